/*
 * どこで: Auth トークン設定
 * 何を: 署名鍵と BCrypt の PasswordEncoder を Bean 化する
 * なぜ: 署名用シークレット未設定のまま起動し、弱い鍵でトークンを発行する事態を起動時に止めるため
 */
package com.example.auth.config;

import com.example.auth.token.TokenSigningKey;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@Configuration
@EnableConfigurationProperties({AuthTokenProperties.class, AuthPasswordProperties.class})
public class AuthTokenConfig {

  @Bean
  TokenSigningKey tokenSigningKey(AuthTokenProperties properties) {
    return TokenSigningKey.fromSecret(properties.secret());
  }

  @Bean
  PasswordEncoder passwordEncoder(AuthPasswordProperties properties) {
    return new BCryptPasswordEncoder(properties.bcryptStrength());
  }
}
