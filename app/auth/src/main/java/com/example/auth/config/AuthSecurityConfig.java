package com.example.auth.config;

import com.example.auth.api.ApiErrorResponse;
import com.example.auth.service.AuthMetrics;
import com.example.auth.service.AuthenticationFailedException;
import com.example.auth.token.AccessTokenVerifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.intercept.AuthorizationFilter;

@Configuration
@Import(AuthTokenConfig.class)
public class AuthSecurityConfig {

  static final String ACCESS_GUARD_CONTEXT = "AccessGuard";

  @Bean
  BearerTokenAuthenticationFilter bearerTokenAuthenticationFilter(
      AuthTokenProperties properties,
      AccessTokenVerifier accessTokenVerifier,
      AuthMetrics authMetrics) {
    return new BearerTokenAuthenticationFilter(properties, accessTokenVerifier, authMetrics);
  }

  @Bean
  AuthenticationEntryPoint authenticationEntryPoint(ObjectMapper objectMapper) {
    return (request, response, authException) -> {
      response.setStatus(HttpStatus.UNAUTHORIZED.value());
      response.setContentType(MediaType.APPLICATION_JSON_VALUE);
      objectMapper.writeValue(
          response.getOutputStream(),
          new ApiErrorResponse(
              "AUTHORIZATION_ERROR", AuthenticationFailedException.MESSAGE, ACCESS_GUARD_CONTEXT));
    };
  }

  @Bean
  SecurityFilterChain securityFilterChain(
      HttpSecurity http,
      BearerTokenAuthenticationFilter bearerTokenAuthenticationFilter,
      AuthenticationEntryPoint authenticationEntryPoint)
      throws Exception {
    http.csrf(csrf -> csrf.disable())
        .httpBasic(basic -> basic.disable())
        .formLogin(form -> form.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .addFilterBefore(bearerTokenAuthenticationFilter, AuthorizationFilter.class)
        .exceptionHandling(ex -> ex.authenticationEntryPoint(authenticationEntryPoint))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/",
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    .requestMatchers(HttpMethod.POST, "/users/login", "/users/register")
                    .permitAll()
                    .requestMatchers(HttpMethod.GET, "/users/info")
                    .hasRole("USER")
                    .anyRequest()
                    .authenticated());
    return http.build();
  }
}
