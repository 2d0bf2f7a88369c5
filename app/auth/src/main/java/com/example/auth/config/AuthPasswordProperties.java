package com.example.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "auth.password")
public record AuthPasswordProperties(Integer bcryptStrength) {

  public static final int DEFAULT_BCRYPT_STRENGTH = 10;

  public AuthPasswordProperties {
    bcryptStrength = bcryptStrength == null ? DEFAULT_BCRYPT_STRENGTH : bcryptStrength;
    if (bcryptStrength < 4 || bcryptStrength > 31) {
      throw new IllegalArgumentException("auth.password.bcrypt-strength must be between 4 and 31");
    }
  }
}
