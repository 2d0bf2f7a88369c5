package com.example.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "auth.token")
public record AuthTokenProperties(String secret, String headerName) {

  public AuthTokenProperties {
    secret = secret == null ? "" : secret;
    headerName = headerName == null || headerName.isBlank() ? "Authorization" : headerName;
  }

  @Override
  public String toString() {
    return "AuthTokenProperties[secret=***, headerName=" + headerName + "]";
  }
}
