package com.example.auth.token;

import java.security.Principal;
import java.util.Optional;

/**
 * 検証済みアクセストークンが主張する利用者。1 リクエストの間だけ SecurityContext に載る。
 *
 * <p>userId は旧形式のトークンで欠落し得るため Optional で持つ。
 */
public record AuthenticatedPrincipal(String email, Optional<Long> userId) implements Principal {

  public AuthenticatedPrincipal {
    if (email == null || email.isBlank()) {
      throw new IllegalArgumentException("email is required");
    }
    userId = userId == null ? Optional.empty() : userId;
  }

  @Override
  public String getName() {
    return email;
  }
}
