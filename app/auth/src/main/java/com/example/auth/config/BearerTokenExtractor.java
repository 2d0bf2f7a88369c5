package com.example.auth.config;

import java.util.Locale;
import java.util.Optional;

/** {@code Authorization: Bearer <token>} からトークン文字列だけを取り出す。 */
public final class BearerTokenExtractor {

  private static final String PREFIX = "bearer";

  private BearerTokenExtractor() {}

  public static Optional<String> extract(String authorizationHeader) {
    if (authorizationHeader == null || authorizationHeader.isBlank()) {
      return Optional.empty();
    }
    final String trimmed = authorizationHeader.strip();
    if (trimmed.length() <= PREFIX.length()
        || !trimmed.substring(0, PREFIX.length()).toLowerCase(Locale.ROOT).equals(PREFIX)
        || !Character.isWhitespace(trimmed.charAt(PREFIX.length()))) {
      return Optional.empty();
    }
    final String token = trimmed.substring(PREFIX.length()).strip();
    return token.isEmpty() ? Optional.empty() : Optional.of(token);
  }
}
