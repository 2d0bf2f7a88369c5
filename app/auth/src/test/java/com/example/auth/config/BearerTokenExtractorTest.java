package com.example.auth.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class BearerTokenExtractorTest {

  @Test
  void extractsTokenFromBearerHeader() {
    assertThat(BearerTokenExtractor.extract("Bearer h.p.s")).contains("h.p.s");
    assertThat(BearerTokenExtractor.extract("  bearer   h.p.s  ")).contains("h.p.s");
  }

  @Test
  void ignoresMissingOrForeignSchemes() {
    assertThat(BearerTokenExtractor.extract(null)).isEmpty();
    assertThat(BearerTokenExtractor.extract("")).isEmpty();
    assertThat(BearerTokenExtractor.extract("Bearer")).isEmpty();
    assertThat(BearerTokenExtractor.extract("Bearer    ")).isEmpty();
    assertThat(BearerTokenExtractor.extract("Bearerh.p.s")).isEmpty();
    assertThat(BearerTokenExtractor.extract("Basic dXNlcjpwYXNz")).isEmpty();
  }
}
