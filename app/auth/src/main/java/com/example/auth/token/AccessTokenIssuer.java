/*
 * どこで: app/auth/src/main/java/com/example/auth/token/AccessTokenIssuer.java
 * 何を: email/userId/iat を主張する HS256 署名付きアクセストークンを発行する
 * なぜ: ログイン成功後のステートレスな認証情報を一箇所で組み立てるため
 */
package com.example.auth.token;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
@SuppressWarnings("EI_EXPOSE_REP2")
public class AccessTokenIssuer {

  static final String CLAIM_EMAIL = "email";
  static final String CLAIM_USER_ID = "userId";
  static final String CLAIM_ISSUED_AT = "iat";

  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

  private final TokenSigningKey signingKey;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final String encodedHeader;

  public AccessTokenIssuer(TokenSigningKey signingKey, ObjectMapper objectMapper, Clock clock) {
    this.signingKey = signingKey;
    this.objectMapper = objectMapper;
    this.clock = clock;
    final Map<String, Object> header = new LinkedHashMap<>();
    header.put("alg", TokenSigningKey.ALGORITHM);
    header.put("typ", "JWT");
    this.encodedHeader = encode(header);
  }

  /**
   * 署名済みトークンを返す。exp/aud/iss は付与しない。
   *
   * @param email ログインに使われた email
   * @param userId 認証済みユーザーの ID
   */
  public String issue(String email, long userId) {
    if (email == null || email.isBlank()) {
      throw new IllegalArgumentException("email is required");
    }
    final Map<String, Object> claims = new LinkedHashMap<>();
    claims.put(CLAIM_EMAIL, email);
    claims.put(CLAIM_USER_ID, userId);
    claims.put(CLAIM_ISSUED_AT, clock.instant().getEpochSecond());

    final String signingInput = encodedHeader + "." + encode(claims);
    return signingInput + "." + signingKey.signatureOf(signingInput);
  }

  private String encode(Map<String, Object> json) {
    try {
      return ENCODER.encodeToString(objectMapper.writeValueAsBytes(json));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("failed to serialize token segment", e);
    }
  }
}
