/*
 * どこで: app/auth/src/main/java/com/example/auth/token/AccessTokenVerifier.java
 * 何を: 提示されたアクセストークンの署名を検証し、主張された利用者を取り出す
 * なぜ: 保護されたエンドポイントへ到達する前に改ざんや不正な構造を弾くため
 */
package com.example.auth.token;

import com.example.auth.token.InvalidAccessTokenException.Reason;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Base64;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * HS256 トークンの検証器。
 *
 * <p>exp クレームは発行されないため有効期限の判定は行わない。署名が一致する限りトークンは有効。
 */
@Component
@SuppressWarnings("EI_EXPOSE_REP2")
public class AccessTokenVerifier {

  private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

  private final TokenSigningKey signingKey;
  private final ObjectMapper objectMapper;

  public AccessTokenVerifier(TokenSigningKey signingKey, ObjectMapper objectMapper) {
    this.signingKey = signingKey;
    this.objectMapper = objectMapper;
  }

  /**
   * @throws InvalidAccessTokenException 構造不正、署名不一致、クレーム不正のいずれか
   */
  public AuthenticatedPrincipal verify(String presentedToken) {
    if (presentedToken == null || presentedToken.isBlank()) {
      throw new InvalidAccessTokenException(Reason.MISSING, "access token is missing");
    }
    final String[] parts = presentedToken.split("\\.", -1);
    if (parts.length != 3 || parts[0].isEmpty() || parts[1].isEmpty() || parts[2].isEmpty()) {
      throw new InvalidAccessTokenException(Reason.MALFORMED, "access token is malformed");
    }

    // 署名検証はデコードより先に行い、未検証のペイロードを解釈しない
    if (!signingKey.matches(parts[0] + "." + parts[1], parts[2])) {
      throw new InvalidAccessTokenException(
          Reason.SIGNATURE_MISMATCH, "access token signature mismatch");
    }

    final JsonNode header = readSegment(parts[0]);
    if (!TokenSigningKey.ALGORITHM.equals(header.path("alg").asText(null))) {
      throw new InvalidAccessTokenException(
          Reason.UNSUPPORTED_ALGORITHM, "access token algorithm is not supported");
    }

    final JsonNode payload = readSegment(parts[1]);
    final JsonNode email = payload.path(AccessTokenIssuer.CLAIM_EMAIL);
    if (!email.isTextual() || email.asText().isBlank()) {
      throw new InvalidAccessTokenException(Reason.INVALID_CLAIMS, "email claim is missing");
    }
    return new AuthenticatedPrincipal(
        email.asText(), readUserId(payload.path(AccessTokenIssuer.CLAIM_USER_ID)));
  }

  // userId: false は旧発行元の「ID なし」表現なので欠落として扱う
  private Optional<Long> readUserId(JsonNode userId) {
    if (userId.isMissingNode() || userId.isNull() || (userId.isBoolean() && !userId.asBoolean())) {
      return Optional.empty();
    }
    if (userId.isIntegralNumber() && userId.canConvertToLong()) {
      return Optional.of(userId.asLong());
    }
    throw new InvalidAccessTokenException(Reason.INVALID_CLAIMS, "userId claim is invalid");
  }

  private JsonNode readSegment(String segment) {
    final JsonNode node;
    try {
      node = objectMapper.readTree(DECODER.decode(segment));
    } catch (IllegalArgumentException | IOException e) {
      throw new InvalidAccessTokenException(
          Reason.MALFORMED, "access token segment is not valid base64url JSON", e);
    }
    if (node == null || !node.isObject()) {
      throw new InvalidAccessTokenException(
          Reason.MALFORMED, "access token segment is not a JSON object");
    }
    return node;
  }
}
