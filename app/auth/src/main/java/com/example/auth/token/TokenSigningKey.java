/*
 * どこで: app/auth/src/main/java/com/example/auth/token/TokenSigningKey.java
 * 何を: HS256 の署名鍵を保持し、署名の計算と照合を行う
 * なぜ: 発行側と検証側で同じ鍵と同じ比較方法を共有するため
 */
package com.example.auth.token;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

public final class TokenSigningKey {

  static final String ALGORITHM = "HS256";
  private static final String MAC_ALGORITHM = "HmacSHA256";
  private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

  private final byte[] secret;

  private TokenSigningKey(byte[] secret) {
    this.secret = secret;
  }

  public static TokenSigningKey fromSecret(String secret) {
    if (secret == null || secret.isEmpty()) {
      throw new SigningSecretMissingException();
    }
    return new TokenSigningKey(secret.getBytes(StandardCharsets.UTF_8));
  }

  /** base64url(HMAC-SHA256(signingInput)) をパディングなしで返す。 */
  public String signatureOf(String signingInput) {
    return ENCODER.encodeToString(mac().doFinal(signingInput.getBytes(StandardCharsets.UTF_8)));
  }

  /** 再計算した署名と提示された署名を定数時間で比較する。 */
  public boolean matches(String signingInput, String presentedSignature) {
    if (presentedSignature == null) {
      return false;
    }
    final byte[] expected = signatureOf(signingInput).getBytes(StandardCharsets.UTF_8);
    final byte[] actual = presentedSignature.getBytes(StandardCharsets.UTF_8);
    return MessageDigest.isEqual(expected, actual);
  }

  // Mac はスレッドセーフではないため呼び出しごとに生成する
  private Mac mac() {
    try {
      final Mac mac = Mac.getInstance(MAC_ALGORITHM);
      mac.init(new SecretKeySpec(secret, MAC_ALGORITHM));
      return mac;
    } catch (NoSuchAlgorithmException | InvalidKeyException e) {
      throw new IllegalStateException("failed to initialize " + MAC_ALGORITHM, e);
    }
  }

  @Override
  public String toString() {
    return "TokenSigningKey[algorithm=" + ALGORITHM + ", length=" + secret.length + "]";
  }
}
