/*
 * どこで: app/auth/src/main/java/com/example/auth/service/PasswordVerifier.java
 * 何を: 生パスワードのハッシュ化と照合を行う
 * なぜ: BCrypt の設定と照合ルールを一箇所に閉じ込めるため
 */
package com.example.auth.service;

import java.nio.charset.StandardCharsets;
import java.util.UUID;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

@Component
@SuppressWarnings("EI_EXPOSE_REP2")
public class PasswordVerifier {

  /** BCrypt はこのバイト数より後ろを照合に使わない。 */
  public static final int MAX_PASSWORD_BYTES = 72;

  private final PasswordEncoder passwordEncoder;
  private final String decoyHash;

  public PasswordVerifier(PasswordEncoder passwordEncoder) {
    this.passwordEncoder = passwordEncoder;
    this.decoyHash = passwordEncoder.encode(UUID.randomUUID().toString());
  }

  /** ソルト付きの一方向ハッシュを返す。生パスワードは保持しない。 */
  public String hash(String rawPassword) {
    if (rawPassword == null || rawPassword.isEmpty()) {
      throw new IllegalArgumentException("password is required");
    }
    if (!fitsHashInput(rawPassword)) {
      throw new IllegalArgumentException("password exceeds " + MAX_PASSWORD_BYTES + " bytes");
    }
    return passwordEncoder.encode(rawPassword);
  }

  /** 上限を超えるパスワードは先頭 72 バイトだけで一致し得るため、常に false を返す。 */
  public boolean verify(String rawPassword, String passwordHash) {
    if (rawPassword == null || passwordHash == null || passwordHash.isBlank()) {
      return false;
    }
    if (!fitsHashInput(rawPassword)) {
      return verifyAgainstDecoy(rawPassword);
    }
    return passwordEncoder.matches(rawPassword, passwordHash);
  }

  /**
   * 存在しない利用者に対しても同じコストの照合を行い、応答時間から登録有無を推測させない。
   * 結果は常に false。
   */
  public boolean verifyAgainstDecoy(String rawPassword) {
    passwordEncoder.matches(
        rawPassword == null || !fitsHashInput(rawPassword) ? "" : rawPassword, decoyHash);
    return false;
  }

  /** UTF-8 で {@value #MAX_PASSWORD_BYTES} バイト以内なら true。 */
  public static boolean fitsHashInput(String rawPassword) {
    return rawPassword == null
        || rawPassword.getBytes(StandardCharsets.UTF_8).length <= MAX_PASSWORD_BYTES;
  }
}
