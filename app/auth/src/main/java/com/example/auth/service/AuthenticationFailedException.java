package com.example.auth.service;

/**
 * 資格情報の不一致、または保護された参照で利用者が見つからなかったことを表す。
 *
 * <p>email 未登録とパスワード不一致を区別しないため、メッセージは常に同じ。
 */
public class AuthenticationFailedException extends RuntimeException {

  public static final String MESSAGE = "Authorization error";

  private final String context;

  public AuthenticationFailedException(String context) {
    super(MESSAGE);
    this.context = context;
  }

  public String context() {
    return context;
  }
}
