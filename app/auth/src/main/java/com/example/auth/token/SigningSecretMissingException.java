package com.example.auth.token;

public class SigningSecretMissingException extends RuntimeException {
  public SigningSecretMissingException() {
    super("token signing secret is not configured (auth.token.secret / SECRET)");
  }
}
