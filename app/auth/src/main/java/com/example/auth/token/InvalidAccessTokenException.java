package com.example.auth.token;

public class InvalidAccessTokenException extends RuntimeException {

  public enum Reason {
    MISSING,
    MALFORMED,
    SIGNATURE_MISMATCH,
    UNSUPPORTED_ALGORITHM,
    INVALID_CLAIMS
  }

  private final Reason reason;

  public InvalidAccessTokenException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public InvalidAccessTokenException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
