package com.example.auth.service;

public class RegistrationFailedException extends RuntimeException {

  public static final String MESSAGE = "Registration error";

  private final String context;

  public RegistrationFailedException(String context, Throwable cause) {
    super(MESSAGE, cause);
    this.context = context;
  }

  public String context() {
    return context;
  }
}
