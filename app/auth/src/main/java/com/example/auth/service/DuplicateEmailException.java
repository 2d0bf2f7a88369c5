package com.example.auth.service;

public class DuplicateEmailException extends RuntimeException {
  public DuplicateEmailException(Throwable cause) {
    super("email is already registered", cause);
  }
}
