package com.example.auth.model;

import java.time.Instant;

public record NewUser(String email, String passwordHash, String name, Instant createdAt) {

  @Override
  public String toString() {
    return "NewUser[email=" + email + ", name=" + name + ", createdAt=" + createdAt + "]";
  }
}
