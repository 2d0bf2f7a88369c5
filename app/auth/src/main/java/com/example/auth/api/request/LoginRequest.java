/*
 * どこで: app/auth/src/main/java/com/example/auth/api/request/LoginRequest.java
 * 何を: POST /users/login の入力 DTO
 * なぜ: 形式チェックを API 境界で済ませ、認証ロジックが型の整った入力だけを扱えるようにするため
 */
package com.example.auth.api.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

public record LoginRequest(
        @NotBlank @Email String email,
        @NotBlank String password) {

    @Override
    public String toString() {
        return "LoginRequest[email=" + email + "]";
    }
}
