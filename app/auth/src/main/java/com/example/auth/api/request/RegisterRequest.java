/*
 * どこで: app/auth/src/main/java/com/example/auth/api/request/RegisterRequest.java
 * 何を: POST /users/register の入力 DTO
 * なぜ: 新規アカウントに必要な項目を API 境界で明示するため
 */
package com.example.auth.api.request;

import com.example.auth.service.PasswordVerifier;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RegisterRequest(
        @NotBlank @Email @Size(max = 320) String email,
        @NotBlank @Size(max = 72) String password,
        @Size(max = 100) String name) {

    @JsonIgnore
    @AssertTrue(message = "password must be at most 72 bytes in UTF-8")
    public boolean isPasswordWithinHashLimit() {
        return PasswordVerifier.fitsHashInput(password);
    }

    @Override
    public String toString() {
        return "RegisterRequest[email=" + email + ", name=" + name + "]";
    }
}
