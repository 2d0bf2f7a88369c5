/*
 * どこで: app/auth/src/main/java/com/example/auth/api/response/UserProfileResponse.java
 * 何を: register/info の出力 DTO
 * なぜ: パスワードハッシュを含まない公開プロフィールだけを契約として返すため
 */
package com.example.auth.api.response;

import java.time.Instant;

public record UserProfileResponse(
        long id,
        String email,
        String name,
        Instant createdAt) {
}
