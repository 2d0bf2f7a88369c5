/*
 * どこで: app/auth/src/main/java/com/example/auth/model/UserRecord.java
 * 何を: users テーブル相当のドメインレコード
 * なぜ: Repository/Service 間で資格情報を含むユーザー情報の受け渡しを明確にするため
 */
package com.example.auth.model;

import java.time.Instant;

public record UserRecord(
        long id,
        String email,
        String passwordHash,
        String name,
        Instant createdAt) {

    // passwordHash をログへ出さない
    @Override
    public String toString() {
        return "UserRecord[id=" + id + ", email=" + email + ", name=" + name
                + ", createdAt=" + createdAt + "]";
    }
}
