/*
 * どこで: app/auth/src/main/java/com/example/auth/api/ApiErrorResponse.java
 * 何を: API エラー応答の共通 DTO
 * なぜ: エラー形式を統一し、呼び出し側で機械的に処理できるようにするため
 */
package com.example.auth.api;

public record ApiErrorResponse(
        String code,
        String message,
        String context) {
}
