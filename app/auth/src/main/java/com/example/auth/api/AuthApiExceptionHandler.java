/*
 * どこで: app/auth/src/main/java/com/example/auth/api/AuthApiExceptionHandler.java
 * 何を: Auth API の例外を標準エラー形式へ変換する
 * なぜ: 失敗時の契約を一定に保ち、アカウントの存在有無を応答から読み取らせないため
 */
package com.example.auth.api;

import com.example.auth.service.AuthenticationFailedException;
import com.example.auth.service.RegistrationFailedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class AuthApiExceptionHandler {

    static final String CODE_AUTHORIZATION_ERROR = "AUTHORIZATION_ERROR";
    static final String CODE_REGISTRATION_ERROR = "REGISTRATION_ERROR";
    static final String CODE_VALIDATION_ERROR = "VALIDATION_ERROR";

    @ExceptionHandler(AuthenticationFailedException.class)
    public ResponseEntity<ApiErrorResponse> handleAuthenticationFailed(
            AuthenticationFailedException ex) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .body(new ApiErrorResponse(CODE_AUTHORIZATION_ERROR, ex.getMessage(), ex.context()));
    }

    @ExceptionHandler(RegistrationFailedException.class)
    public ResponseEntity<ApiErrorResponse> handleRegistrationFailed(
            RegistrationFailedException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ApiErrorResponse(CODE_REGISTRATION_ERROR, ex.getMessage(), ex.context()));
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiErrorResponse> handleValidation(Exception ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ApiErrorResponse(CODE_VALIDATION_ERROR, "request validation failed", null));
    }
}
