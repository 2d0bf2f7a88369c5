/*
 * どこで: app/auth/src/main/java/com/example/auth/api/AuthUserController.java
 * 何を: ログイン/登録/プロフィール参照 API を提供するコントローラー
 * なぜ: 認証の入口を /users 配下にまとめ、業務判断を AuthService へ委ねるため
 */
package com.example.auth.api;

import com.example.auth.api.request.LoginRequest;
import com.example.auth.api.request.RegisterRequest;
import com.example.auth.api.response.AccessTokenResponse;
import com.example.auth.api.response.UserProfileResponse;
import com.example.auth.service.AuthService;
import com.example.auth.token.AuthenticatedPrincipal;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users")
public class AuthUserController {

    private final AuthService authService;

    public AuthUserController(AuthService authService) {
        this.authService = authService;
    }

    /**
     * 役割:
     * - email/password を照合し、成功時にアクセストークンを返す。
     *
     * 期待動作:
     * - 未登録 email とパスワード不一致は同じ 401 応答になる。
     */
    @PostMapping("/login")
    public ResponseEntity<AccessTokenResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    /**
     * 役割:
     * - 新規アカウントを作成し、公開プロフィールを返す。
     *
     * 期待動作:
     * - email 重複は 422 とする。
     */
    @PostMapping("/register")
    public ResponseEntity<UserProfileResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.ok(authService.register(request));
    }

    /**
     * 役割:
     * - Bearer トークンで認証済みの利用者自身のプロフィールを返す。
     *
     * 期待動作:
     * - 認証は BearerTokenAuthenticationFilter で済んでいる前提とする。
     */
    @GetMapping("/info")
    public ResponseEntity<UserProfileResponse> info(
            @AuthenticationPrincipal AuthenticatedPrincipal principal) {
        return ResponseEntity.ok(authService.info(principal.email()));
    }
}
