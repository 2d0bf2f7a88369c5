package com.example.auth.service;

import com.example.auth.api.request.LoginRequest;
import com.example.auth.api.request.RegisterRequest;
import com.example.auth.api.response.AccessTokenResponse;
import com.example.auth.api.response.UserProfileResponse;
import com.example.auth.model.UserRecord;
import com.example.auth.token.AccessTokenIssuer;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class AuthService {

  static final String CONTEXT_LOGIN = "Login";
  static final String CONTEXT_REGISTER = "Register";
  static final String CONTEXT_INFO = "Info";

  private static final Logger logger = LoggerFactory.getLogger(AuthService.class);

  private final CredentialStore credentialStore;
  private final PasswordVerifier passwordVerifier;
  private final AccessTokenIssuer accessTokenIssuer;
  private final AuthMetrics authMetrics;

  /**
   * 資格情報が一致した場合のみ署名済みトークンを返す。
   *
   * <p>署名処理の失敗は 401 に丸めずそのまま伝播させる。
   */
  public AccessTokenResponse login(@NonNull LoginRequest request) {
    final Long userId =
        credentialStore
            .loginCheck(request.email(), request.password())
            .orElseThrow(
                () -> {
                  authMetrics.recordLoginResult("rejected");
                  logger.info("login rejected");
                  return new AuthenticationFailedException(CONTEXT_LOGIN);
                });

    final String accessToken = accessTokenIssuer.issue(request.email(), userId);
    authMetrics.recordLoginResult("success");
    logger.info("login succeeded userId={}", userId);
    return new AccessTokenResponse(accessToken);
  }

  public UserProfileResponse register(@NonNull RegisterRequest request) {
    final String passwordHash = passwordVerifier.hash(request.password());
    final UserRecord created;
    try {
      created = credentialStore.create(request.email(), passwordHash, request.name());
    } catch (DuplicateEmailException ex) {
      authMetrics.recordRegistrationResult("duplicate");
      logger.info("registration rejected: email already registered");
      throw new RegistrationFailedException(CONTEXT_REGISTER, ex);
    }
    authMetrics.recordRegistrationResult("success");
    logger.info("user registered userId={}", created.id());
    return toProfile(created);
  }

  /** 検証済みトークンの email で利用者を引く。見つからない場合もログイン失敗と同じ扱い。 */
  public UserProfileResponse info(String email) {
    return credentialStore
        .findByEmail(email)
        .map(this::toProfile)
        .orElseThrow(
            () -> {
              logger.warn("profile lookup missed for a verified token");
              return new AuthenticationFailedException(CONTEXT_INFO);
            });
  }

  private UserProfileResponse toProfile(UserRecord user) {
    return new UserProfileResponse(user.id(), user.email(), user.name(), user.createdAt());
  }
}
