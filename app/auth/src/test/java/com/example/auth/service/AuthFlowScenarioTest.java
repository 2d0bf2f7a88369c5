package com.example.auth.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;

import com.example.auth.api.request.LoginRequest;
import com.example.auth.api.request.RegisterRequest;
import com.example.auth.api.response.UserProfileResponse;
import com.example.auth.model.NewUser;
import com.example.auth.model.UserRecord;
import com.example.auth.repository.UserRepository;
import com.example.auth.token.AccessTokenIssuer;
import com.example.auth.token.AccessTokenVerifier;
import com.example.auth.token.AuthenticatedPrincipal;
import com.example.auth.token.InvalidAccessTokenException;
import com.example.auth.token.TokenSigningKey;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

/** 実際のハッシュ化と署名を通した register → login → info の一連の流れを確認する。 */
class AuthFlowScenarioTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

  private final Map<String, UserRecord> users = new ConcurrentHashMap<>();
  private final ObjectMapper objectMapper = new ObjectMapper();
  private final TokenSigningKey signingKey = TokenSigningKey.fromSecret("scenario-secret");

  private AuthService authService;
  private AccessTokenVerifier accessTokenVerifier;

  @BeforeEach
  void setUp() {
    final UserRepository userRepository = mock(UserRepository.class);
    final AtomicLong sequence = new AtomicLong();
    lenient()
        .when(userRepository.findByEmail(anyString()))
        .thenAnswer(invocation -> Optional.ofNullable(users.get(invocation.<String>getArgument(0))));
    lenient()
        .when(userRepository.insert(any(NewUser.class)))
        .thenAnswer(
            invocation -> {
              final NewUser user = invocation.getArgument(0);
              final UserRecord record =
                  new UserRecord(
                      sequence.incrementAndGet(),
                      user.email(),
                      user.passwordHash(),
                      user.name(),
                      user.createdAt());
              if (users.putIfAbsent(user.email(), record) != null) {
                throw new DuplicateKeyException("uq_users_email");
              }
              return record;
            });

    final PasswordVerifier passwordVerifier = new PasswordVerifier(new BCryptPasswordEncoder(4));
    final CredentialStore credentialStore =
        new CredentialStore(userRepository, passwordVerifier, CLOCK);
    authService =
        new AuthService(
            credentialStore,
            passwordVerifier,
            new AccessTokenIssuer(signingKey, objectMapper, CLOCK),
            new AuthMetrics(new SimpleMeterRegistry()));
    accessTokenVerifier = new AccessTokenVerifier(signingKey, objectMapper);
  }

  @Test
  void registerLoginAndReadProfile() {
    final UserProfileResponse registered =
        authService.register(new RegisterRequest("a@x.com", "p1", null));
    assertThat(registered.email()).isEqualTo("a@x.com");
    assertThat(users.get("a@x.com").passwordHash()).isNotEqualTo("p1");

    final String token = authService.login(new LoginRequest("a@x.com", "p1")).accessToken();
    final AuthenticatedPrincipal principal = accessTokenVerifier.verify(token);
    assertThat(principal.email()).isEqualTo("a@x.com");
    assertThat(principal.userId()).contains(registered.id());

    assertThat(authService.info(principal.email())).isEqualTo(registered);
  }

  @Test
  void wrongPasswordAndUnknownEmailFailIdentically() {
    authService.register(new RegisterRequest("a@x.com", "p1", null));

    final Throwable wrongPassword =
        catchThrowable(
            () -> authService.login(new LoginRequest("a@x.com", "wrong")));
    final Throwable unknownEmail =
        catchThrowable(
            () -> authService.login(new LoginRequest("nobody@x.com", "p1")));

    assertThat(wrongPassword).isInstanceOf(AuthenticationFailedException.class);
    assertThat(unknownEmail).isInstanceOf(AuthenticationFailedException.class);
    assertThat(wrongPassword.getMessage()).isEqualTo(unknownEmail.getMessage());
    assertThat(((AuthenticationFailedException) wrongPassword).context())
        .isEqualTo(((AuthenticationFailedException) unknownEmail).context());
  }

  @Test
  void secondRegistrationWithSameEmailFailsAndKeepsFirstAccount() {
    authService.register(new RegisterRequest("a@x.com", "p1", "first"));

    assertThatThrownBy(() -> authService.register(new RegisterRequest("a@x.com", "p2", "second")))
        .isInstanceOf(RegistrationFailedException.class);

    assertThat(users.get("a@x.com").name()).isEqualTo("first");
    assertThat(authService.login(new LoginRequest("a@x.com", "p1")).accessToken()).isNotBlank();
    assertThatThrownBy(() -> authService.login(new LoginRequest("a@x.com", "p2")))
        .isInstanceOf(AuthenticationFailedException.class);
  }

  @Test
  void infoFailsWhenTokenOutlivesItsUser() {
    authService.register(new RegisterRequest("a@x.com", "p1", null));
    final String token = authService.login(new LoginRequest("a@x.com", "p1")).accessToken();
    users.clear();

    final AuthenticatedPrincipal principal = accessTokenVerifier.verify(token);

    assertThatThrownBy(() -> authService.info(principal.email()))
        .isInstanceOf(AuthenticationFailedException.class);
  }

  @Test
  void tokenFromAnotherDeploymentIsRejected() {
    authService.register(new RegisterRequest("a@x.com", "p1", null));
    final String token = authService.login(new LoginRequest("a@x.com", "p1")).accessToken();

    final AccessTokenVerifier otherVerifier =
        new AccessTokenVerifier(TokenSigningKey.fromSecret("other-secret"), objectMapper);

    assertThatThrownBy(() -> otherVerifier.verify(token))
        .isInstanceOf(InvalidAccessTokenException.class);
  }
}
