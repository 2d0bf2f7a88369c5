package com.example.auth.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.auth.api.request.LoginRequest;
import com.example.auth.api.request.RegisterRequest;
import com.example.auth.api.response.AccessTokenResponse;
import com.example.auth.api.response.UserProfileResponse;
import com.example.auth.model.UserRecord;
import com.example.auth.token.AccessTokenIssuer;
import com.example.auth.token.SigningSecretMissingException;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

  private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

  @Mock private CredentialStore credentialStore;
  @Mock private PasswordVerifier passwordVerifier;
  @Mock private AccessTokenIssuer accessTokenIssuer;
  @Mock private AuthMetrics authMetrics;

  @InjectMocks private AuthService service;

  @Test
  void loginReturnsSignedTokenWhenCredentialsMatch() {
    when(credentialStore.loginCheck("a@x.com", "p1")).thenReturn(Optional.of(3L));
    when(accessTokenIssuer.issue("a@x.com", 3L)).thenReturn("h.p.s");

    final AccessTokenResponse response = service.login(new LoginRequest("a@x.com", "p1"));

    assertThat(response.accessToken()).isEqualTo("h.p.s");
    verify(authMetrics).recordLoginResult("success");
  }

  @Test
  void loginFailsWithoutIssuingTokenWhenCredentialsDoNotMatch() {
    when(credentialStore.loginCheck("a@x.com", "wrong")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.login(new LoginRequest("a@x.com", "wrong")))
        .isInstanceOfSatisfying(
            AuthenticationFailedException.class,
            ex -> {
              assertThat(ex.getMessage()).isEqualTo("Authorization error");
              assertThat(ex.context()).isEqualTo("Login");
            });
    verify(accessTokenIssuer, never()).issue(anyString(), anyLong());
    verify(authMetrics).recordLoginResult("rejected");
  }

  @Test
  void loginPropagatesSigningFailures() {
    when(credentialStore.loginCheck("a@x.com", "p1")).thenReturn(Optional.of(3L));
    when(accessTokenIssuer.issue("a@x.com", 3L)).thenThrow(new SigningSecretMissingException());

    assertThatThrownBy(() -> service.login(new LoginRequest("a@x.com", "p1")))
        .isInstanceOf(SigningSecretMissingException.class);
  }

  @Test
  void registerHashesPasswordAndReturnsPublicProfile() {
    when(passwordVerifier.hash("p1")).thenReturn("hashed");
    when(credentialStore.create("a@x.com", "hashed", "A"))
        .thenReturn(new UserRecord(1L, "a@x.com", "hashed", "A", NOW));

    final UserProfileResponse profile =
        service.register(new RegisterRequest("a@x.com", "p1", "A"));

    assertThat(profile).isEqualTo(new UserProfileResponse(1L, "a@x.com", "A", NOW));
    verify(authMetrics).recordRegistrationResult("success");
  }

  @Test
  void registerFailsWhenEmailAlreadyExists() {
    when(passwordVerifier.hash("p2")).thenReturn("hashed");
    when(credentialStore.create("a@x.com", "hashed", null))
        .thenThrow(new DuplicateEmailException(new DuplicateKeyException("dup")));

    assertThatThrownBy(() -> service.register(new RegisterRequest("a@x.com", "p2", null)))
        .isInstanceOfSatisfying(
            RegistrationFailedException.class,
            ex -> {
              assertThat(ex.getMessage()).isEqualTo("Registration error");
              assertThat(ex.context()).isEqualTo("Register");
            });
    verify(authMetrics).recordRegistrationResult("duplicate");
  }

  @Test
  void infoReturnsProfileForExistingUser() {
    when(credentialStore.findByEmail("a@x.com"))
        .thenReturn(Optional.of(new UserRecord(1L, "a@x.com", "hashed", "A", NOW)));

    assertThat(service.info("a@x.com").email()).isEqualTo("a@x.com");
  }

  @Test
  void infoFailsAsAuthenticationErrorWhenUserIsGone() {
    when(credentialStore.findByEmail("gone@x.com")).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.info("gone@x.com"))
        .isInstanceOfSatisfying(
            AuthenticationFailedException.class,
            ex -> assertThat(ex.context()).isEqualTo("Info"));
  }
}
