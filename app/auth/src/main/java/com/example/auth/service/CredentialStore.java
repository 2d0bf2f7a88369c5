/*
 * どこで: app/auth/src/main/java/com/example/auth/service/CredentialStore.java
 * 何を: ユーザーレコードの参照/作成とログイン照合を提供する
 * なぜ: 資格情報を扱う処理を Repository の上に一枚で集約し、呼び出し側から保存形式を隠すため
 */
package com.example.auth.service;

import com.example.auth.model.NewUser;
import com.example.auth.model.UserRecord;
import com.example.auth.repository.UserRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

@Service
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class CredentialStore {

  private final UserRepository userRepository;
  private final PasswordVerifier passwordVerifier;
  private final Clock clock;

  public Optional<UserRecord> findByEmail(String email) {
    if (email == null || email.isBlank()) {
      return Optional.empty();
    }
    return userRepository.findByEmail(email);
  }

  /**
   * 重複判定は DB の一意制約に任せる。同一 email の同時登録は片方だけが成功する。
   *
   * @throws DuplicateEmailException email が登録済みの場合
   */
  public UserRecord create(String email, String passwordHash, String name) {
    final NewUser user = new NewUser(email, passwordHash, name, Instant.now(clock));
    try {
      return userRepository.insert(user);
    } catch (DuplicateKeyException ex) {
      throw new DuplicateEmailException(ex);
    }
  }

  /**
   * email と生パスワードを照合し、一致すればユーザー ID を返す。
   *
   * <p>未登録 email とパスワード不一致はどちらも空を返し、呼び出し側から区別できない。
   */
  public Optional<Long> loginCheck(String email, String rawPassword) {
    final Optional<UserRecord> user = findByEmail(email);
    if (user.isEmpty()) {
      passwordVerifier.verifyAgainstDecoy(rawPassword);
      return Optional.empty();
    }
    if (!passwordVerifier.verify(rawPassword, user.get().passwordHash())) {
      return Optional.empty();
    }
    return Optional.of(user.get().id());
  }
}
