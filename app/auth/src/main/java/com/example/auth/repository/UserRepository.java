package com.example.auth.repository;

import com.example.auth.model.NewUser;
import com.example.auth.model.UserRecord;
import com.example.common.JdbcTimestampUtils;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@SuppressWarnings("EI_EXPOSE_REP2")
@RequiredArgsConstructor
public class UserRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<UserRecord> findByEmail(String email) {
    final String sql =
        """
        SELECT id, email, password_hash, name, created_at
        FROM users
        WHERE email = :email
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("email", email);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * users.email の UNIQUE 制約で重複を弾く。
   *
   * @throws org.springframework.dao.DuplicateKeyException email が登録済みの場合
   */
  public UserRecord insert(NewUser user) {
    final String sql =
        """
        INSERT INTO users (email, password_hash, name, created_at)
        VALUES (:email, :passwordHash, :name, :createdAt)
        RETURNING id, email, password_hash, name, created_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("email", user.email())
            .addValue("passwordHash", user.passwordHash())
            .addValue("name", user.name())
            .addValue("createdAt", JdbcTimestampUtils.toTimestamp(user.createdAt()));
    return jdbcTemplate.queryForObject(sql, params, this::mapRow);
  }

  private UserRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserRecord(
        rs.getLong("id"),
        rs.getString("email"),
        rs.getString("password_hash"),
        rs.getString("name"),
        JdbcTimestampUtils.toInstant(rs.getTimestamp("created_at")));
  }
}
