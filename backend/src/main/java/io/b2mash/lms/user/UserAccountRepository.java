package io.b2mash.lms.user;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.b2mash.lms.security.Role;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

/** User accounts in the directory database, shared by all tenants. */
@Repository
public class UserAccountRepository {

  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
  private static final TypeReference<LinkedHashMap<String, String>> STRING_MAP =
      new TypeReference<>() {};

  private static final String SELECT_COLUMNS =
      """
      SELECT id, email, password_hash, first_name, last_name, avatar_url, phone_number,
             job_title, bio, timezone, locale, social_links, notify_email, notify_sms,
             notify_push, marketing_opt_in, last_login_at, last_password_changed_at,
             roles, status, tenant_id, created_at, updated_at
      FROM users
      """;

  private final JdbcClient jdbc;
  private final ObjectMapper objectMapper;

  public UserAccountRepository(
      @Qualifier("directoryJdbcClient") JdbcClient jdbc, ObjectMapper objectMapper) {
    this.jdbc = jdbc;
    this.objectMapper = objectMapper;
  }

  private static Timestamp toTimestamp(Instant instant) {
    return instant != null ? Timestamp.from(instant) : null;
  }

  private static Instant toInstant(Timestamp timestamp) {
    return timestamp != null ? timestamp.toInstant() : null;
  }

  public Optional<UserAccount> findById(UUID id) {
    return jdbc.sql(SELECT_COLUMNS + " WHERE id = ?").params(id).query(this::mapRow).optional();
  }

  public Optional<UserAccount> findByEmail(String email) {
    return jdbc.sql(SELECT_COLUMNS + " WHERE email = ?")
        .params(email)
        .query(this::mapRow)
        .optional();
  }

  public boolean existsByEmail(String email) {
    return jdbc.sql("SELECT COUNT(*) FROM users WHERE email = ?")
            .params(email)
            .query(Long.class)
            .single()
        > 0;
  }

  public UserAccount insert(
      String email,
      String passwordHash,
      String firstName,
      String lastName,
      List<Role> roles,
      String tenantId) {
    UUID id = UUID.randomUUID();
    jdbc.sql(
            """
            INSERT INTO users
                (id, email, password_hash, first_name, last_name, roles, status, tenant_id,
                 created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, CAST(? AS jsonb), ?, ?, now(), now())
            """)
        .params(
            id,
            email,
            passwordHash,
            firstName,
            lastName,
            toJson(Role.wireNames(roles)),
            UserStatus.ACTIVE.name(),
            tenantId)
        .update();
    return findById(id).orElseThrow();
  }

  public void updateProfile(UserAccount user) {
    jdbc.sql(
            """
            UPDATE users
            SET first_name = ?, last_name = ?, avatar_url = ?, phone_number = ?, job_title = ?,
                bio = ?, timezone = ?, locale = ?, social_links = CAST(? AS jsonb),
                updated_at = now()
            WHERE id = ?
            """)
        .params(
            user.firstName(),
            user.lastName(),
            user.avatarUrl(),
            user.phoneNumber(),
            user.jobTitle(),
            user.bio(),
            user.timezone(),
            user.locale(),
            toJson(user.socialLinks()),
            user.id())
        .update();
  }

  public void updatePreferences(
      UUID id, NotificationPreferences preferences, boolean marketingOptIn) {
    jdbc.sql(
            """
            UPDATE users
            SET notify_email = ?, notify_sms = ?, notify_push = ?, marketing_opt_in = ?,
                updated_at = now()
            WHERE id = ?
            """)
        .params(
            preferences.email(), preferences.sms(), preferences.push(), marketingOptIn, id)
        .update();
  }

  public void updatePassword(UUID id, String passwordHash, Instant changedAt) {
    jdbc.sql(
            """
            UPDATE users
            SET password_hash = ?, last_password_changed_at = ?, updated_at = now()
            WHERE id = ?
            """)
        .params(passwordHash, toTimestamp(changedAt), id)
        .update();
  }

  public void recordLogin(UUID id, Instant loggedInAt) {
    jdbc.sql("UPDATE users SET last_login_at = ?, updated_at = now() WHERE id = ?")
        .params(toTimestamp(loggedInAt), id)
        .update();
  }

  private UserAccount mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserAccount(
        rs.getObject("id", UUID.class),
        rs.getString("email"),
        rs.getString("password_hash"),
        rs.getString("first_name"),
        rs.getString("last_name"),
        rs.getString("avatar_url"),
        rs.getString("phone_number"),
        rs.getString("job_title"),
        rs.getString("bio"),
        rs.getString("timezone"),
        rs.getString("locale"),
        fromJson(rs.getString("social_links"), STRING_MAP, Map.of()),
        new NotificationPreferences(
            rs.getBoolean("notify_email"), rs.getBoolean("notify_sms"), rs.getBoolean("notify_push")),
        rs.getBoolean("marketing_opt_in"),
        toInstant(rs.getTimestamp("last_login_at")),
        toInstant(rs.getTimestamp("last_password_changed_at")),
        Role.parseAll(fromJson(rs.getString("roles"), STRING_LIST, List.of())),
        UserStatus.valueOf(rs.getString("status")),
        rs.getString("tenant_id"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }

  private String toJson(Object value) {
    if (value == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize user column", e);
    }
  }

  private <T> T fromJson(String json, TypeReference<? extends T> type, T fallback) {
    if (json == null || json.isBlank()) {
      return fallback;
    }
    try {
      return objectMapper.readValue(json, type);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to read user column", e);
    }
  }
}
