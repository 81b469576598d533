package io.b2mash.lms.security;

import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

/** BCrypt password hashing. Verification never throws; bad input simply does not match. */
@Component
public class PasswordHasher {

  private final BCryptPasswordEncoder encoder;

  public PasswordHasher(SecurityProperties properties) {
    this.encoder = new BCryptPasswordEncoder(properties.bcryptRounds());
  }

  public String hash(String plaintext) {
    if (plaintext == null || plaintext.isEmpty()) {
      throw new IllegalArgumentException("Password must not be empty");
    }
    return encoder.encode(plaintext);
  }

  public boolean verify(String plaintext, String digest) {
    if (plaintext == null || plaintext.isEmpty() || digest == null || digest.isEmpty()) {
      return false;
    }
    try {
      return encoder.matches(plaintext, digest);
    } catch (IllegalArgumentException e) {
      return false;
    }
  }
}
