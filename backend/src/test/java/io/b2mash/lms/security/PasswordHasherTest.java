package io.b2mash.lms.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class PasswordHasherTest {

  private final PasswordHasher hasher = new PasswordHasher(new SecurityProperties(4, List.of()));

  @Test
  void hash_thenVerify_matches() {
    String digest = hasher.hash("correct horse battery");

    assertThat(digest).isNotEqualTo("correct horse battery");
    assertThat(hasher.verify("correct horse battery", digest)).isTrue();
    assertThat(hasher.verify("wrong horse battery", digest)).isFalse();
  }

  @Test
  void hash_isSaltedPerCall() {
    assertThat(hasher.hash("secret-password")).isNotEqualTo(hasher.hash("secret-password"));
  }

  @Test
  void hash_rejectsEmptyPassword() {
    assertThatThrownBy(() -> hasher.hash("")).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void verify_emptyInputsReturnFalse() {
    String digest = hasher.hash("secret-password");

    assertThat(hasher.verify("", digest)).isFalse();
    assertThat(hasher.verify("secret-password", "")).isFalse();
    assertThat(hasher.verify(null, digest)).isFalse();
  }

  @Test
  void verify_malformedDigestReturnsFalse() {
    assertThat(hasher.verify("secret-password", "not-a-bcrypt-digest")).isFalse();
  }
}
