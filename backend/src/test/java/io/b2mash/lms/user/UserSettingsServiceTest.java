package io.b2mash.lms.user;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.lms.exception.ForbiddenException;
import io.b2mash.lms.exception.InvalidStateException;
import io.b2mash.lms.exception.UnauthorizedException;
import io.b2mash.lms.security.AuthenticatedUser;
import io.b2mash.lms.security.PasswordHasher;
import io.b2mash.lms.security.Role;
import io.b2mash.lms.security.SecurityProperties;
import io.b2mash.lms.user.dto.ChangePasswordRequest;
import io.b2mash.lms.user.dto.UpdatePreferencesRequest;
import io.b2mash.lms.user.dto.UpdateProfileRequest;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class UserSettingsServiceTest {

  private static final UUID USER_ID = UUID.randomUUID();
  private static final PasswordHasher PASSWORD_HASHER =
      new PasswordHasher(new SecurityProperties(4, List.of()));
  private static final String CURRENT_DIGEST = PASSWORD_HASHER.hash("old-password");

  @Mock private UserAccountRepository userRepository;

  private UserSettingsService service;
  private AuthenticatedUser caller;

  @BeforeEach
  void setUp() {
    service = new UserSettingsService(userRepository, PASSWORD_HASHER);
    caller =
        new AuthenticatedUser(
            USER_ID, "ada@x.com", "acme", List.of(Role.STUDENT), "Ada Lovelace", List.of());
  }

  @Test
  void updateProfile_trimsFieldsAndDropsBlankSocialLinks() {
    when(userRepository.findById(USER_ID))
        .thenReturn(Optional.of(account("acme")), Optional.empty());
    var links = new HashMap<String, String>();
    links.put(" github ", " https://github.com/ada ");
    links.put("twitter", "  ");

    var response =
        service.updateProfile(
            caller,
            new UpdateProfileRequest(
                "  Augusta ", null, " 555-0100 ", null, null, null, null, null, links));

    var saved = ArgumentCaptor.forClass(UserAccount.class);
    verify(userRepository).updateProfile(saved.capture());
    assertThat(saved.getValue().firstName()).isEqualTo("Augusta");
    assertThat(saved.getValue().lastName()).isEqualTo("Lovelace");
    assertThat(saved.getValue().phoneNumber()).isEqualTo("555-0100");
    assertThat(saved.getValue().socialLinks())
        .containsExactly(Map.entry("github", "https://github.com/ada"));
    assertThat(response.firstName()).isEqualTo("Augusta");
  }

  @Test
  void updatePreferences_keepsUnsetFlags() {
    when(userRepository.findById(USER_ID)).thenReturn(Optional.of(account("acme")));

    service.updatePreferences(caller, new UpdatePreferencesRequest(null, true, null, true));

    verify(userRepository)
        .updatePreferences(USER_ID, new NotificationPreferences(true, true, false), true);
  }

  @Test
  void changePassword_wrongCurrentPassword_throwsUnauthorized() {
    when(userRepository.findById(USER_ID)).thenReturn(Optional.of(account("acme")));

    assertThatThrownBy(
            () ->
                service.changePassword(
                    caller, new ChangePasswordRequest("not-my-password", "new-password")))
        .isInstanceOf(UnauthorizedException.class);
    verify(userRepository, never()).updatePassword(any(), anyString(), any());
  }

  @Test
  void changePassword_tooShort_isRejectedBeforeLookup() {
    assertThatThrownBy(
            () -> service.changePassword(caller, new ChangePasswordRequest("old-password", "short")))
        .isInstanceOf(InvalidStateException.class);
    verify(userRepository, never()).findById(any());
  }

  @Test
  void changePassword_storesNewDigest() {
    when(userRepository.findById(USER_ID)).thenReturn(Optional.of(account("acme")));

    service.changePassword(caller, new ChangePasswordRequest("old-password", "new-password"));

    var digest = ArgumentCaptor.forClass(String.class);
    verify(userRepository).updatePassword(eq(USER_ID), digest.capture(), any(Instant.class));
    assertThat(PASSWORD_HASHER.verify("new-password", digest.getValue())).isTrue();
  }

  @Test
  void getProfile_accountInOtherTenant_throwsForbidden() {
    when(userRepository.findById(USER_ID)).thenReturn(Optional.of(account("globex")));

    assertThatThrownBy(() -> service.getProfile(caller)).isInstanceOf(ForbiddenException.class);
  }

  private static UserAccount account(String tenantId) {
    return new UserAccount(
        USER_ID,
        "ada@x.com",
        CURRENT_DIGEST,
        "Ada",
        "Lovelace",
        null,
        null,
        null,
        null,
        null,
        null,
        Map.of(),
        NotificationPreferences.defaults(),
        false,
        null,
        null,
        List.of(Role.STUDENT),
        UserStatus.ACTIVE,
        tenantId,
        Instant.now(),
        Instant.now());
  }
}
