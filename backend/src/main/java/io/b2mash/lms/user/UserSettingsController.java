package io.b2mash.lms.user;

import io.b2mash.lms.security.CurrentUser;
import io.b2mash.lms.user.dto.ChangePasswordRequest;
import io.b2mash.lms.user.dto.UpdatePreferencesRequest;
import io.b2mash.lms.user.dto.UpdateProfileRequest;
import io.b2mash.lms.user.dto.UserResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tenant/me")
@PreAuthorize("@rbac.isMember(authentication)")
public class UserSettingsController {

  private final UserSettingsService userSettingsService;

  public UserSettingsController(UserSettingsService userSettingsService) {
    this.userSettingsService = userSettingsService;
  }

  @GetMapping("/profile")
  public ResponseEntity<UserResponse> getProfile() {
    return ResponseEntity.ok(userSettingsService.getProfile(CurrentUser.require()));
  }

  @PatchMapping("/profile")
  public ResponseEntity<UserResponse> updateProfile(
      @Valid @RequestBody UpdateProfileRequest request) {
    return ResponseEntity.ok(userSettingsService.updateProfile(CurrentUser.require(), request));
  }

  @PatchMapping("/preferences")
  public ResponseEntity<UserResponse> updatePreferences(
      @RequestBody UpdatePreferencesRequest request) {
    return ResponseEntity.ok(
        userSettingsService.updatePreferences(CurrentUser.require(), request));
  }

  @PostMapping("/password")
  public ResponseEntity<Void> changePassword(@Valid @RequestBody ChangePasswordRequest request) {
    userSettingsService.changePassword(CurrentUser.require(), request);
    return ResponseEntity.noContent().build();
  }
}
