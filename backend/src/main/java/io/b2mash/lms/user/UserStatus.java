package io.b2mash.lms.user;

public enum UserStatus {
  ACTIVE,
  INACTIVE,
  SUSPENDED
}
