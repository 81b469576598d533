package io.b2mash.lms.security;

public enum AccessDecision {
  ALLOW,
  DENY
}
