package io.b2mash.lms.session;

public enum SessionType {
  LIVE,
  RECORDED
}
