package io.b2mash.lms.cms;

public enum CmsStatus {
  DRAFT,
  SCHEDULED,
  PUBLISHED,
  ARCHIVED
}
