package io.b2mash.lms.course;

public enum CourseStatus {
  DRAFT,
  PUBLISHED,
  ARCHIVED
}
