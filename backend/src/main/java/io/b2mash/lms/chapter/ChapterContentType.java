package io.b2mash.lms.chapter;

public enum ChapterContentType {
  LIVE,
  RECORDED,
  ARTICLE,
  RESOURCE
}
