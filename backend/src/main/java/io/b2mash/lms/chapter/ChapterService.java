package io.b2mash.lms.chapter;

import io.b2mash.lms.chapter.dto.ChapterResponse;
import io.b2mash.lms.chapter.dto.CreateChapterRequest;
import io.b2mash.lms.chapter.dto.UpdateChapterRequest;
import io.b2mash.lms.ownership.TenantOwnershipGuard;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ChapterService {

  private static final Logger log = LoggerFactory.getLogger(ChapterService.class);

  private final ChapterRepository chapterRepository;
  private final TenantOwnershipGuard ownershipGuard;

  public ChapterService(ChapterRepository chapterRepository, TenantOwnershipGuard ownershipGuard) {
    this.chapterRepository = chapterRepository;
    this.ownershipGuard = ownershipGuard;
  }

  @Transactional
  public ChapterResponse create(UUID moduleId, CreateChapterRequest request) {
    ownershipGuard.requireModule(moduleId);
    var chapter = new Chapter(moduleId, request.title().trim());
    chapter.update(
        request.title().trim(),
        request.description(),
        request.contentType() != null ? request.contentType() : ChapterContentType.RECORDED,
        request.contentUrl(),
        request.durationMinutes(),
        request.ordering() != null ? request.ordering() : 0);
    chapter = chapterRepository.save(chapter);
    log.info("Created chapter: id={}, moduleId={}", chapter.getId(), moduleId);
    return ChapterResponse.from(chapter);
  }

  @Transactional(readOnly = true)
  public List<ChapterResponse> list(UUID moduleId) {
    ownershipGuard.requireModule(moduleId);
    return chapterRepository.findByModuleIdOrdered(moduleId).stream()
        .map(ChapterResponse::from)
        .toList();
  }

  @Transactional(readOnly = true)
  public ChapterResponse get(UUID moduleId, UUID chapterId) {
    return ChapterResponse.from(ownershipGuard.requireChapter(moduleId, chapterId));
  }

  @Transactional
  public ChapterResponse update(UUID moduleId, UUID chapterId, UpdateChapterRequest request) {
    var chapter = ownershipGuard.requireChapter(moduleId, chapterId);
    chapter.update(
        request.title() != null ? request.title().trim() : chapter.getTitle(),
        request.description() != null ? request.description() : chapter.getDescription(),
        request.contentType() != null ? request.contentType() : chapter.getContentType(),
        request.contentUrl() != null ? request.contentUrl() : chapter.getContentUrl(),
        request.durationMinutes() != null
            ? request.durationMinutes()
            : chapter.getDurationMinutes(),
        request.ordering() != null ? request.ordering() : chapter.getOrdering());
    chapter = chapterRepository.save(chapter);
    log.info("Updated chapter: id={}", chapter.getId());
    return ChapterResponse.from(chapter);
  }

  @Transactional
  public void delete(UUID moduleId, UUID chapterId) {
    var chapter = ownershipGuard.requireChapter(moduleId, chapterId);
    chapterRepository.delete(chapter);
    log.info("Deleted chapter: id={}, moduleId={}", chapterId, moduleId);
  }
}
