package io.b2mash.lms.ownership;

import io.b2mash.lms.chapter.Chapter;
import io.b2mash.lms.chapter.ChapterRepository;
import io.b2mash.lms.course.Course;
import io.b2mash.lms.course.CourseRepository;
import io.b2mash.lms.coursemodule.CourseModule;
import io.b2mash.lms.coursemodule.CourseModuleRepository;
import io.b2mash.lms.exception.ForbiddenException;
import io.b2mash.lms.exception.ResourceNotFoundException;
import io.b2mash.lms.exception.TenantLinkageException;
import io.b2mash.lms.multitenancy.TenantContext;
import io.b2mash.lms.multitenancy.TenantResolver;
import io.b2mash.lms.security.Role;
import io.b2mash.lms.session.CourseSession;
import io.b2mash.lms.session.CourseSessionRepository;
import io.b2mash.lms.user.UserAccount;
import io.b2mash.lms.user.UserAccountRepository;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Walks a resource's ownership chain up to its course and asserts the course belongs to the request
 * tenant. Path parents that disagree with the persisted parent are rejected as forbidden.
 */
@Service
public class TenantOwnershipGuard {

  private static final Logger log = LoggerFactory.getLogger(TenantOwnershipGuard.class);

  private final CourseRepository courseRepository;
  private final CourseModuleRepository moduleRepository;
  private final ChapterRepository chapterRepository;
  private final CourseSessionRepository sessionRepository;
  private final UserAccountRepository userAccountRepository;

  public TenantOwnershipGuard(
      CourseRepository courseRepository,
      CourseModuleRepository moduleRepository,
      ChapterRepository chapterRepository,
      CourseSessionRepository sessionRepository,
      UserAccountRepository userAccountRepository) {
    this.courseRepository = courseRepository;
    this.moduleRepository = moduleRepository;
    this.chapterRepository = chapterRepository;
    this.sessionRepository = sessionRepository;
    this.userAccountRepository = userAccountRepository;
  }

  @Transactional(readOnly = true)
  public Course requireCourse(UUID courseId) {
    var course =
        courseRepository
            .findById(courseId)
            .orElseThrow(() -> new ResourceNotFoundException("Course", courseId));
    requireTenant("Course", courseId, course.getTenantId());
    return course;
  }

  @Transactional(readOnly = true)
  public CourseModule requireModule(UUID moduleId) {
    var module =
        moduleRepository
            .findById(moduleId)
            .orElseThrow(() -> new ResourceNotFoundException("Module", moduleId));
    requireCourse(module.getCourseId());
    return module;
  }

  @Transactional(readOnly = true)
  public CourseModule requireModule(UUID courseId, UUID moduleId) {
    var module = requireModule(moduleId);
    requireParent("Module", moduleId, "course", courseId, module.getCourseId());
    return module;
  }

  @Transactional(readOnly = true)
  public Chapter requireChapter(UUID moduleId, UUID chapterId) {
    var chapter =
        chapterRepository
            .findById(chapterId)
            .orElseThrow(() -> new ResourceNotFoundException("Chapter", chapterId));
    requireParent("Chapter", chapterId, "module", moduleId, chapter.getModuleId());
    requireModule(chapter.getModuleId());
    return chapter;
  }

  @Transactional(readOnly = true)
  public CourseSession requireSession(UUID sessionId) {
    var session =
        sessionRepository
            .findById(sessionId)
            .orElseThrow(() -> new ResourceNotFoundException("Session", sessionId));
    requireCourse(session.getCourseId());
    return session;
  }

  @Transactional(readOnly = true)
  public CourseSession requireSession(UUID courseId, UUID sessionId) {
    var session = requireSession(sessionId);
    requireParent("Session", sessionId, "course", courseId, session.getCourseId());
    return session;
  }

  /**
   * Asserts that a tenant-tagged record belongs to the request tenant. A record with no tenant is
   * a linkage fault, not an ownership mismatch.
   */
  public void requireTenant(String resourceType, Object resourceId, String resourceTenant) {
    if (resourceTenant == null || resourceTenant.isBlank()) {
      throw new TenantLinkageException(resourceType, resourceId);
    }
    String requestTenant = TenantContext.requireTenantId();
    if (!TenantResolver.sameTenant(resourceTenant, requestTenant)) {
      log.warn(
          "ownership.tenant_mismatch: resource={}, id={}, resource_tenant={}, request_tenant={}",
          resourceType,
          resourceId,
          resourceTenant,
          requestTenant);
      throw ForbiddenException.crossTenant(resourceType, resourceId);
    }
  }

  /** The user exists, belongs to the request tenant and may teach. */
  public UserAccount requireInstructor(UUID userId) {
    var user =
        userAccountRepository
            .findById(userId)
            .orElseThrow(
                () ->
                    ResourceNotFoundException.withDetail(
                        "Instructor not found", "No instructor found with id " + userId));
    requireTenantMembership(user);
    if (!user.roles().contains(Role.INSTRUCTOR) && !user.roles().contains(Role.TENANT_ADMIN)) {
      throw new ForbiddenException(
          "Not an instructor", "User " + userId + " does not hold an instructor role");
    }
    return user;
  }

  public UserAccount requireTenantUser(UUID userId) {
    var user =
        userAccountRepository
            .findById(userId)
            .orElseThrow(() -> new ResourceNotFoundException("User", userId));
    requireTenantMembership(user);
    return user;
  }

  private void requireTenantMembership(UserAccount user) {
    String requestTenant = TenantContext.requireTenantId();
    if (user.tenantId() == null || !TenantResolver.sameTenant(user.tenantId(), requestTenant)) {
      log.warn(
          "ownership.user_tenant_mismatch: user_id={}, user_tenant={}, request_tenant={}",
          user.id(),
          user.tenantId(),
          requestTenant);
      throw ForbiddenException.crossTenant("User", user.id());
    }
  }

  private static void requireParent(
      String resourceType, UUID resourceId, String parentType, UUID pathParent, UUID actualParent) {
    if (!pathParent.equals(actualParent)) {
      log.warn(
          "ownership.parent_mismatch: resource={}, id={}, path_{}={}, actual_{}={}",
          resourceType,
          resourceId,
          parentType,
          pathParent,
          parentType,
          actualParent);
      throw ForbiddenException.foreignParent(resourceType, resourceId, parentType);
    }
  }
}
