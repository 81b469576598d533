package io.b2mash.lms.ownership;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

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
import io.b2mash.lms.security.Role;
import io.b2mash.lms.session.CourseSession;
import io.b2mash.lms.session.CourseSessionRepository;
import io.b2mash.lms.user.NotificationPreferences;
import io.b2mash.lms.user.UserAccount;
import io.b2mash.lms.user.UserAccountRepository;
import io.b2mash.lms.user.UserStatus;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TenantOwnershipGuardTest {

  private static final UUID COURSE_ID = UUID.randomUUID();
  private static final UUID MODULE_ID = UUID.randomUUID();
  private static final UUID CHAPTER_ID = UUID.randomUUID();
  private static final UUID SESSION_ID = UUID.randomUUID();
  private static final UUID USER_ID = UUID.randomUUID();

  @Mock private CourseRepository courseRepository;
  @Mock private CourseModuleRepository moduleRepository;
  @Mock private ChapterRepository chapterRepository;
  @Mock private CourseSessionRepository sessionRepository;
  @Mock private UserAccountRepository userAccountRepository;

  private TenantOwnershipGuard guard;

  @BeforeEach
  void setUp() {
    guard =
        new TenantOwnershipGuard(
            courseRepository,
            moduleRepository,
            chapterRepository,
            sessionRepository,
            userAccountRepository);
    TenantContext.setTenantId("t2");
  }

  @AfterEach
  void tearDown() {
    TenantContext.clear();
  }

  @Test
  void requireCourse_sameTenant_returnsCourse() {
    var course = course("T2");
    when(courseRepository.findById(COURSE_ID)).thenReturn(Optional.of(course));

    assertThat(guard.requireCourse(COURSE_ID)).isSameAs(course);
  }

  @Test
  void requireCourse_missing_throwsNotFound() {
    when(courseRepository.findById(COURSE_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> guard.requireCourse(COURSE_ID))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void requireModule_courseOwnedByOtherTenant_throwsForbidden() {
    when(moduleRepository.findById(MODULE_ID)).thenReturn(Optional.of(module(COURSE_ID)));
    when(courseRepository.findById(COURSE_ID)).thenReturn(Optional.of(course("t1")));

    assertThatThrownBy(() -> guard.requireModule(MODULE_ID))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void requireModule_courseWithoutTenant_throwsLinkageError() {
    when(moduleRepository.findById(MODULE_ID)).thenReturn(Optional.of(module(COURSE_ID)));
    when(courseRepository.findById(COURSE_ID)).thenReturn(Optional.of(course(null)));

    assertThatThrownBy(() -> guard.requireModule(MODULE_ID))
        .isInstanceOf(TenantLinkageException.class)
        .satisfies(e -> assertThat(((TenantLinkageException) e).getStatusCode().value()).isEqualTo(400));
  }

  @Test
  void requireModule_underDifferentCourse_throwsForbidden() {
    var otherCourse = UUID.randomUUID();
    when(moduleRepository.findById(MODULE_ID)).thenReturn(Optional.of(module(otherCourse)));
    when(courseRepository.findById(otherCourse)).thenReturn(Optional.of(course("t2")));

    assertThatThrownBy(() -> guard.requireModule(COURSE_ID, MODULE_ID))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void requireChapter_underDifferentModule_throwsForbidden() {
    when(chapterRepository.findById(CHAPTER_ID))
        .thenReturn(Optional.of(new Chapter(UUID.randomUUID(), "Intro")));

    assertThatThrownBy(() -> guard.requireChapter(MODULE_ID, CHAPTER_ID))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void requireChapter_walksChainToCourse() {
    var chapter = new Chapter(MODULE_ID, "Intro");
    when(chapterRepository.findById(CHAPTER_ID)).thenReturn(Optional.of(chapter));
    when(moduleRepository.findById(MODULE_ID)).thenReturn(Optional.of(module(COURSE_ID)));
    when(courseRepository.findById(COURSE_ID)).thenReturn(Optional.of(course("t1")));

    assertThatThrownBy(() -> guard.requireChapter(MODULE_ID, CHAPTER_ID))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void requireSession_underDifferentCourse_throwsForbidden() {
    var otherCourse = UUID.randomUUID();
    when(sessionRepository.findById(SESSION_ID))
        .thenReturn(Optional.of(new CourseSession(otherCourse, USER_ID, Instant.now())));
    when(courseRepository.findById(otherCourse)).thenReturn(Optional.of(course("t2")));

    assertThatThrownBy(() -> guard.requireSession(COURSE_ID, SESSION_ID))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void requireInstructor_missingUser_throwsNotFound() {
    when(userAccountRepository.findById(USER_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> guard.requireInstructor(USER_ID))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void requireInstructor_otherTenant_throwsForbidden() {
    when(userAccountRepository.findById(USER_ID))
        .thenReturn(Optional.of(user("t1", Role.INSTRUCTOR)));

    assertThatThrownBy(() -> guard.requireInstructor(USER_ID))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void requireInstructor_studentOnly_throwsForbidden() {
    when(userAccountRepository.findById(USER_ID)).thenReturn(Optional.of(user("t2", Role.STUDENT)));

    assertThatThrownBy(() -> guard.requireInstructor(USER_ID))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void requireInstructor_tenantAdminQualifies() {
    var admin = user("t2", Role.TENANT_ADMIN);
    when(userAccountRepository.findById(USER_ID)).thenReturn(Optional.of(admin));

    assertThat(guard.requireInstructor(USER_ID)).isSameAs(admin);
  }

  private static Course course(String tenantId) {
    return new Course(tenantId, "Algorithms", UUID.randomUUID());
  }

  private static CourseModule module(UUID courseId) {
    return new CourseModule(courseId, "Week 1", null, 0);
  }

  static UserAccount user(String tenantId, Role role) {
    return new UserAccount(
        USER_ID,
        "user@x.com",
        "$2a$04$digest",
        "Grace",
        "Hopper",
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
        List.of(role),
        UserStatus.ACTIVE,
        tenantId,
        Instant.now(),
        Instant.now());
  }
}
