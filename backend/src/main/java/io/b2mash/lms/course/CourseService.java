package io.b2mash.lms.course;

import io.b2mash.lms.course.dto.CourseResponse;
import io.b2mash.lms.course.dto.CreateCourseRequest;
import io.b2mash.lms.course.dto.UpdateCourseRequest;
import io.b2mash.lms.exception.InvalidStateException;
import io.b2mash.lms.multitenancy.TenantContext;
import io.b2mash.lms.ownership.TenantOwnershipGuard;
import io.b2mash.lms.security.AuthenticatedUser;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CourseService {

  private static final Logger log = LoggerFactory.getLogger(CourseService.class);

  private final CourseRepository courseRepository;
  private final TenantOwnershipGuard ownershipGuard;

  public CourseService(CourseRepository courseRepository, TenantOwnershipGuard ownershipGuard) {
    this.courseRepository = courseRepository;
    this.ownershipGuard = ownershipGuard;
  }

  @Transactional
  public CourseResponse create(CreateCourseRequest request, AuthenticatedUser caller) {
    validateDates(request.startDate(), request.endDate());
    if (request.instructorId() != null) {
      ownershipGuard.requireInstructor(request.instructorId());
    }

    var course = new Course(TenantContext.requireTenantId(), request.title().trim(), caller.userId());
    course.updateDetails(
        request.title().trim(),
        request.description(),
        request.category(),
        request.level(),
        request.language(),
        request.thumbnailUrl());
    course.updatePricing(request.price(), request.salePrice(), normalizeCurrency(request.currency()));
    course.schedule(request.startDate(), request.endDate());
    if (request.status() != null) {
      course.changeStatus(request.status());
    }
    course.assignInstructor(request.instructorId());
    course = courseRepository.save(course);

    log.info("Created course: id={}, title={}", course.getId(), course.getTitle());
    return CourseResponse.from(course);
  }

  @Transactional(readOnly = true)
  public List<CourseResponse> list(CourseStatus status) {
    String tenantId = TenantContext.requireTenantId();
    var courses =
        status != null
            ? courseRepository.findByTenantAndStatus(tenantId, status)
            : courseRepository.findByTenant(tenantId);
    return courses.stream().map(CourseResponse::from).toList();
  }

  @Transactional(readOnly = true)
  public CourseResponse get(UUID courseId) {
    return CourseResponse.from(ownershipGuard.requireCourse(courseId));
  }

  @Transactional
  public CourseResponse update(UUID courseId, UpdateCourseRequest request) {
    var course = ownershipGuard.requireCourse(courseId);

    LocalDate startDate = request.startDate() != null ? request.startDate() : course.getStartDate();
    LocalDate endDate = request.endDate() != null ? request.endDate() : course.getEndDate();
    validateDates(startDate, endDate);
    if (request.instructorId() != null) {
      ownershipGuard.requireInstructor(request.instructorId());
      course.assignInstructor(request.instructorId());
    }

    course.updateDetails(
        request.title() != null ? request.title().trim() : course.getTitle(),
        request.description() != null ? request.description() : course.getDescription(),
        request.category() != null ? request.category() : course.getCategory(),
        request.level() != null ? request.level() : course.getLevel(),
        request.language() != null ? request.language() : course.getLanguage(),
        request.thumbnailUrl() != null ? request.thumbnailUrl() : course.getThumbnailUrl());
    course.updatePricing(
        request.price() != null ? request.price() : course.getPrice(),
        request.salePrice() != null ? request.salePrice() : course.getSalePrice(),
        request.currency() != null ? normalizeCurrency(request.currency()) : course.getCurrency());
    course.schedule(startDate, endDate);
    if (request.status() != null) {
      course.changeStatus(request.status());
    }
    course = courseRepository.save(course);

    log.info("Updated course: id={}, status={}", course.getId(), course.getStatus());
    return CourseResponse.from(course);
  }

  private static void validateDates(LocalDate startDate, LocalDate endDate) {
    if (startDate != null && endDate != null && endDate.isBefore(startDate)) {
      throw new InvalidStateException(
          "Invalid course dates", "endDate must be on or after startDate");
    }
  }

  private static String normalizeCurrency(String currency) {
    return currency == null || currency.isBlank() ? "USD" : currency.toUpperCase(Locale.ROOT);
  }
}
