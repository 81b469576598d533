package io.b2mash.lms.coursemodule;

import io.b2mash.lms.coursemodule.dto.CreateModuleRequest;
import io.b2mash.lms.coursemodule.dto.ModuleResponse;
import io.b2mash.lms.coursemodule.dto.UpdateModuleRequest;
import io.b2mash.lms.ownership.TenantOwnershipGuard;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CourseModuleService {

  private static final Logger log = LoggerFactory.getLogger(CourseModuleService.class);

  private final CourseModuleRepository moduleRepository;
  private final TenantOwnershipGuard ownershipGuard;

  public CourseModuleService(
      CourseModuleRepository moduleRepository, TenantOwnershipGuard ownershipGuard) {
    this.moduleRepository = moduleRepository;
    this.ownershipGuard = ownershipGuard;
  }

  @Transactional
  public ModuleResponse create(UUID courseId, CreateModuleRequest request) {
    ownershipGuard.requireCourse(courseId);
    var module =
        new CourseModule(
            courseId,
            request.title().trim(),
            request.description(),
            request.ordering() != null ? request.ordering() : 0);
    module = moduleRepository.save(module);
    log.info("Created module: id={}, courseId={}", module.getId(), courseId);
    return ModuleResponse.from(module);
  }

  @Transactional(readOnly = true)
  public List<ModuleResponse> list(UUID courseId) {
    ownershipGuard.requireCourse(courseId);
    return moduleRepository.findByCourseIdOrdered(courseId).stream()
        .map(ModuleResponse::from)
        .toList();
  }

  @Transactional(readOnly = true)
  public ModuleResponse get(UUID courseId, UUID moduleId) {
    return ModuleResponse.from(ownershipGuard.requireModule(courseId, moduleId));
  }

  @Transactional
  public ModuleResponse update(UUID courseId, UUID moduleId, UpdateModuleRequest request) {
    var module = ownershipGuard.requireModule(courseId, moduleId);
    module.update(
        request.title() != null ? request.title().trim() : module.getTitle(),
        request.description() != null ? request.description() : module.getDescription(),
        request.ordering() != null ? request.ordering() : module.getOrdering());
    module = moduleRepository.save(module);
    log.info("Updated module: id={}", module.getId());
    return ModuleResponse.from(module);
  }

  @Transactional
  public void delete(UUID courseId, UUID moduleId) {
    var module = ownershipGuard.requireModule(courseId, moduleId);
    moduleRepository.delete(module);
    log.info("Deleted module: id={}, courseId={}", moduleId, courseId);
  }
}
