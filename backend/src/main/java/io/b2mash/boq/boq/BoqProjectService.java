package io.b2mash.boq.boq;

import io.b2mash.boq.audit.AuditEventBuilder;
import io.b2mash.boq.audit.AuditService;
import io.b2mash.boq.exception.InvalidStateException;
import io.b2mash.boq.exception.ResourceNotFoundException;
import io.b2mash.boq.security.ActorContext;
import io.b2mash.boq.taxonomy.TaxonomyNames;
import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class BoqProjectService {

  private static final Logger log = LoggerFactory.getLogger(BoqProjectService.class);

  private final BoqProjectRepository projectRepository;
  private final BoqVersionRepository versionRepository;
  private final BoqItemRepository itemRepository;
  private final AuditService auditService;

  public BoqProjectService(
      BoqProjectRepository projectRepository,
      BoqVersionRepository versionRepository,
      BoqItemRepository itemRepository,
      AuditService auditService) {
    this.projectRepository = projectRepository;
    this.versionRepository = versionRepository;
    this.itemRepository = itemRepository;
    this.auditService = auditService;
  }

  @Transactional(readOnly = true)
  public List<BoqProject> listProjects() {
    return projectRepository.findAllByOrderByCreatedAtDesc();
  }

  @Transactional(readOnly = true)
  public BoqProject getProject(UUID id) {
    return projectRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("BoqProject", id));
  }

  @Transactional
  public BoqProject createProject(
      String name, String client, BigDecimal budget, String location) {
    String trimmed = TaxonomyNames.require(name, "name");
    var project =
        projectRepository.save(
            new BoqProject(
                trimmed,
                TaxonomyNames.trimToNull(client),
                budget,
                TaxonomyNames.trimToNull(location),
                ActorContext.getActorId()));

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("boq_project.created")
            .entityType("boq_project")
            .entityId(project.getId())
            .details(Map.of("name", trimmed))
            .build());

    log.info("Created BOQ project '{}' ({})", trimmed, project.getId());
    return project;
  }

  /** Partial update: null arguments keep the current value. Status moves forward only. */
  @Transactional
  public BoqProject updateProject(
      UUID id, String name, String client, BigDecimal budget, String location, String status) {
    var project = getProject(id);

    String newName = name != null ? TaxonomyNames.require(name, "name") : project.getName();
    project.update(
        newName,
        client != null ? TaxonomyNames.trimToNull(client) : project.getClient(),
        budget != null ? budget : project.getBudget(),
        location != null ? TaxonomyNames.trimToNull(location) : project.getLocation());

    var details = new HashMap<String, Object>();
    details.put("name", newName);
    if (status != null) {
      var from = project.getStatus();
      if (project.changeStatus(parseStatus(status))) {
        details.put("status", Map.of("from", from.wireValue(), "to", project.getStatus().wireValue()));
        log.info(
            "BOQ project {} moved from {} to {}",
            id,
            from.wireValue(),
            project.getStatus().wireValue());
      }
    }
    project = projectRepository.save(project);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("boq_project.updated")
            .entityType("boq_project")
            .entityId(id)
            .details(details)
            .build());

    return project;
  }

  /** Deletes all items, then all versions, then the project. */
  @Transactional
  public void deleteProject(UUID id) {
    var project = getProject(id);

    int items = itemRepository.deleteByProjectId(id);
    int versions = versionRepository.deleteByProjectId(id);
    projectRepository.deleteById(id);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("boq_project.deleted")
            .entityType("boq_project")
            .entityId(id)
            .details(
                Map.of(
                    "name", project.getName(),
                    "items_deleted", items,
                    "versions_deleted", versions))
            .build());

    log.info(
        "Deleted BOQ project '{}' ({}): versions={}, items={}",
        project.getName(),
        id,
        versions,
        items);
  }

  private static BoqProjectStatus parseStatus(String status) {
    try {
      return BoqProjectStatus.from(status);
    } catch (IllegalArgumentException ex) {
      throw new InvalidStateException("Invalid status", "Unknown project status: " + status);
    }
  }
}
