package io.b2mash.boq.boq;

import io.b2mash.boq.audit.AuditEventBuilder;
import io.b2mash.boq.audit.AuditService;
import io.b2mash.boq.exception.InvalidStateException;
import io.b2mash.boq.exception.ResourceNotFoundException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class BoqVersionService {

  private static final Logger log = LoggerFactory.getLogger(BoqVersionService.class);

  private final BoqProjectRepository projectRepository;
  private final BoqVersionRepository versionRepository;
  private final BoqItemRepository itemRepository;
  private final AuditService auditService;

  public BoqVersionService(
      BoqProjectRepository projectRepository,
      BoqVersionRepository versionRepository,
      BoqItemRepository itemRepository,
      AuditService auditService) {
    this.projectRepository = projectRepository;
    this.versionRepository = versionRepository;
    this.itemRepository = itemRepository;
    this.auditService = auditService;
  }

  /**
   * Creates the next version of a project, optionally copying every item of an existing version of
   * the same project. The project row is locked for the duration so concurrent creates get
   * distinct, gap-free numbers.
   */
  @Transactional
  public BoqVersion createVersion(UUID projectId, UUID copyFromVersionId) {
    if (projectId == null) {
      throw new InvalidStateException("Invalid projectId", "projectId is required");
    }
    var project =
        projectRepository
            .findByIdForUpdate(projectId)
            .orElseThrow(() -> new ResourceNotFoundException("BoqProject", projectId));

    BoqVersion source = null;
    if (copyFromVersionId != null) {
      source = getVersion(copyFromVersionId);
      if (!source.getProjectId().equals(projectId)) {
        throw new InvalidStateException(
            "Version mismatch",
            "Version " + copyFromVersionId + " does not belong to project " + projectId);
      }
    }

    int versionNumber = versionRepository.findMaxVersionNumber(projectId) + 1;
    var version =
        versionRepository.saveAndFlush(
            new BoqVersion(projectId, versionNumber, project.getName(), project.getClient()));

    int copied = 0;
    if (source != null) {
      var copies =
          itemRepository.findByVersionIdOrderByCreatedAtAsc(source.getId()).stream()
              .map(item -> item.copyTo(version.getId()))
              .toList();
      itemRepository.saveAll(copies);
      copied = copies.size();
    }

    var details = new HashMap<String, Object>();
    details.put("project_id", projectId.toString());
    details.put("version_number", versionNumber);
    if (source != null) {
      details.put("copied_from", source.getId().toString());
      details.put("items_copied", copied);
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("boq_version.created")
            .entityType("boq_version")
            .entityId(version.getId())
            .details(details)
            .build());

    log.info(
        "Created version {} of BOQ project {} (itemsCopied={})", versionNumber, projectId, copied);
    return version;
  }

  /** Versions of the project, newest first. */
  @Transactional(readOnly = true)
  public List<BoqVersion> listVersions(UUID projectId) {
    if (!projectRepository.existsById(projectId)) {
      throw new ResourceNotFoundException("BoqProject", projectId);
    }
    return versionRepository.findByProjectIdOrderByVersionNumberDesc(projectId);
  }

  @Transactional(readOnly = true)
  public BoqVersion getVersion(UUID id) {
    return versionRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("BoqVersion", id));
  }

  @Transactional
  public BoqVersion updateVersionStatus(UUID id, String status) {
    if (status == null || status.isBlank()) {
      throw new InvalidStateException("Invalid status", "status is required");
    }
    BoqVersionStatus target;
    try {
      target = BoqVersionStatus.from(status);
    } catch (IllegalArgumentException ex) {
      throw new InvalidStateException("Invalid status", "Unknown version status: " + status);
    }

    var version = getVersion(id);
    var from = version.getStatus();
    if (!version.changeStatus(target)) {
      return version;
    }
    version = versionRepository.save(version);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("boq_version.status_changed")
            .entityType("boq_version")
            .entityId(id)
            .details(Map.of("from", from.wireValue(), "to", target.wireValue()))
            .build());

    log.info("BOQ version {} moved from {} to {}", id, from.wireValue(), target.wireValue());
    return version;
  }

  /** Deletes the version's items, then the version. The project is untouched. */
  @Transactional
  public void deleteVersion(UUID id) {
    var version = getVersion(id);

    int items = itemRepository.deleteByVersionId(id);
    versionRepository.deleteById(id);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("boq_version.deleted")
            .entityType("boq_version")
            .entityId(id)
            .details(
                Map.of(
                    "project_id", version.getProjectId().toString(),
                    "version_number", version.getVersionNumber(),
                    "items_deleted", items))
            .build());

    log.info(
        "Deleted version {} of BOQ project {} (items={})",
        version.getVersionNumber(),
        version.getProjectId(),
        items);
  }

  @Transactional(readOnly = true)
  public Map<String, Object> getEdits(UUID versionId) {
    return getVersion(versionId).getEditedFields();
  }

  /** Replaces the per-version cell overrides. Fails once the version is submitted. */
  @Transactional
  public Map<String, Object> saveEdits(UUID versionId, Map<String, Object> editedFields) {
    if (editedFields == null) {
      throw new InvalidStateException("Invalid editedFields", "editedFields is required");
    }
    var version = getVersion(versionId);
    version.replaceEditedFields(editedFields);
    version = versionRepository.save(version);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("boq_version.edits_saved")
            .entityType("boq_version")
            .entityId(versionId)
            .details(Map.of("fields", editedFields.size()))
            .build());

    log.debug("Saved {} edited fields on BOQ version {}", editedFields.size(), versionId);
    return version.getEditedFields();
  }
}
