package io.b2mash.boq.boq;

import io.b2mash.boq.audit.AuditEventBuilder;
import io.b2mash.boq.audit.AuditService;
import io.b2mash.boq.exception.InvalidStateException;
import io.b2mash.boq.exception.ResourceNotFoundException;
import io.b2mash.boq.taxonomy.TaxonomyNames;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class BoqItemService {

  private static final Logger log = LoggerFactory.getLogger(BoqItemService.class);

  private final BoqItemRepository itemRepository;
  private final BoqProjectRepository projectRepository;
  private final BoqVersionRepository versionRepository;
  private final AuditService auditService;

  public BoqItemService(
      BoqItemRepository itemRepository,
      BoqProjectRepository projectRepository,
      BoqVersionRepository versionRepository,
      AuditService auditService) {
    this.itemRepository = itemRepository;
    this.projectRepository = projectRepository;
    this.versionRepository = versionRepository;
    this.auditService = auditService;
  }

  /**
   * Adds a user item. {@code versionId} may be null for items attached to the project only; when
   * given, the version must belong to the project and still be a draft.
   */
  @Transactional
  public BoqItem addItem(
      UUID projectId, UUID versionId, String estimatorKind, Map<String, Object> payload) {
    if (projectId == null) {
      throw new InvalidStateException("Invalid projectId", "projectId is required");
    }
    String kind = TaxonomyNames.require(estimatorKind, "estimator");
    if (!projectRepository.existsById(projectId)) {
      throw new ResourceNotFoundException("BoqProject", projectId);
    }
    if (versionId != null) {
      var version = requireVersion(versionId);
      if (!version.getProjectId().equals(projectId)) {
        throw new InvalidStateException(
            "Version mismatch",
            "Version " + versionId + " does not belong to project " + projectId);
      }
      version.requireEditable();
    }

    var item = itemRepository.save(new BoqItem(projectId, versionId, kind, payload));

    var details = new HashMap<String, Object>();
    details.put("project_id", projectId.toString());
    details.put("estimator", kind);
    if (versionId != null) {
      details.put("version_id", versionId.toString());
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("boq_item.created")
            .entityType("boq_item")
            .entityId(item.getId())
            .details(details)
            .build());

    log.info("Added {} item {} to BOQ project {}", kind, item.getId(), projectId);
    return item;
  }

  @Transactional
  public BoqItem updateItem(UUID itemId, Map<String, Object> payload) {
    if (payload == null) {
      throw new InvalidStateException("Invalid payload", "payload is required");
    }
    var item = getItem(itemId);
    requireEditableVersion(item);

    item.replacePayload(payload);
    item = itemRepository.save(item);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("boq_item.updated")
            .entityType("boq_item")
            .entityId(itemId)
            .build());

    log.info("Updated BOQ item {}", itemId);
    return item;
  }

  @Transactional
  public void deleteItem(UUID itemId) {
    var item = getItem(itemId);
    requireEditableVersion(item);
    itemRepository.delete(item);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("boq_item.deleted")
            .entityType("boq_item")
            .entityId(itemId)
            .details(Map.of("project_id", item.getProjectId().toString()))
            .build());

    log.info("Deleted BOQ item {}", itemId);
  }

  @Transactional(readOnly = true)
  public List<BoqItem> listItemsForVersion(UUID versionId) {
    requireVersion(versionId);
    return itemRepository.findVisibleByVersionId(versionId);
  }

  @Transactional(readOnly = true)
  public List<BoqItem> listItemsForProject(UUID projectId) {
    if (!projectRepository.existsById(projectId)) {
      throw new ResourceNotFoundException("BoqProject", projectId);
    }
    return itemRepository.findVisibleByProjectId(projectId);
  }

  private BoqItem getItem(UUID itemId) {
    return itemRepository
        .findById(itemId)
        .orElseThrow(() -> new ResourceNotFoundException("BoqItem", itemId));
  }

  private BoqVersion requireVersion(UUID versionId) {
    return versionRepository
        .findById(versionId)
        .orElseThrow(() -> new ResourceNotFoundException("BoqVersion", versionId));
  }

  private void requireEditableVersion(BoqItem item) {
    if (item.getVersionId() != null) {
      versionRepository.findById(item.getVersionId()).ifPresent(BoqVersion::requireEditable);
    }
  }
}
