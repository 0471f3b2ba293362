package io.b2mash.boq.template;

import io.b2mash.boq.audit.AuditEventBuilder;
import io.b2mash.boq.audit.AuditService;
import io.b2mash.boq.exception.InvalidStateException;
import io.b2mash.boq.exception.ResourceConflictException;
import io.b2mash.boq.exception.ResourceNotFoundException;
import io.b2mash.boq.material.MaterialRepository;
import io.b2mash.boq.submission.MaterialSubmissionRepository;
import io.b2mash.boq.taxonomy.CategoryRepository;
import io.b2mash.boq.taxonomy.TaxonomyNames;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class MaterialTemplateService {

  private static final Logger log = LoggerFactory.getLogger(MaterialTemplateService.class);

  private final MaterialTemplateRepository templateRepository;
  private final CategoryRepository categoryRepository;
  private final MaterialSubmissionRepository submissionRepository;
  private final MaterialRepository materialRepository;
  private final AuditService auditService;

  public MaterialTemplateService(
      MaterialTemplateRepository templateRepository,
      CategoryRepository categoryRepository,
      MaterialSubmissionRepository submissionRepository,
      MaterialRepository materialRepository,
      AuditService auditService) {
    this.templateRepository = templateRepository;
    this.categoryRepository = categoryRepository;
    this.submissionRepository = submissionRepository;
    this.materialRepository = materialRepository;
    this.auditService = auditService;
  }

  @Transactional(readOnly = true)
  public List<MaterialTemplate> listTemplates() {
    return templateRepository.findAllByOrderByNameAsc();
  }

  @Transactional(readOnly = true)
  public MaterialTemplate getTemplate(UUID id) {
    return templateRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("MaterialTemplate", id));
  }

  @Transactional
  public MaterialTemplate createTemplate(String name, String code, UUID categoryId) {
    String trimmedName = TaxonomyNames.require(name, "name");
    String trimmedCode = TaxonomyNames.require(code, "code");
    if (categoryId != null && !categoryRepository.existsById(categoryId)) {
      throw new ResourceNotFoundException("Category", categoryId);
    }
    if (templateRepository.existsByName(trimmedName)) {
      throw duplicateName(trimmedName);
    }
    if (templateRepository.existsByCode(trimmedCode)) {
      throw duplicateCode(trimmedCode);
    }

    MaterialTemplate template;
    try {
      template =
          templateRepository.saveAndFlush(
              new MaterialTemplate(trimmedName, trimmedCode, categoryId));
    } catch (DataIntegrityViolationException ex) {
      throw new ResourceConflictException(
          "Duplicate template", "A template with this name or code already exists");
    }

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("template.created")
            .entityType("material_template")
            .entityId(template.getId())
            .details(Map.of("name", trimmedName, "code", trimmedCode))
            .build());

    log.info("Created material template '{}' [{}]", trimmedName, trimmedCode);
    return template;
  }

  /**
   * Renames and/or re-codes a template. Materials already created from it keep the name and code
   * they were materialized with.
   */
  @Transactional
  public MaterialTemplate updateTemplate(UUID id, String name, String code) {
    if ((name == null || name.isBlank()) && (code == null || code.isBlank())) {
      throw new InvalidStateException("Nothing to update", "name or code is required");
    }
    var template = getTemplate(id);
    var changes = new HashMap<String, Object>();

    if (name != null && !name.isBlank()) {
      String trimmedName = name.trim();
      if (!trimmedName.equals(template.getName())) {
        if (templateRepository.existsByNameAndIdNot(trimmedName, id)) {
          throw duplicateName(trimmedName);
        }
        changes.put("name", Map.of("from", template.getName(), "to", trimmedName));
        template.rename(trimmedName);
      }
    }
    if (code != null && !code.isBlank()) {
      String trimmedCode = code.trim();
      if (!trimmedCode.equals(template.getCode())) {
        if (templateRepository.existsByCodeAndIdNot(trimmedCode, id)) {
          throw duplicateCode(trimmedCode);
        }
        changes.put("code", Map.of("from", template.getCode(), "to", trimmedCode));
        template.updateCode(trimmedCode);
      }
    }
    if (changes.isEmpty()) {
      return template;
    }

    try {
      template = templateRepository.saveAndFlush(template);
    } catch (DataIntegrityViolationException ex) {
      throw new ResourceConflictException(
          "Duplicate template", "A template with this name or code already exists");
    }

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("template.updated")
            .entityType("material_template")
            .entityId(id)
            .details(changes)
            .build());

    log.info("Updated material template {} fields={}", id, changes.keySet());
    return template;
  }

  /** Deletes the template with its submissions and the materials created from it. */
  @Transactional
  public MaterialTemplate deleteTemplate(UUID id) {
    var template = getTemplate(id);

    int submissions = submissionRepository.deleteByTemplateId(id);
    List<UUID> materialIds = materialRepository.findIdsByTemplateId(id);
    int materials = 0;
    if (!materialIds.isEmpty()) {
      submissionRepository.unlinkMaterials(materialIds);
      materials = materialRepository.deleteByIdIn(materialIds);
    }
    templateRepository.deleteById(id);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("template.deleted")
            .entityType("material_template")
            .entityId(id)
            .details(
                Map.of(
                    "name", template.getName(),
                    "code", template.getCode(),
                    "submissions_deleted", submissions,
                    "materials_deleted", materials))
            .build());

    log.info(
        "Deleted material template '{}' ({}): submissions={}, materials={}",
        template.getName(),
        id,
        submissions,
        materials);
    return template;
  }

  private static ResourceConflictException duplicateName(String name) {
    return new ResourceConflictException(
        "Duplicate template", "A template named '" + name + "' already exists");
  }

  private static ResourceConflictException duplicateCode(String code) {
    return new ResourceConflictException(
        "Duplicate template code", "A template with code '" + code + "' already exists");
  }
}
