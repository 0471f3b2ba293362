package io.b2mash.boq.submission;

import io.b2mash.boq.audit.AuditEventBuilder;
import io.b2mash.boq.audit.AuditService;
import io.b2mash.boq.exception.ForbiddenException;
import io.b2mash.boq.exception.InvalidStateException;
import io.b2mash.boq.exception.ResourceNotFoundException;
import io.b2mash.boq.material.Material;
import io.b2mash.boq.material.MaterialRepository;
import io.b2mash.boq.security.ActorContext;
import io.b2mash.boq.security.Roles;
import io.b2mash.boq.shop.ShopRepository;
import io.b2mash.boq.taxonomy.SubcategoryRepository;
import io.b2mash.boq.taxonomy.TaxonomyNames;
import io.b2mash.boq.template.MaterialTemplate;
import io.b2mash.boq.template.MaterialTemplateRepository;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Supplier submissions against material templates, and their one-shot review. Approving a
 * submission materializes it as an approved {@link Material} in the same transaction.
 */
@Service
public class MaterialSubmissionService {

  private static final Logger log = LoggerFactory.getLogger(MaterialSubmissionService.class);

  private final MaterialSubmissionRepository submissionRepository;
  private final MaterialTemplateRepository templateRepository;
  private final ShopRepository shopRepository;
  private final MaterialRepository materialRepository;
  private final SubcategoryRepository subcategoryRepository;
  private final AuditService auditService;

  public MaterialSubmissionService(
      MaterialSubmissionRepository submissionRepository,
      MaterialTemplateRepository templateRepository,
      ShopRepository shopRepository,
      MaterialRepository materialRepository,
      SubcategoryRepository subcategoryRepository,
      AuditService auditService) {
    this.submissionRepository = submissionRepository;
    this.templateRepository = templateRepository;
    this.shopRepository = shopRepository;
    this.materialRepository = materialRepository;
    this.subcategoryRepository = subcategoryRepository;
    this.auditService = auditService;
  }

  @Transactional
  public MaterialSubmission submit(NewSubmission request) {
    if (request.templateId() == null) {
      throw new InvalidStateException("Invalid templateId", "templateId is required");
    }
    if (request.shopId() == null) {
      throw new InvalidStateException("Invalid shopId", "shopId is required");
    }
    if (!templateRepository.existsById(request.templateId())) {
      throw new ResourceNotFoundException("MaterialTemplate", request.templateId());
    }
    var shop =
        shopRepository
            .findById(request.shopId())
            .orElseThrow(() -> new ResourceNotFoundException("Shop", request.shopId()));
    if (Roles.SUPPLIER.equals(ActorContext.getRole())
        && !shop.isOwnedBy(ActorContext.getActorId())) {
      throw new ForbiddenException(
          "Not shop owner", "Suppliers may only submit materials for shops they own");
    }

    var submission =
        new MaterialSubmission(
            request.templateId(),
            request.shopId(),
            request.rate(),
            TaxonomyNames.trimToNull(request.unit()),
            ActorContext.getActorId());
    submission.describe(
        TaxonomyNames.trimToNull(request.brandName()),
        TaxonomyNames.trimToNull(request.modelNumber()),
        TaxonomyNames.trimToNull(request.subcategory()),
        request.technicalSpecification());
    submission = submissionRepository.save(submission);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("submission.created")
            .entityType("material_submission")
            .entityId(submission.getId())
            .details(
                Map.of(
                    "template_id", request.templateId().toString(),
                    "shop_id", request.shopId().toString()))
            .build());

    log.info(
        "Submission {} created for template {} by shop {}",
        submission.getId(),
        request.templateId(),
        request.shopId());
    return submission;
  }

  /**
   * Approves a pending submission and creates its material. The pending-to-approved flip is a
   * conditional update, so of two concurrent approvals only one creates a material; the other
   * fails with {@link InvalidStateException}.
   */
  @Transactional
  public SubmissionApproval approve(UUID id) {
    var submission = getSubmission(id);
    MaterialTemplate template =
        templateRepository
            .findById(submission.getTemplateId())
            .orElseThrow(
                () -> new ResourceNotFoundException("MaterialTemplate", submission.getTemplateId()));

    String reviewer = ActorContext.getActorId();
    if (submissionRepository.markApproved(id, reviewer, Instant.now()) == 0) {
      throw alreadyReviewed(id);
    }

    var material =
        Material.fromSubmission(
            template.getName(),
            template.getCode(),
            submission.getRate(),
            submission.getShopId(),
            submission.getUnit(),
            template.getId(),
            template.getCategoryId(),
            reviewer);
    material.describe(
        submission.getBrandName(),
        submission.getModelNumber(),
        submission.getTechnicalSpecification(),
        null,
        null);
    resolveSubcategory(template, submission.getSubcategory(), material);
    material = materialRepository.saveAndFlush(material);

    submissionRepository.linkMaterial(id, material.getId());

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("submission.approved")
            .entityType("material_submission")
            .entityId(id)
            .details(
                Map.of(
                    "material_id", material.getId().toString(),
                    "template_id", template.getId().toString()))
            .build());

    log.info("Approved submission {} into material {}", id, material.getId());
    return new SubmissionApproval(getSubmission(id), material);
  }

  @Transactional
  public MaterialSubmission reject(UUID id, String reason) {
    if (reason == null || reason.isBlank()) {
      throw new InvalidStateException("Invalid reason", "A rejection reason is required");
    }
    getSubmission(id);

    String trimmed = reason.trim();
    if (submissionRepository.markRejected(id, trimmed, ActorContext.getActorId(), Instant.now())
        == 0) {
      throw alreadyReviewed(id);
    }

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("submission.rejected")
            .entityType("material_submission")
            .entityId(id)
            .details(Map.of("reason", trimmed))
            .build());

    log.info("Rejected submission {}", id);
    return getSubmission(id);
  }

  @Transactional(readOnly = true)
  public List<SubmissionWithNames> listPending() {
    return submissionRepository.findPendingWithNames();
  }

  /** Every submission made for shops owned by the given supplier, newest first. */
  @Transactional(readOnly = true)
  public List<SubmissionWithNames> listForSupplier(String ownerId) {
    return submissionRepository.findForShopOwnerWithNames(ownerId);
  }

  private MaterialSubmission getSubmission(UUID id) {
    return submissionRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("MaterialSubmission", id));
  }

  private void resolveSubcategory(
      MaterialTemplate template, String subcategoryName, Material material) {
    if (template.getCategoryId() == null || subcategoryName == null || subcategoryName.isBlank()) {
      return;
    }
    subcategoryRepository
        .findByNameAndCategoryId(subcategoryName.trim(), template.getCategoryId())
        .ifPresent(s -> material.classify(template.getCategoryId(), s.getId(), null));
  }

  private static InvalidStateException alreadyReviewed(UUID id) {
    return new InvalidStateException(
        "Submission already reviewed", "Submission " + id + " has already been approved or rejected");
  }
}
