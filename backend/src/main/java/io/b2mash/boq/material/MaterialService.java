package io.b2mash.boq.material;

import io.b2mash.boq.approval.ApprovalGate;
import io.b2mash.boq.audit.AuditEventBuilder;
import io.b2mash.boq.audit.AuditService;
import io.b2mash.boq.exception.ForbiddenException;
import io.b2mash.boq.exception.InvalidStateException;
import io.b2mash.boq.exception.ResourceNotFoundException;
import io.b2mash.boq.security.ActorContext;
import io.b2mash.boq.shop.Shop;
import io.b2mash.boq.shop.ShopRepository;
import io.b2mash.boq.submission.MaterialSubmissionRepository;
import io.b2mash.boq.taxonomy.CategoryRepository;
import io.b2mash.boq.taxonomy.ProductRepository;
import io.b2mash.boq.taxonomy.SubcategoryRepository;
import io.b2mash.boq.taxonomy.TaxonomyNames;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class MaterialService {

  private static final Logger log = LoggerFactory.getLogger(MaterialService.class);

  private final MaterialRepository materialRepository;
  private final ShopRepository shopRepository;
  private final CategoryRepository categoryRepository;
  private final SubcategoryRepository subcategoryRepository;
  private final ProductRepository productRepository;
  private final MaterialSubmissionRepository submissionRepository;
  private final AuditService auditService;
  private final ApprovalGate<Material> approvalGate;

  public MaterialService(
      MaterialRepository materialRepository,
      ShopRepository shopRepository,
      CategoryRepository categoryRepository,
      SubcategoryRepository subcategoryRepository,
      ProductRepository productRepository,
      MaterialSubmissionRepository submissionRepository,
      AuditService auditService) {
    this.materialRepository = materialRepository;
    this.shopRepository = shopRepository;
    this.categoryRepository = categoryRepository;
    this.subcategoryRepository = subcategoryRepository;
    this.productRepository = productRepository;
    this.submissionRepository = submissionRepository;
    this.auditService = auditService;
    this.approvalGate =
        new ApprovalGate<>(materialRepository, auditService, "Material", "material");
  }

  @Transactional(readOnly = true)
  public List<Material> listApprovedMaterials() {
    return approvalGate.listApproved();
  }

  @Transactional(readOnly = true)
  public List<Material> listPendingMaterials() {
    return approvalGate.listPending();
  }

  @Transactional(readOnly = true)
  public Material getMaterial(UUID id) {
    return materialRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Material", id));
  }

  /** Direct entry: the material waits in the pending listing until staff approve it. */
  @Transactional
  public Material submitMaterial(MaterialDetails details) {
    String name = TaxonomyNames.require(details.name(), "name");
    if (details.shopId() == null) {
      throw new InvalidStateException("Invalid shopId", "shopId is required");
    }
    requireWritableShop(details.shopId());
    requireClassification(details);

    var material =
        Material.directEntry(
            name,
            TaxonomyNames.trimToNull(details.code()),
            details.rate(),
            details.shopId(),
            ActorContext.getActorId());
    apply(material, name, details);
    material = materialRepository.save(material);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("material.submitted")
            .entityType("material")
            .entityId(material.getId())
            .details(Map.of("name", name, "shop_id", details.shopId().toString()))
            .build());

    log.info("Material '{}' ({}) submitted for approval", name, material.getId());
    return material;
  }

  /**
   * Updates the material. Staff may edit any material; a supplier only materials of a shop they
   * own, and may not move one to somebody else's shop.
   */
  @Transactional
  public Material updateMaterial(UUID id, MaterialDetails patch) {
    var material = getMaterial(id);
    requireWritableShop(material.getShopId());

    var merged = patch.mergeOnto(material);
    String name = TaxonomyNames.require(merged.name(), "name");
    if (!merged.shopId().equals(material.getShopId())) {
      requireWritableShop(merged.shopId());
    }
    requireClassification(merged);

    apply(material, name, merged);
    material = materialRepository.save(material);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("material.updated")
            .entityType("material")
            .entityId(id)
            .details(Map.of("name", name))
            .build());

    log.info("Updated material '{}' ({})", name, id);
    return material;
  }

  @Transactional
  public void deleteMaterial(UUID id) {
    var material = getMaterial(id);
    submissionRepository.unlinkMaterials(List.of(id));
    materialRepository.deleteById(id);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("material.deleted")
            .entityType("material")
            .entityId(id)
            .details(Map.of("name", material.getName()))
            .build());

    log.info("Deleted material '{}' ({})", material.getName(), id);
  }

  @Transactional
  public Material approveMaterial(UUID id) {
    return approvalGate.approve(id);
  }

  @Transactional
  public Material rejectMaterial(UUID id, String reason) {
    return approvalGate.reject(id, TaxonomyNames.trimToNull(reason));
  }

  private void requireWritableShop(UUID shopId) {
    Shop shop =
        shopRepository.findById(shopId).orElseThrow(() -> new ResourceNotFoundException("Shop", shopId));
    if (ActorContext.isStaff() || shop.isOwnedBy(ActorContext.getActorId())) {
      return;
    }
    throw new ForbiddenException(
        "Not shop owner", "Materials may only be managed for shops you own");
  }

  private void requireClassification(MaterialDetails details) {
    if (details.categoryId() != null && !categoryRepository.existsById(details.categoryId())) {
      throw new ResourceNotFoundException("Category", details.categoryId());
    }
    if (details.subcategoryId() != null
        && !subcategoryRepository.existsById(details.subcategoryId())) {
      throw new ResourceNotFoundException("Subcategory", details.subcategoryId());
    }
    if (details.productId() != null && !productRepository.existsById(details.productId())) {
      throw new ResourceNotFoundException("Product", details.productId());
    }
  }

  private static void apply(Material material, String name, MaterialDetails details) {
    material.update(
        name,
        TaxonomyNames.trimToNull(details.code()),
        details.rate(),
        details.shopId(),
        details.unit());
    material.classify(details.categoryId(), details.subcategoryId(), details.productId());
    material.describe(
        details.brandName(),
        details.modelNumber(),
        details.technicalSpecification(),
        details.image(),
        details.attributes());
  }
}
