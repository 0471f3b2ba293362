package io.b2mash.boq.shop;

import io.b2mash.boq.approval.ApprovalGate;
import io.b2mash.boq.audit.AuditEventBuilder;
import io.b2mash.boq.audit.AuditService;
import io.b2mash.boq.exception.ForbiddenException;
import io.b2mash.boq.exception.ResourceNotFoundException;
import io.b2mash.boq.material.MaterialRepository;
import io.b2mash.boq.security.ActorContext;
import io.b2mash.boq.submission.MaterialSubmissionRepository;
import io.b2mash.boq.taxonomy.TaxonomyNames;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ShopService {

  private static final Logger log = LoggerFactory.getLogger(ShopService.class);

  private final ShopRepository shopRepository;
  private final MaterialRepository materialRepository;
  private final MaterialSubmissionRepository submissionRepository;
  private final AuditService auditService;
  private final ApprovalGate<Shop> approvalGate;

  public ShopService(
      ShopRepository shopRepository,
      MaterialRepository materialRepository,
      MaterialSubmissionRepository submissionRepository,
      AuditService auditService) {
    this.shopRepository = shopRepository;
    this.materialRepository = materialRepository;
    this.submissionRepository = submissionRepository;
    this.auditService = auditService;
    this.approvalGate = new ApprovalGate<>(shopRepository, auditService, "Shop", "shop");
  }

  /** Shops visible in the public catalog. */
  @Transactional(readOnly = true)
  public List<Shop> listApprovedShops() {
    return approvalGate.listApproved();
  }

  /** Shops awaiting review, including rejected ones. */
  @Transactional(readOnly = true)
  public List<Shop> listPendingShops() {
    return approvalGate.listPending();
  }

  @Transactional(readOnly = true)
  public List<Shop> listShopsForOwner(String ownerId) {
    return shopRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId);
  }

  @Transactional(readOnly = true)
  public Shop getShop(UUID id) {
    return shopRepository.findById(id).orElseThrow(() -> new ResourceNotFoundException("Shop", id));
  }

  /** Creates a shop owned by the caller. It stays out of the public catalog until approved. */
  @Transactional
  public Shop submitShop(ShopDetails details) {
    String name = TaxonomyNames.require(details.name(), "name");
    var shop = new Shop(name, ActorContext.getActorId());
    apply(shop, name, details);
    shop = shopRepository.save(shop);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("shop.submitted")
            .entityType("shop")
            .entityId(shop.getId())
            .details(Map.of("name", name))
            .build());

    log.info("Shop '{}' ({}) submitted for approval", name, shop.getId());
    return shop;
  }

  @Transactional
  public Shop updateShop(UUID id, ShopDetails details) {
    var shop = getShop(id);
    requireOwnerOrStaff(shop);
    var merged = details.mergeOnto(shop);
    String name = TaxonomyNames.require(merged.name(), "name");
    apply(shop, name, merged);
    shop = shopRepository.save(shop);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("shop.updated")
            .entityType("shop")
            .entityId(id)
            .details(Map.of("name", name))
            .build());

    log.info("Updated shop '{}' ({})", name, id);
    return shop;
  }

  /** Deletes the shop with its submissions and materials. */
  @Transactional
  public void deleteShop(UUID id) {
    var shop = getShop(id);

    int submissions = submissionRepository.deleteByShopId(id);
    List<UUID> materialIds = materialRepository.findIdsByShopId(id);
    int materials = 0;
    if (!materialIds.isEmpty()) {
      submissionRepository.unlinkMaterials(materialIds);
      materials = materialRepository.deleteByIdIn(materialIds);
    }
    shopRepository.deleteById(id);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("shop.deleted")
            .entityType("shop")
            .entityId(id)
            .details(
                Map.of(
                    "name", shop.getName(),
                    "submissions_deleted", submissions,
                    "materials_deleted", materials))
            .build());

    log.info(
        "Deleted shop '{}' ({}): submissions={}, materials={}",
        shop.getName(),
        id,
        submissions,
        materials);
  }

  @Transactional
  public Shop approveShop(UUID id) {
    return approvalGate.approve(id);
  }

  @Transactional
  public Shop rejectShop(UUID id, String reason) {
    return approvalGate.reject(id, TaxonomyNames.trimToNull(reason));
  }

  private static void requireOwnerOrStaff(Shop shop) {
    if (ActorContext.isStaff() || shop.isOwnedBy(ActorContext.getActorId())) {
      return;
    }
    throw new ForbiddenException("Not shop owner", "Only the shop owner or staff may edit this shop");
  }

  private static void apply(Shop shop, String name, ShopDetails details) {
    shop.updateDetails(
        name,
        details.location(),
        details.phoneCountryCode(),
        details.contactNumber(),
        details.city(),
        details.state(),
        details.country(),
        details.pincode());
    shop.updateProfile(details.image(), details.rating(), details.categories(), details.gstNo());
  }
}
