package io.b2mash.boq.material;

import io.b2mash.boq.approval.Approvable;
import io.b2mash.boq.approval.ApprovalOrigin;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * A priced catalog material offered by a shop. Produced either by direct entry (starts pending) or
 * by approving a material submission (starts approved, anchored to its template).
 */
@Entity
@Table(name = "materials")
public class Material implements Approvable {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "code", length = 100)
  private String code;

  @Column(name = "rate", nullable = false, precision = 12, scale = 2)
  private BigDecimal rate;

  @Column(name = "shop_id", nullable = false)
  private UUID shopId;

  @Column(name = "unit", length = 50)
  private String unit;

  @Column(name = "category_id")
  private UUID categoryId;

  @Column(name = "subcategory_id")
  private UUID subcategoryId;

  @Column(name = "product_id")
  private UUID productId;

  @Column(name = "brand_name", length = 255)
  private String brandName;

  @Column(name = "model_number", length = 255)
  private String modelNumber;

  @Column(name = "technical_specification", columnDefinition = "TEXT")
  private String technicalSpecification;

  @Column(name = "image", columnDefinition = "TEXT")
  private String image;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "attributes", columnDefinition = "jsonb")
  private Map<String, Object> attributes = new HashMap<>();

  @Column(name = "template_id")
  private UUID templateId;

  @Enumerated(EnumType.STRING)
  @Column(name = "origin", nullable = false, length = 20)
  private ApprovalOrigin origin;

  @Column(name = "approved", nullable = false)
  private boolean approved;

  @Column(name = "approval_reason", columnDefinition = "TEXT")
  private String approvalReason;

  @Column(name = "created_by")
  private String createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Material() {}

  private Material(
      String name,
      String code,
      BigDecimal rate,
      UUID shopId,
      ApprovalOrigin origin,
      boolean approved,
      String createdBy) {
    this.name = name;
    this.code = code;
    this.rate = rate != null ? rate : BigDecimal.ZERO;
    this.shopId = shopId;
    this.origin = origin;
    this.approved = approved;
    this.createdBy = createdBy;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** A material entered directly by a supplier or staff member; pending until reviewed. */
  public static Material directEntry(
      String name, String code, BigDecimal rate, UUID shopId, String createdBy) {
    return new Material(name, code, rate, shopId, ApprovalOrigin.DIRECT_ENTRY, false, createdBy);
  }

  /** A material materialized from an approved submission; approved from the start. */
  public static Material fromSubmission(
      String name,
      String code,
      BigDecimal rate,
      UUID shopId,
      String unit,
      UUID templateId,
      UUID categoryId,
      String createdBy) {
    var material =
        new Material(name, code, rate, shopId, ApprovalOrigin.SUBMISSION, true, createdBy);
    material.unit = unit;
    material.templateId = templateId;
    material.categoryId = categoryId;
    return material;
  }

  @Override
  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getCode() {
    return code;
  }

  public BigDecimal getRate() {
    return rate;
  }

  public UUID getShopId() {
    return shopId;
  }

  public String getUnit() {
    return unit;
  }

  public UUID getCategoryId() {
    return categoryId;
  }

  public UUID getSubcategoryId() {
    return subcategoryId;
  }

  public UUID getProductId() {
    return productId;
  }

  public String getBrandName() {
    return brandName;
  }

  public String getModelNumber() {
    return modelNumber;
  }

  public String getTechnicalSpecification() {
    return technicalSpecification;
  }

  public String getImage() {
    return image;
  }

  public Map<String, Object> getAttributes() {
    return attributes;
  }

  public UUID getTemplateId() {
    return templateId;
  }

  public ApprovalOrigin getOrigin() {
    return origin;
  }

  @Override
  public boolean isApproved() {
    return approved;
  }

  @Override
  public String getApprovalReason() {
    return approvalReason;
  }

  public String getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void update(String name, String code, BigDecimal rate, UUID shopId, String unit) {
    this.name = name;
    this.code = code;
    this.rate = rate != null ? rate : this.rate;
    this.shopId = shopId != null ? shopId : this.shopId;
    this.unit = unit;
    this.updatedAt = Instant.now();
  }

  public void classify(UUID categoryId, UUID subcategoryId, UUID productId) {
    this.categoryId = categoryId;
    this.subcategoryId = subcategoryId;
    this.productId = productId;
    this.updatedAt = Instant.now();
  }

  public void describe(
      String brandName,
      String modelNumber,
      String technicalSpecification,
      String image,
      Map<String, Object> attributes) {
    this.brandName = brandName;
    this.modelNumber = modelNumber;
    this.technicalSpecification = technicalSpecification;
    this.image = image;
    this.attributes = attributes != null ? new HashMap<>(attributes) : new HashMap<>();
    this.updatedAt = Instant.now();
  }
}
