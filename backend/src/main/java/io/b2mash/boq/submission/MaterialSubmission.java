package io.b2mash.boq.submission;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A supplier's offer to stock a template at a given rate. {@code approved} is null while pending
 * and is written exactly once by review.
 */
@Entity
@Table(name = "material_submissions")
public class MaterialSubmission {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "template_id", nullable = false)
  private UUID templateId;

  @Column(name = "shop_id", nullable = false)
  private UUID shopId;

  @Column(name = "rate", precision = 12, scale = 2)
  private BigDecimal rate;

  @Column(name = "unit", length = 50)
  private String unit;

  @Column(name = "brand_name", length = 255)
  private String brandName;

  @Column(name = "model_number", length = 255)
  private String modelNumber;

  @Column(name = "subcategory", length = 255)
  private String subcategory;

  @Column(name = "technical_specification", columnDefinition = "TEXT")
  private String technicalSpecification;

  @Column(name = "submitted_by")
  private String submittedBy;

  @Column(name = "submitted_at", nullable = false, updatable = false)
  private Instant submittedAt;

  @Column(name = "approved")
  private Boolean approved;

  @Column(name = "approval_reason", columnDefinition = "TEXT")
  private String approvalReason;

  @Column(name = "reviewed_by")
  private String reviewedBy;

  @Column(name = "reviewed_at")
  private Instant reviewedAt;

  @Column(name = "material_id")
  private UUID materialId;

  protected MaterialSubmission() {}

  public MaterialSubmission(
      UUID templateId, UUID shopId, BigDecimal rate, String unit, String submittedBy) {
    this.templateId = templateId;
    this.shopId = shopId;
    this.rate = rate;
    this.unit = unit;
    this.submittedBy = submittedBy;
    this.submittedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getTemplateId() {
    return templateId;
  }

  public UUID getShopId() {
    return shopId;
  }

  public BigDecimal getRate() {
    return rate;
  }

  public String getUnit() {
    return unit;
  }

  public String getBrandName() {
    return brandName;
  }

  public String getModelNumber() {
    return modelNumber;
  }

  public String getSubcategory() {
    return subcategory;
  }

  public String getTechnicalSpecification() {
    return technicalSpecification;
  }

  public String getSubmittedBy() {
    return submittedBy;
  }

  public Instant getSubmittedAt() {
    return submittedAt;
  }

  public Boolean getApproved() {
    return approved;
  }

  public String getApprovalReason() {
    return approvalReason;
  }

  public String getReviewedBy() {
    return reviewedBy;
  }

  public Instant getReviewedAt() {
    return reviewedAt;
  }

  public UUID getMaterialId() {
    return materialId;
  }

  public SubmissionStatus getStatus() {
    return SubmissionStatus.of(approved);
  }

  public void describe(
      String brandName, String modelNumber, String subcategory, String technicalSpecification) {
    this.brandName = brandName;
    this.modelNumber = modelNumber;
    this.subcategory = subcategory;
    this.technicalSpecification = technicalSpecification;
  }
}
