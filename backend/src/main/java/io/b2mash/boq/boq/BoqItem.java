package io.b2mash.boq.boq;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/** One estimator line in a BOQ. The payload is stored as-is and never interpreted here. */
@Entity
@Table(name = "boq_items")
public class BoqItem {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  @Column(name = "version_id")
  private UUID versionId;

  @Column(name = "estimator_kind", nullable = false, length = 100)
  private String estimatorKind;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "payload", columnDefinition = "jsonb")
  private Map<String, Object> payload = new HashMap<>();

  @Column(name = "user_added", nullable = false)
  private boolean userAdded;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected BoqItem() {}

  public BoqItem(
      UUID projectId, UUID versionId, String estimatorKind, Map<String, Object> payload) {
    this.projectId = projectId;
    this.versionId = versionId;
    this.estimatorKind = estimatorKind;
    this.payload = payload != null ? new HashMap<>(payload) : new HashMap<>();
    this.userAdded = true;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  /** A fresh row in {@code targetVersionId} with this item's kind, payload and visibility. */
  public BoqItem copyTo(UUID targetVersionId) {
    var copy = new BoqItem(projectId, targetVersionId, estimatorKind, payload);
    copy.userAdded = userAdded;
    return copy;
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public UUID getVersionId() {
    return versionId;
  }

  public String getEstimatorKind() {
    return estimatorKind;
  }

  public Map<String, Object> getPayload() {
    return payload;
  }

  public boolean isUserAdded() {
    return userAdded;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void replacePayload(Map<String, Object> payload) {
    this.payload = payload != null ? new HashMap<>(payload) : new HashMap<>();
    this.updatedAt = Instant.now();
  }
}
