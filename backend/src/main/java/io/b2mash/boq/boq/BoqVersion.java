package io.b2mash.boq.boq;

import io.b2mash.boq.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
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

/**
 * A numbered revision of a BOQ project. Project name and client are snapshotted at creation so a
 * later project rename does not rewrite history.
 */
@Entity
@Table(name = "boq_versions")
public class BoqVersion {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  @Column(name = "version_number", nullable = false, updatable = false)
  private int versionNumber;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private BoqVersionStatus status;

  @Column(name = "project_name", length = 255)
  private String projectName;

  @Column(name = "project_client", length = 255)
  private String projectClient;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "edited_fields", columnDefinition = "jsonb")
  private Map<String, Object> editedFields = new HashMap<>();

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected BoqVersion() {}

  public BoqVersion(UUID projectId, int versionNumber, String projectName, String projectClient) {
    this.projectId = projectId;
    this.versionNumber = versionNumber;
    this.projectName = projectName;
    this.projectClient = projectClient;
    this.status = BoqVersionStatus.DRAFT;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public int getVersionNumber() {
    return versionNumber;
  }

  public BoqVersionStatus getStatus() {
    return status;
  }

  public String getProjectName() {
    return projectName;
  }

  public String getProjectClient() {
    return projectClient;
  }

  public Map<String, Object> getEditedFields() {
    return editedFields != null ? editedFields : Map.of();
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public boolean isLocked() {
    return status.isTerminal();
  }

  /** Throws when the version no longer accepts item or edit changes. */
  public void requireEditable() {
    if (isLocked()) {
      throw new InvalidStateException(
          "Version locked", "Version " + versionNumber + " is submitted and can no longer change");
    }
  }

  public boolean changeStatus(BoqVersionStatus target) {
    if (status == target) {
      return false;
    }
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid version transition",
          "Cannot move version from " + status.wireValue() + " to " + target.wireValue());
    }
    this.status = target;
    this.updatedAt = Instant.now();
    return true;
  }

  public void replaceEditedFields(Map<String, Object> editedFields) {
    requireEditable();
    this.editedFields = editedFields != null ? new HashMap<>(editedFields) : new HashMap<>();
    this.updatedAt = Instant.now();
  }
}
