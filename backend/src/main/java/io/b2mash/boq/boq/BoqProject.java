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
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "boq_projects")
public class BoqProject {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "client", length = 255)
  private String client;

  @Column(name = "budget", precision = 15, scale = 2)
  private BigDecimal budget;

  @Column(name = "location", length = 255)
  private String location;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private BoqProjectStatus status;

  @Column(name = "created_by")
  private String createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected BoqProject() {}

  public BoqProject(
      String name, String client, BigDecimal budget, String location, String createdBy) {
    this.name = name;
    this.client = client;
    this.budget = budget;
    this.location = location;
    this.createdBy = createdBy;
    this.status = BoqProjectStatus.DRAFT;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getClient() {
    return client;
  }

  public BigDecimal getBudget() {
    return budget;
  }

  public String getLocation() {
    return location;
  }

  public BoqProjectStatus getStatus() {
    return status;
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

  public void update(String name, String client, BigDecimal budget, String location) {
    this.name = name;
    this.client = client;
    this.budget = budget;
    this.location = location;
    this.updatedAt = Instant.now();
  }

  /**
   * Moves the project to {@code target}. Returns false when it is already there, and throws for a
   * backward move.
   */
  public boolean changeStatus(BoqProjectStatus target) {
    if (status == target) {
      return false;
    }
    if (!status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid project transition",
          "Cannot move project from " + status.wireValue() + " to " + target.wireValue());
    }
    this.status = target;
    this.updatedAt = Instant.now();
    return true;
  }
}
