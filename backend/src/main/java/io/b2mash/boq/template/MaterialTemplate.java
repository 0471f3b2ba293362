package io.b2mash.boq.template;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Canonical catalog entry (name + code) that suppliers price through submissions. Renaming a
 * template never rewrites materials already created from it.
 */
@Entity
@Table(name = "material_templates")
public class MaterialTemplate {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "code", nullable = false, length = 100)
  private String code;

  @Column(name = "category_id")
  private UUID categoryId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected MaterialTemplate() {}

  public MaterialTemplate(String name, String code, UUID categoryId) {
    this.name = name;
    this.code = code;
    this.categoryId = categoryId;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getCode() {
    return code;
  }

  public UUID getCategoryId() {
    return categoryId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void rename(String name) {
    this.name = name;
    this.updatedAt = Instant.now();
  }

  public void updateCode(String code) {
    this.code = code;
    this.updatedAt = Instant.now();
  }
}
