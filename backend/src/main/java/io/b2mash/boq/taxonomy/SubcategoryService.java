package io.b2mash.boq.taxonomy;

import io.b2mash.boq.audit.AuditEventBuilder;
import io.b2mash.boq.audit.AuditService;
import io.b2mash.boq.exception.InvalidStateException;
import io.b2mash.boq.exception.ResourceConflictException;
import io.b2mash.boq.exception.ResourceNotFoundException;
import io.b2mash.boq.material.MaterialRepository;
import io.b2mash.boq.security.ActorContext;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class SubcategoryService {

  private static final Logger log = LoggerFactory.getLogger(SubcategoryService.class);

  private final SubcategoryRepository subcategoryRepository;
  private final CategoryRepository categoryRepository;
  private final ProductRepository productRepository;
  private final MaterialRepository materialRepository;
  private final AuditService auditService;

  public SubcategoryService(
      SubcategoryRepository subcategoryRepository,
      CategoryRepository categoryRepository,
      ProductRepository productRepository,
      MaterialRepository materialRepository,
      AuditService auditService) {
    this.subcategoryRepository = subcategoryRepository;
    this.categoryRepository = categoryRepository;
    this.productRepository = productRepository;
    this.materialRepository = materialRepository;
    this.auditService = auditService;
  }

  /** All subcategories ordered by category name, then subcategory name. */
  @Transactional(readOnly = true)
  public List<SubcategoryView> listSubcategories() {
    return subcategoryRepository.findAllWithCategoryName();
  }

  @Transactional(readOnly = true)
  public List<String> listSubcategoryNames(String categoryName) {
    return subcategoryRepository.findNamesByCategoryName(categoryName);
  }

  @Transactional
  public Subcategory createSubcategory(String name, UUID categoryId) {
    String trimmed = TaxonomyNames.require(name, "name");
    if (categoryId == null) {
      throw new InvalidStateException(
          "Invalid categoryId", "categoryId is required");
    }
    if (!categoryRepository.existsById(categoryId)) {
      throw new ResourceNotFoundException("Category", categoryId);
    }
    if (subcategoryRepository.existsByNameAndCategoryId(trimmed, categoryId)) {
      throw duplicate(trimmed);
    }

    Subcategory subcategory;
    try {
      subcategory =
          subcategoryRepository.saveAndFlush(
              new Subcategory(trimmed, categoryId, ActorContext.getActorId()));
    } catch (DataIntegrityViolationException ex) {
      throw duplicate(trimmed);
    }

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("subcategory.created")
            .entityType("subcategory")
            .entityId(subcategory.getId())
            .details(Map.of("name", trimmed, "category_id", categoryId.toString()))
            .build());

    log.info("Created subcategory '{}' in category {}", trimmed, categoryId);
    return subcategory;
  }

  @Transactional
  public Subcategory renameSubcategory(UUID id, String newName) {
    String trimmed = TaxonomyNames.require(newName, "name");
    var subcategory = getSubcategory(id);
    String oldName = subcategory.getName();
    if (oldName.equals(trimmed)) {
      return subcategory;
    }
    if (subcategoryRepository.existsByNameAndCategoryId(trimmed, subcategory.getCategoryId())) {
      throw duplicate(trimmed);
    }

    subcategory.rename(trimmed);
    try {
      subcategory = subcategoryRepository.saveAndFlush(subcategory);
    } catch (DataIntegrityViolationException ex) {
      throw duplicate(trimmed);
    }

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("subcategory.renamed")
            .entityType("subcategory")
            .entityId(id)
            .details(Map.of("old_name", oldName, "new_name", trimmed))
            .build());

    log.info("Renamed subcategory {} from '{}' to '{}'", id, oldName, trimmed);
    return subcategory;
  }

  /** Deletes the subcategory. Its products and materials lose the reference but are kept. */
  @Transactional
  public Subcategory deleteSubcategory(UUID id) {
    var subcategory = getSubcategory(id);
    Instant now = Instant.now();

    int detachedProducts = productRepository.detachFromSubcategories(List.of(id), now);
    int detachedMaterials = materialRepository.clearSubcategories(List.of(id), now);
    subcategoryRepository.deleteById(id);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("subcategory.deleted")
            .entityType("subcategory")
            .entityId(id)
            .details(
                Map.of(
                    "name", subcategory.getName(),
                    "products_detached", detachedProducts,
                    "materials_detached", detachedMaterials))
            .build());

    log.info(
        "Deleted subcategory '{}' ({}): productsDetached={}, materialsDetached={}",
        subcategory.getName(),
        id,
        detachedProducts,
        detachedMaterials);
    return subcategory;
  }

  private Subcategory getSubcategory(UUID id) {
    return subcategoryRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Subcategory", id));
  }

  private static ResourceConflictException duplicate(String name) {
    return new ResourceConflictException(
        "Duplicate subcategory", "Subcategory '" + name + "' already exists in this category");
  }
}
