package io.b2mash.boq.taxonomy;

import io.b2mash.boq.audit.AuditEventBuilder;
import io.b2mash.boq.audit.AuditService;
import io.b2mash.boq.exception.ResourceConflictException;
import io.b2mash.boq.exception.ResourceNotFoundException;
import io.b2mash.boq.material.MaterialRepository;
import io.b2mash.boq.security.ActorContext;
import io.b2mash.boq.submission.MaterialSubmissionRepository;
import io.b2mash.boq.template.MaterialTemplateRepository;
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
public class CategoryService {

  private static final Logger log = LoggerFactory.getLogger(CategoryService.class);

  private final CategoryRepository categoryRepository;
  private final SubcategoryRepository subcategoryRepository;
  private final ProductRepository productRepository;
  private final MaterialTemplateRepository templateRepository;
  private final MaterialRepository materialRepository;
  private final MaterialSubmissionRepository submissionRepository;
  private final AuditService auditService;

  public CategoryService(
      CategoryRepository categoryRepository,
      SubcategoryRepository subcategoryRepository,
      ProductRepository productRepository,
      MaterialTemplateRepository templateRepository,
      MaterialRepository materialRepository,
      MaterialSubmissionRepository submissionRepository,
      AuditService auditService) {
    this.categoryRepository = categoryRepository;
    this.subcategoryRepository = subcategoryRepository;
    this.productRepository = productRepository;
    this.templateRepository = templateRepository;
    this.materialRepository = materialRepository;
    this.submissionRepository = submissionRepository;
    this.auditService = auditService;
  }

  @Transactional(readOnly = true)
  public List<Category> listCategories() {
    return categoryRepository.findAllByOrderByNameAsc();
  }

  @Transactional(readOnly = true)
  public List<String> listCategoryNames() {
    return categoryRepository.findAllNames();
  }

  @Transactional(readOnly = true)
  public Category getCategory(UUID id) {
    return categoryRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Category", id));
  }

  @Transactional
  public Category createCategory(String name) {
    String trimmed = TaxonomyNames.require(name, "name");
    if (categoryRepository.existsByName(trimmed)) {
      throw duplicate(trimmed);
    }

    Category category;
    try {
      category = categoryRepository.saveAndFlush(new Category(trimmed, ActorContext.getActorId()));
    } catch (DataIntegrityViolationException ex) {
      throw duplicate(trimmed);
    }

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("category.created")
            .entityType("category")
            .entityId(category.getId())
            .details(Map.of("name", trimmed))
            .build());

    log.info("Created category '{}' ({})", trimmed, category.getId());
    return category;
  }

  @Transactional
  public Category renameCategory(UUID id, String newName) {
    String trimmed = TaxonomyNames.require(newName, "name");
    var category = getCategory(id);
    String oldName = category.getName();
    if (oldName.equals(trimmed)) {
      return category;
    }
    if (categoryRepository.existsByName(trimmed)) {
      throw duplicate(trimmed);
    }

    category.rename(trimmed);
    try {
      category = categoryRepository.saveAndFlush(category);
    } catch (DataIntegrityViolationException ex) {
      throw duplicate(trimmed);
    }

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("category.renamed")
            .entityType("category")
            .entityId(id)
            .details(Map.of("old_name", oldName, "new_name", trimmed))
            .build());

    log.info("Renamed category {} from '{}' to '{}'", id, oldName, trimmed);
    return category;
  }

  /**
   * Deletes the category and everything that hangs off it, children before parents: submissions of
   * its templates, its materials, its templates, then its subcategories (whose products are
   * detached, not deleted), then the category itself. Runs in one transaction.
   */
  @Transactional
  public Category deleteCategory(UUID id) {
    var category = getCategory(id);
    Instant now = Instant.now();

    int submissions = submissionRepository.deleteByTemplateCategoryId(id);

    List<UUID> materialIds = materialRepository.findIdsInCategory(id);
    int materials = 0;
    if (!materialIds.isEmpty()) {
      submissionRepository.unlinkMaterials(materialIds);
      materials = materialRepository.deleteByIdIn(materialIds);
    }

    int templates = templateRepository.deleteByCategoryId(id);

    List<UUID> subcategoryIds = subcategoryRepository.findIdsByCategoryId(id);
    int detachedProducts = 0;
    if (!subcategoryIds.isEmpty()) {
      detachedProducts = productRepository.detachFromSubcategories(subcategoryIds, now);
      materialRepository.clearSubcategories(subcategoryIds, now);
    }
    int subcategories = subcategoryRepository.deleteByCategoryId(id);

    categoryRepository.deleteById(id);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("category.deleted")
            .entityType("category")
            .entityId(id)
            .details(
                Map.of(
                    "name", category.getName(),
                    "submissions_deleted", submissions,
                    "materials_deleted", materials,
                    "templates_deleted", templates,
                    "subcategories_deleted", subcategories,
                    "products_detached", detachedProducts))
            .build());

    log.info(
        "Deleted category '{}' ({}): submissions={}, materials={}, templates={},"
            + " subcategories={}, productsDetached={}",
        category.getName(),
        id,
        submissions,
        materials,
        templates,
        subcategories,
        detachedProducts);
    return category;
  }

  private static ResourceConflictException duplicate(String name) {
    return new ResourceConflictException(
        "Duplicate category", "A category named '" + name + "' already exists");
  }
}
