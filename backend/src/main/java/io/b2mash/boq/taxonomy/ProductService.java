package io.b2mash.boq.taxonomy;

import io.b2mash.boq.audit.AuditEventBuilder;
import io.b2mash.boq.audit.AuditService;
import io.b2mash.boq.exception.ResourceConflictException;
import io.b2mash.boq.exception.ResourceNotFoundException;
import io.b2mash.boq.material.MaterialRepository;
import io.b2mash.boq.security.ActorContext;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProductService {

  private static final Logger log = LoggerFactory.getLogger(ProductService.class);

  private final ProductRepository productRepository;
  private final SubcategoryRepository subcategoryRepository;
  private final MaterialRepository materialRepository;
  private final AuditService auditService;

  public ProductService(
      ProductRepository productRepository,
      SubcategoryRepository subcategoryRepository,
      MaterialRepository materialRepository,
      AuditService auditService) {
    this.productRepository = productRepository;
    this.subcategoryRepository = subcategoryRepository;
    this.materialRepository = materialRepository;
    this.auditService = auditService;
  }

  @Transactional(readOnly = true)
  public List<Product> listProducts() {
    return productRepository.findAllByOrderByNameAsc();
  }

  @Transactional(readOnly = true)
  public Product getProduct(UUID id) {
    return productRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Product", id));
  }

  @Transactional
  public Product createProduct(String name, UUID subcategoryId, String description) {
    String trimmed = TaxonomyNames.require(name, "name");
    requireSubcategory(subcategoryId);
    if (productRepository.existsByName(trimmed)) {
      throw duplicate(trimmed);
    }

    Product product;
    try {
      product =
          productRepository.saveAndFlush(
              new Product(
                  trimmed,
                  subcategoryId,
                  TaxonomyNames.trimToNull(description),
                  ActorContext.getActorId()));
    } catch (DataIntegrityViolationException ex) {
      throw duplicate(trimmed);
    }

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("product.created")
            .entityType("product")
            .entityId(product.getId())
            .details(details(product))
            .build());

    log.info("Created product '{}' ({})", trimmed, product.getId());
    return product;
  }

  @Transactional
  public Product updateProduct(UUID id, String name, UUID subcategoryId, String description) {
    String trimmed = TaxonomyNames.require(name, "name");
    var product = getProduct(id);
    requireSubcategory(subcategoryId);
    if (productRepository.existsByNameAndIdNot(trimmed, id)) {
      throw duplicate(trimmed);
    }

    product.update(trimmed, subcategoryId, TaxonomyNames.trimToNull(description));
    try {
      product = productRepository.saveAndFlush(product);
    } catch (DataIntegrityViolationException ex) {
      throw duplicate(trimmed);
    }

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("product.updated")
            .entityType("product")
            .entityId(id)
            .details(details(product))
            .build());

    log.info("Updated product '{}' ({})", trimmed, id);
    return product;
  }

  /** Deletes the product; materials that referenced it keep existing without the reference. */
  @Transactional
  public void deleteProduct(UUID id) {
    var product = getProduct(id);
    int detachedMaterials = materialRepository.clearProduct(id, Instant.now());
    productRepository.deleteById(id);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("product.deleted")
            .entityType("product")
            .entityId(id)
            .details(Map.of("name", product.getName(), "materials_detached", detachedMaterials))
            .build());

    log.info("Deleted product '{}' ({})", product.getName(), id);
  }

  private void requireSubcategory(UUID subcategoryId) {
    if (subcategoryId != null && !subcategoryRepository.existsById(subcategoryId)) {
      throw new ResourceNotFoundException("Subcategory", subcategoryId);
    }
  }

  private static Map<String, Object> details(Product product) {
    var details = new HashMap<String, Object>();
    details.put("name", product.getName());
    if (product.getSubcategoryId() != null) {
      details.put("subcategory_id", product.getSubcategoryId().toString());
    }
    return details;
  }

  private static ResourceConflictException duplicate(String name) {
    return new ResourceConflictException(
        "Duplicate product", "A product named '" + name + "' already exists");
  }
}
