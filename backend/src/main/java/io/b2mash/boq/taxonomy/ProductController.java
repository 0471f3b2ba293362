package io.b2mash.boq.taxonomy;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/products")
public class ProductController {

  private final ProductService productService;

  public ProductController(ProductService productService) {
    this.productService = productService;
  }

  @GetMapping
  public ResponseEntity<ProductListResponse> listProducts() {
    var products = productService.listProducts().stream().map(ProductResponse::from).toList();
    return ResponseEntity.ok(new ProductListResponse(products));
  }

  @GetMapping("/{id}")
  public ResponseEntity<ProductEnvelope> getProduct(@PathVariable UUID id) {
    return ResponseEntity.ok(
        new ProductEnvelope(ProductResponse.from(productService.getProduct(id))));
  }

  @PostMapping
  @PreAuthorize("hasAnyRole('ADMIN', 'SOFTWARE_TEAM', 'PURCHASE_TEAM')")
  public ResponseEntity<ProductEnvelope> createProduct(
      @Valid @RequestBody ProductRequest request) {
    var product =
        productService.createProduct(
            request.name(), request.subcategoryId(), request.description());
    return ResponseEntity.created(URI.create("/api/products/" + product.getId()))
        .body(new ProductEnvelope(ProductResponse.from(product)));
  }

  @PutMapping("/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'SOFTWARE_TEAM', 'PURCHASE_TEAM')")
  public ResponseEntity<ProductEnvelope> updateProduct(
      @PathVariable UUID id, @Valid @RequestBody ProductRequest request) {
    var product =
        productService.updateProduct(
            id, request.name(), request.subcategoryId(), request.description());
    return ResponseEntity.ok(new ProductEnvelope(ProductResponse.from(product)));
  }

  @DeleteMapping("/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'SOFTWARE_TEAM', 'PURCHASE_TEAM')")
  public ResponseEntity<MessageResponse> deleteProduct(@PathVariable UUID id) {
    productService.deleteProduct(id);
    return ResponseEntity.ok(new MessageResponse("Product deleted"));
  }

  public record ProductRequest(
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      UUID subcategoryId,
      @Size(max = 4000, message = "description must be at most 4000 characters")
          String description) {}

  public record ProductResponse(
      UUID id,
      String name,
      UUID subcategoryId,
      String description,
      String createdBy,
      Instant createdAt,
      Instant updatedAt) {

    public static ProductResponse from(Product product) {
      return new ProductResponse(
          product.getId(),
          product.getName(),
          product.getSubcategoryId(),
          product.getDescription(),
          product.getCreatedBy(),
          product.getCreatedAt(),
          product.getUpdatedAt());
    }
  }

  public record ProductListResponse(List<ProductResponse> products) {}

  public record ProductEnvelope(ProductResponse product) {}

  public record MessageResponse(String message) {}
}
