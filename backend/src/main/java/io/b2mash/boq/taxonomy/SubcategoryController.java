package io.b2mash.boq.taxonomy;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
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
import org.springframework.web.bind.annotation.RestController;

@RestController
public class SubcategoryController {

  private final SubcategoryService subcategoryService;

  public SubcategoryController(SubcategoryService subcategoryService) {
    this.subcategoryService = subcategoryService;
  }

  @GetMapping("/api/subcategories-admin")
  public ResponseEntity<SubcategoryListResponse> listSubcategories() {
    return ResponseEntity.ok(new SubcategoryListResponse(subcategoryService.listSubcategories()));
  }

  @GetMapping("/api/material-subcategories/{categoryName}")
  public ResponseEntity<SubcategoryNamesResponse> listSubcategoryNames(
      @PathVariable String categoryName) {
    return ResponseEntity.ok(
        new SubcategoryNamesResponse(subcategoryService.listSubcategoryNames(categoryName)));
  }

  @PostMapping("/api/subcategories")
  @PreAuthorize("hasAnyRole('ADMIN', 'SOFTWARE_TEAM')")
  public ResponseEntity<SubcategoryEnvelope> createSubcategory(
      @Valid @RequestBody CreateSubcategoryRequest request) {
    var subcategory = subcategoryService.createSubcategory(request.name(), request.categoryId());
    return ResponseEntity.created(URI.create("/api/subcategories/" + subcategory.getId()))
        .body(new SubcategoryEnvelope(SubcategoryResponse.from(subcategory)));
  }

  @PutMapping("/api/subcategories/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'SOFTWARE_TEAM')")
  public ResponseEntity<SubcategoryEnvelope> renameSubcategory(
      @PathVariable UUID id, @Valid @RequestBody RenameSubcategoryRequest request) {
    var subcategory = subcategoryService.renameSubcategory(id, request.name());
    return ResponseEntity.ok(new SubcategoryEnvelope(SubcategoryResponse.from(subcategory)));
  }

  @DeleteMapping("/api/subcategories/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'SOFTWARE_TEAM')")
  public ResponseEntity<SubcategoryDeletedResponse> deleteSubcategory(@PathVariable UUID id) {
    var subcategory = subcategoryService.deleteSubcategory(id);
    return ResponseEntity.ok(
        new SubcategoryDeletedResponse(
            "Subcategory deleted", SubcategoryResponse.from(subcategory)));
  }

  public record CreateSubcategoryRequest(
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      @NotNull(message = "categoryId is required") UUID categoryId) {}

  public record RenameSubcategoryRequest(
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name) {}

  public record SubcategoryResponse(
      UUID id, String name, UUID categoryId, String createdBy, Instant createdAt) {

    public static SubcategoryResponse from(Subcategory subcategory) {
      return new SubcategoryResponse(
          subcategory.getId(),
          subcategory.getName(),
          subcategory.getCategoryId(),
          subcategory.getCreatedBy(),
          subcategory.getCreatedAt());
    }
  }

  public record SubcategoryListResponse(List<SubcategoryView> subcategories) {}

  public record SubcategoryNamesResponse(List<String> subcategories) {}

  public record SubcategoryEnvelope(SubcategoryResponse subcategory) {}

  public record SubcategoryDeletedResponse(String message, SubcategoryResponse subcategory) {}
}
