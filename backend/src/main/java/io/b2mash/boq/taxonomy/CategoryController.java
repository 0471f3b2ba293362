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
import org.springframework.web.bind.annotation.RestController;

@RestController
public class CategoryController {

  private final CategoryService categoryService;

  public CategoryController(CategoryService categoryService) {
    this.categoryService = categoryService;
  }

  @GetMapping("/api/categories")
  public ResponseEntity<CategoryListResponse> listCategories() {
    var categories =
        categoryService.listCategories().stream().map(CategoryResponse::from).toList();
    return ResponseEntity.ok(new CategoryListResponse(categories));
  }

  /** Category names only, for pickers. */
  @GetMapping("/api/material-categories")
  public ResponseEntity<CategoryNamesResponse> listCategoryNames() {
    return ResponseEntity.ok(new CategoryNamesResponse(categoryService.listCategoryNames()));
  }

  @PostMapping("/api/categories")
  @PreAuthorize("hasAnyRole('ADMIN', 'SOFTWARE_TEAM')")
  public ResponseEntity<CategoryEnvelope> createCategory(
      @Valid @RequestBody CategoryNameRequest request) {
    var category = categoryService.createCategory(request.name());
    return ResponseEntity.created(URI.create("/api/categories/" + category.getId()))
        .body(new CategoryEnvelope(CategoryResponse.from(category)));
  }

  @PutMapping("/api/categories/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'SOFTWARE_TEAM')")
  public ResponseEntity<CategoryEnvelope> renameCategory(
      @PathVariable UUID id, @Valid @RequestBody CategoryNameRequest request) {
    var category = categoryService.renameCategory(id, request.name());
    return ResponseEntity.ok(new CategoryEnvelope(CategoryResponse.from(category)));
  }

  @DeleteMapping("/api/categories/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'SOFTWARE_TEAM')")
  public ResponseEntity<CategoryDeletedResponse> deleteCategory(@PathVariable UUID id) {
    var category = categoryService.deleteCategory(id);
    return ResponseEntity.ok(
        new CategoryDeletedResponse(
            "Category and related items deleted", CategoryResponse.from(category)));
  }

  public record CategoryNameRequest(
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name) {}

  public record CategoryResponse(UUID id, String name, String createdBy, Instant createdAt) {

    public static CategoryResponse from(Category category) {
      return new CategoryResponse(
          category.getId(), category.getName(), category.getCreatedBy(), category.getCreatedAt());
    }
  }

  public record CategoryListResponse(List<CategoryResponse> categories) {}

  public record CategoryNamesResponse(List<String> categories) {}

  public record CategoryEnvelope(CategoryResponse category) {}

  public record CategoryDeletedResponse(String message, CategoryResponse category) {}
}
