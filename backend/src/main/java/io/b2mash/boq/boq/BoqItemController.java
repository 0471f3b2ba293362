package io.b2mash.boq.boq;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class BoqItemController {

  private final BoqItemService itemService;

  public BoqItemController(BoqItemService itemService) {
    this.itemService = itemService;
  }

  @PostMapping("/api/boq-items")
  public ResponseEntity<ItemResponse> addItem(@Valid @RequestBody CreateItemRequest request) {
    var item =
        itemService.addItem(
            request.projectId(), request.versionId(), request.estimator(), request.tableData());
    return ResponseEntity.created(URI.create("/api/boq-items/" + item.getId()))
        .body(ItemResponse.from(item));
  }

  @PutMapping("/api/boq-items/{id}")
  public ResponseEntity<ItemResponse> updateItem(
      @PathVariable UUID id, @Valid @RequestBody UpdateItemRequest request) {
    return ResponseEntity.ok(ItemResponse.from(itemService.updateItem(id, request.tableData())));
  }

  @DeleteMapping("/api/boq-items/{id}")
  public ResponseEntity<BoqProjectController.MessageResponse> deleteItem(@PathVariable UUID id) {
    itemService.deleteItem(id);
    return ResponseEntity.ok(new BoqProjectController.MessageResponse("Item deleted"));
  }

  @GetMapping("/api/boq-versions/{versionId}/items")
  public ResponseEntity<ItemListResponse> listVersionItems(@PathVariable UUID versionId) {
    var items = itemService.listItemsForVersion(versionId).stream().map(ItemResponse::from).toList();
    return ResponseEntity.ok(new ItemListResponse(items));
  }

  @GetMapping("/api/boq-projects/{projectId}/items")
  public ResponseEntity<ItemListResponse> listProjectItems(@PathVariable UUID projectId) {
    var items = itemService.listItemsForProject(projectId).stream().map(ItemResponse::from).toList();
    return ResponseEntity.ok(new ItemListResponse(items));
  }

  /** {@code estimator} names the estimator that produced {@code tableData}, e.g. "flooring". */
  public record CreateItemRequest(
      @NotNull(message = "projectId is required") UUID projectId,
      UUID versionId,
      @NotBlank(message = "estimator is required")
          @Size(max = 100, message = "estimator must be at most 100 characters")
          String estimator,
      Map<String, Object> tableData) {}

  public record UpdateItemRequest(
      @NotNull(message = "tableData is required") Map<String, Object> tableData) {}

  public record ItemResponse(
      UUID id,
      UUID projectId,
      UUID versionId,
      String estimator,
      Map<String, Object> tableData,
      boolean userAdded,
      Instant createdAt,
      Instant updatedAt) {

    public static ItemResponse from(BoqItem item) {
      return new ItemResponse(
          item.getId(),
          item.getProjectId(),
          item.getVersionId(),
          item.getEstimatorKind(),
          item.getPayload(),
          item.isUserAdded(),
          item.getCreatedAt(),
          item.getUpdatedAt());
    }
  }

  public record ItemListResponse(List<ItemResponse> items) {}
}
