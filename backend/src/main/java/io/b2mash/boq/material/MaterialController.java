package io.b2mash.boq.material;

import io.b2mash.boq.approval.ApprovalOrigin;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.Map;
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
public class MaterialController {

  private final MaterialService materialService;

  public MaterialController(MaterialService materialService) {
    this.materialService = materialService;
  }

  @GetMapping("/api/materials")
  public ResponseEntity<MaterialListResponse> listMaterials() {
    var materials =
        materialService.listApprovedMaterials().stream().map(MaterialResponse::from).toList();
    return ResponseEntity.ok(new MaterialListResponse(materials));
  }

  @GetMapping("/api/materials/{id}")
  public ResponseEntity<MaterialEnvelope> getMaterial(@PathVariable UUID id) {
    return ResponseEntity.ok(
        new MaterialEnvelope(MaterialResponse.from(materialService.getMaterial(id))));
  }

  @GetMapping("/api/materials-pending-approval")
  @PreAuthorize("hasAnyRole('ADMIN', 'SOFTWARE_TEAM', 'PURCHASE_TEAM')")
  public ResponseEntity<PendingMaterialListResponse> listPendingMaterials() {
    var entries =
        materialService.listPendingMaterials().stream()
            .map(m -> new PendingMaterialEntry(m.getId(), "pending", MaterialResponse.from(m)))
            .toList();
    return ResponseEntity.ok(new PendingMaterialListResponse(entries));
  }

  @PostMapping("/api/materials")
  @PreAuthorize("isAuthenticated()")
  public ResponseEntity<MaterialEnvelope> submitMaterial(
      @Valid @RequestBody CreateMaterialRequest request) {
    var material = materialService.submitMaterial(request.toDetails());
    return ResponseEntity.created(URI.create("/api/materials/" + material.getId()))
        .body(new MaterialEnvelope(MaterialResponse.from(material)));
  }

  @PutMapping("/api/materials/{id}")
  @PreAuthorize("isAuthenticated()")
  public ResponseEntity<MaterialEnvelope> updateMaterial(
      @PathVariable UUID id, @Valid @RequestBody UpdateMaterialRequest request) {
    var material = materialService.updateMaterial(id, request.toDetails());
    return ResponseEntity.ok(new MaterialEnvelope(MaterialResponse.from(material)));
  }

  @DeleteMapping("/api/materials/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'SOFTWARE_TEAM')")
  public ResponseEntity<MessageResponse> deleteMaterial(@PathVariable UUID id) {
    materialService.deleteMaterial(id);
    return ResponseEntity.ok(new MessageResponse("deleted"));
  }

  @PostMapping("/api/materials/{id}/approve")
  @PreAuthorize("hasAnyRole('ADMIN', 'SOFTWARE_TEAM', 'PURCHASE_TEAM')")
  public ResponseEntity<MaterialEnvelope> approveMaterial(@PathVariable UUID id) {
    return ResponseEntity.ok(
        new MaterialEnvelope(MaterialResponse.from(materialService.approveMaterial(id))));
  }

  @PostMapping("/api/materials/{id}/reject")
  @PreAuthorize("hasAnyRole('ADMIN', 'SOFTWARE_TEAM', 'PURCHASE_TEAM')")
  public ResponseEntity<MaterialEnvelope> rejectMaterial(
      @PathVariable UUID id, @RequestBody(required = false) RejectRequest request) {
    String reason = request != null ? request.reason() : null;
    return ResponseEntity.ok(
        new MaterialEnvelope(MaterialResponse.from(materialService.rejectMaterial(id, reason))));
  }

  public record CreateMaterialRequest(
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      @Size(max = 100) String code,
      @DecimalMin(value = "0", message = "rate must not be negative") BigDecimal rate,
      @NotNull(message = "shopId is required") UUID shopId,
      @Size(max = 50) String unit,
      UUID categoryId,
      UUID subcategoryId,
      UUID productId,
      @Size(max = 255) String brandName,
      @Size(max = 255) String modelNumber,
      String technicalSpecification,
      String image,
      Map<String, Object> attributes) {

    MaterialDetails toDetails() {
      return new MaterialDetails(
          name,
          code,
          rate,
          shopId,
          unit,
          categoryId,
          subcategoryId,
          productId,
          brandName,
          modelNumber,
          technicalSpecification,
          image,
          attributes);
    }
  }

  public record UpdateMaterialRequest(
      @Size(max = 255, message = "name must be at most 255 characters") String name,
      @Size(max = 100) String code,
      @DecimalMin(value = "0", message = "rate must not be negative") BigDecimal rate,
      UUID shopId,
      @Size(max = 50) String unit,
      UUID categoryId,
      UUID subcategoryId,
      UUID productId,
      @Size(max = 255) String brandName,
      @Size(max = 255) String modelNumber,
      String technicalSpecification,
      String image,
      Map<String, Object> attributes) {

    MaterialDetails toDetails() {
      return new MaterialDetails(
          name,
          code,
          rate,
          shopId,
          unit,
          categoryId,
          subcategoryId,
          productId,
          brandName,
          modelNumber,
          technicalSpecification,
          image,
          attributes);
    }
  }

  public record RejectRequest(String reason) {}

  public record MaterialResponse(
      UUID id,
      String name,
      String code,
      BigDecimal rate,
      UUID shopId,
      String unit,
      UUID categoryId,
      UUID subcategoryId,
      UUID productId,
      String brandName,
      String modelNumber,
      String technicalSpecification,
      String image,
      Map<String, Object> attributes,
      UUID templateId,
      ApprovalOrigin origin,
      boolean approved,
      String approvalReason,
      String createdBy,
      Instant createdAt,
      Instant updatedAt) {

    public static MaterialResponse from(Material material) {
      return new MaterialResponse(
          material.getId(),
          material.getName(),
          material.getCode(),
          material.getRate(),
          material.getShopId(),
          material.getUnit(),
          material.getCategoryId(),
          material.getSubcategoryId(),
          material.getProductId(),
          material.getBrandName(),
          material.getModelNumber(),
          material.getTechnicalSpecification(),
          material.getImage(),
          material.getAttributes(),
          material.getTemplateId(),
          material.getOrigin(),
          material.isApproved(),
          material.getApprovalReason(),
          material.getCreatedBy(),
          material.getCreatedAt(),
          material.getUpdatedAt());
    }
  }

  public record MaterialListResponse(List<MaterialResponse> materials) {}

  public record MaterialEnvelope(MaterialResponse material) {}

  public record PendingMaterialEntry(UUID id, String status, MaterialResponse material) {}

  public record PendingMaterialListResponse(List<PendingMaterialEntry> materials) {}

  public record MessageResponse(String message) {}
}
