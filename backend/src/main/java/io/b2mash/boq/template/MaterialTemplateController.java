package io.b2mash.boq.template;

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
@RequestMapping("/api/material-templates")
public class MaterialTemplateController {

  private final MaterialTemplateService templateService;

  public MaterialTemplateController(MaterialTemplateService templateService) {
    this.templateService = templateService;
  }

  @GetMapping
  public ResponseEntity<TemplateListResponse> listTemplates() {
    var templates =
        templateService.listTemplates().stream().map(TemplateResponse::from).toList();
    return ResponseEntity.ok(new TemplateListResponse(templates));
  }

  @PostMapping
  @PreAuthorize("hasAnyRole('ADMIN', 'SOFTWARE_TEAM', 'PURCHASE_TEAM')")
  public ResponseEntity<TemplateEnvelope> createTemplate(
      @Valid @RequestBody CreateTemplateRequest request) {
    var template =
        templateService.createTemplate(request.name(), request.code(), request.categoryId());
    return ResponseEntity.created(URI.create("/api/material-templates/" + template.getId()))
        .body(new TemplateEnvelope(TemplateResponse.from(template)));
  }

  @PutMapping("/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'SOFTWARE_TEAM')")
  public ResponseEntity<TemplateEnvelope> updateTemplate(
      @PathVariable UUID id, @Valid @RequestBody UpdateTemplateRequest request) {
    var template = templateService.updateTemplate(id, request.name(), request.code());
    return ResponseEntity.ok(new TemplateEnvelope(TemplateResponse.from(template)));
  }

  @DeleteMapping("/{id}")
  @PreAuthorize("hasAnyRole('ADMIN', 'SOFTWARE_TEAM')")
  public ResponseEntity<TemplateDeletedResponse> deleteTemplate(@PathVariable UUID id) {
    var template = templateService.deleteTemplate(id);
    return ResponseEntity.ok(
        new TemplateDeletedResponse(
            "Template and related items deleted", TemplateResponse.from(template)));
  }

  public record CreateTemplateRequest(
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      @NotBlank(message = "code is required")
          @Size(max = 100, message = "code must be at most 100 characters")
          String code,
      UUID categoryId) {}

  public record UpdateTemplateRequest(
      @Size(max = 255, message = "name must be at most 255 characters") String name,
      @Size(max = 100, message = "code must be at most 100 characters") String code) {}

  public record TemplateResponse(
      UUID id, String name, String code, UUID categoryId, Instant createdAt, Instant updatedAt) {

    public static TemplateResponse from(MaterialTemplate template) {
      return new TemplateResponse(
          template.getId(),
          template.getName(),
          template.getCode(),
          template.getCategoryId(),
          template.getCreatedAt(),
          template.getUpdatedAt());
    }
  }

  public record TemplateListResponse(List<TemplateResponse> templates) {}

  public record TemplateEnvelope(TemplateResponse template) {}

  public record TemplateDeletedResponse(String message, TemplateResponse template) {}
}
