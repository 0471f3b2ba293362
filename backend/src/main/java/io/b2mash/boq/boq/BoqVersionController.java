package io.b2mash.boq.boq;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
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
public class BoqVersionController {

  private final BoqVersionService versionService;

  public BoqVersionController(BoqVersionService versionService) {
    this.versionService = versionService;
  }

  @PostMapping("/api/boq-versions")
  public ResponseEntity<VersionResponse> createVersion(
      @Valid @RequestBody CreateVersionRequest request) {
    var version = versionService.createVersion(request.projectId(), request.copyFromVersionId());
    return ResponseEntity.created(URI.create("/api/boq-versions/" + version.getId()))
        .body(VersionResponse.from(version));
  }

  @GetMapping("/api/boq-projects/{projectId}/versions")
  public ResponseEntity<VersionListResponse> listVersions(@PathVariable UUID projectId) {
    var versions =
        versionService.listVersions(projectId).stream().map(VersionResponse::from).toList();
    return ResponseEntity.ok(new VersionListResponse(versions));
  }

  @PutMapping("/api/boq-versions/{id}")
  public ResponseEntity<VersionResponse> updateVersion(
      @PathVariable UUID id, @Valid @RequestBody UpdateVersionRequest request) {
    var version = versionService.updateVersionStatus(id, request.status());
    return ResponseEntity.ok(VersionResponse.from(version));
  }

  @DeleteMapping("/api/boq-versions/{id}")
  public ResponseEntity<BoqProjectController.MessageResponse> deleteVersion(
      @PathVariable UUID id) {
    versionService.deleteVersion(id);
    return ResponseEntity.ok(new BoqProjectController.MessageResponse("Version deleted"));
  }

  @GetMapping("/api/boq-versions/{id}/edits")
  public ResponseEntity<EditsResponse> getEdits(@PathVariable UUID id) {
    return ResponseEntity.ok(new EditsResponse(versionService.getEdits(id)));
  }

  @PutMapping("/api/boq-versions/{id}/edits")
  public ResponseEntity<EditsResponse> saveEdits(
      @PathVariable UUID id, @Valid @RequestBody EditsRequest request) {
    return ResponseEntity.ok(new EditsResponse(versionService.saveEdits(id, request.editedFields())));
  }

  public record CreateVersionRequest(
      @NotNull(message = "projectId is required") UUID projectId, UUID copyFromVersionId) {}

  public record UpdateVersionRequest(@NotBlank(message = "status is required") String status) {}

  public record EditsRequest(
      @NotNull(message = "editedFields is required") Map<String, Object> editedFields) {}

  public record EditsResponse(Map<String, Object> editedFields) {}

  public record VersionResponse(
      UUID id,
      UUID projectId,
      int versionNumber,
      String status,
      String projectName,
      String projectClient,
      Instant createdAt,
      Instant updatedAt) {

    public static VersionResponse from(BoqVersion version) {
      return new VersionResponse(
          version.getId(),
          version.getProjectId(),
          version.getVersionNumber(),
          version.getStatus().wireValue(),
          version.getProjectName(),
          version.getProjectClient(),
          version.getCreatedAt(),
          version.getUpdatedAt());
    }
  }

  public record VersionListResponse(List<VersionResponse> versions) {}
}
