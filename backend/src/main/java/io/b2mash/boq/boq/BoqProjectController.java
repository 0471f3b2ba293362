package io.b2mash.boq.boq;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/boq-projects")
public class BoqProjectController {

  private final BoqProjectService projectService;

  public BoqProjectController(BoqProjectService projectService) {
    this.projectService = projectService;
  }

  @GetMapping
  public ResponseEntity<ProjectListResponse> listProjects() {
    var projects = projectService.listProjects().stream().map(ProjectResponse::from).toList();
    return ResponseEntity.ok(new ProjectListResponse(projects));
  }

  @GetMapping("/{id}")
  public ResponseEntity<ProjectResponse> getProject(@PathVariable UUID id) {
    return ResponseEntity.ok(ProjectResponse.from(projectService.getProject(id)));
  }

  @PostMapping
  public ResponseEntity<ProjectResponse> createProject(
      @Valid @RequestBody CreateProjectRequest request) {
    var project =
        projectService.createProject(
            request.name(), request.client(), request.budget(), request.location());
    return ResponseEntity.created(URI.create("/api/boq-projects/" + project.getId()))
        .body(ProjectResponse.from(project));
  }

  @PutMapping("/{id}")
  public ResponseEntity<ProjectResponse> updateProject(
      @PathVariable UUID id, @Valid @RequestBody UpdateProjectRequest request) {
    var project =
        projectService.updateProject(
            id,
            request.name(),
            request.client(),
            request.budget(),
            request.location(),
            request.status());
    return ResponseEntity.ok(ProjectResponse.from(project));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<MessageResponse> deleteProject(@PathVariable UUID id) {
    projectService.deleteProject(id);
    return ResponseEntity.ok(new MessageResponse("Project and all related data deleted"));
  }

  public record CreateProjectRequest(
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      @Size(max = 255, message = "client must be at most 255 characters") String client,
      @PositiveOrZero(message = "budget must not be negative") BigDecimal budget,
      @Size(max = 255, message = "location must be at most 255 characters") String location) {}

  public record UpdateProjectRequest(
      @Size(max = 255, message = "name must be at most 255 characters") String name,
      @Size(max = 255, message = "client must be at most 255 characters") String client,
      @PositiveOrZero(message = "budget must not be negative") BigDecimal budget,
      @Size(max = 255, message = "location must be at most 255 characters") String location,
      String status) {}

  public record ProjectResponse(
      UUID id,
      String name,
      String client,
      BigDecimal budget,
      String location,
      String status,
      String createdBy,
      Instant createdAt,
      Instant updatedAt) {

    public static ProjectResponse from(BoqProject project) {
      return new ProjectResponse(
          project.getId(),
          project.getName(),
          project.getClient(),
          project.getBudget(),
          project.getLocation(),
          project.getStatus().wireValue(),
          project.getCreatedBy(),
          project.getCreatedAt(),
          project.getUpdatedAt());
    }
  }

  public record ProjectListResponse(List<ProjectResponse> projects) {}

  public record MessageResponse(String message) {}
}
