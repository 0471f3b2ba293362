package io.b2mash.boq.submission;

import io.b2mash.boq.security.ActorContext;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MaterialSubmissionController {

  private final MaterialSubmissionService submissionService;

  public MaterialSubmissionController(MaterialSubmissionService submissionService) {
    this.submissionService = submissionService;
  }

  @PostMapping("/api/material-submissions")
  @PreAuthorize("hasAnyRole('SUPPLIER', 'PURCHASE_TEAM', 'ADMIN')")
  public ResponseEntity<SubmissionEnvelope> createSubmission(
      @Valid @RequestBody CreateSubmissionRequest request) {
    var submission = submissionService.submit(request.toNewSubmission());
    return ResponseEntity.created(URI.create("/api/material-submissions/" + submission.getId()))
        .body(new SubmissionEnvelope(SubmissionResponse.from(submission)));
  }

  @GetMapping("/api/material-submissions-pending-approval")
  @PreAuthorize("hasAnyRole('ADMIN', 'SOFTWARE_TEAM', 'PURCHASE_TEAM')")
  public ResponseEntity<PendingSubmissionListResponse> listPending() {
    var entries =
        submissionService.listPending().stream()
            .map(
                row ->
                    new PendingSubmissionEntry(
                        row.submission().getId(), "pending", SubmissionResponse.from(row)))
            .toList();
    return ResponseEntity.ok(new PendingSubmissionListResponse(entries));
  }

  @GetMapping("/api/supplier/my-submissions")
  @PreAuthorize("hasRole('SUPPLIER')")
  public ResponseEntity<SubmissionListResponse> listMySubmissions() {
    var submissions =
        submissionService.listForSupplier(ActorContext.getActorId()).stream()
            .map(SubmissionResponse::from)
            .toList();
    return ResponseEntity.ok(new SubmissionListResponse(submissions));
  }

  @PostMapping("/api/material-submissions/{id}/approve")
  @PreAuthorize("hasAnyRole('ADMIN', 'SOFTWARE_TEAM', 'PURCHASE_TEAM')")
  public ResponseEntity<ApprovalResponse> approveSubmission(@PathVariable UUID id) {
    var approval = submissionService.approve(id);
    return ResponseEntity.ok(
        new ApprovalResponse(
            SubmissionResponse.from(approval.submission()),
            new MaterialRef(approval.material().getId())));
  }

  @PostMapping("/api/material-submissions/{id}/reject")
  @PreAuthorize("hasAnyRole('ADMIN', 'SOFTWARE_TEAM', 'PURCHASE_TEAM')")
  public ResponseEntity<SubmissionEnvelope> rejectSubmission(
      @PathVariable UUID id, @RequestBody(required = false) RejectRequest request) {
    String reason = request != null ? request.reason() : null;
    var submission = submissionService.reject(id, reason);
    return ResponseEntity.ok(new SubmissionEnvelope(SubmissionResponse.from(submission)));
  }

  /** templateId and shopId are checked by the service so both report the same 400 shape. */
  public record CreateSubmissionRequest(
      UUID templateId,
      UUID shopId,
      @DecimalMin(value = "0", message = "rate must not be negative") BigDecimal rate,
      @Size(max = 50) String unit,
      @Size(max = 255) String brandName,
      @Size(max = 255) String modelNumber,
      @Size(max = 255) String subcategory,
      String technicalSpecification) {

    NewSubmission toNewSubmission() {
      return new NewSubmission(
          templateId,
          shopId,
          rate,
          unit,
          brandName,
          modelNumber,
          subcategory,
          technicalSpecification);
    }
  }

  public record RejectRequest(String reason) {}

  public record SubmissionResponse(
      UUID id,
      UUID templateId,
      String templateName,
      String templateCode,
      UUID shopId,
      String shopName,
      BigDecimal rate,
      String unit,
      String brandName,
      String modelNumber,
      String subcategory,
      String technicalSpecification,
      String submittedBy,
      Instant submittedAt,
      Boolean approved,
      String status,
      String approvalReason,
      String reviewedBy,
      Instant reviewedAt,
      UUID materialId) {

    public static SubmissionResponse from(MaterialSubmission submission) {
      return from(submission, null, null, null);
    }

    public static SubmissionResponse from(SubmissionWithNames row) {
      return from(row.submission(), row.templateName(), row.templateCode(), row.shopName());
    }

    private static SubmissionResponse from(
        MaterialSubmission s, String templateName, String templateCode, String shopName) {
      return new SubmissionResponse(
          s.getId(),
          s.getTemplateId(),
          templateName,
          templateCode,
          s.getShopId(),
          shopName,
          s.getRate(),
          s.getUnit(),
          s.getBrandName(),
          s.getModelNumber(),
          s.getSubcategory(),
          s.getTechnicalSpecification(),
          s.getSubmittedBy(),
          s.getSubmittedAt(),
          s.getApproved(),
          s.getStatus().wireValue(),
          s.getApprovalReason(),
          s.getReviewedBy(),
          s.getReviewedAt(),
          s.getMaterialId());
    }
  }

  public record MaterialRef(UUID id) {}

  public record ApprovalResponse(SubmissionResponse submission, MaterialRef material) {}

  public record SubmissionEnvelope(SubmissionResponse submission) {}

  public record SubmissionListResponse(List<SubmissionResponse> submissions) {}

  public record PendingSubmissionEntry(UUID id, String status, SubmissionResponse submission) {}

  public record PendingSubmissionListResponse(List<PendingSubmissionEntry> submissions) {}
}
