package io.b2mash.boq.message;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/messages")
public class MessageController {

  private final MessageService messageService;

  public MessageController(MessageService messageService) {
    this.messageService = messageService;
  }

  @PostMapping
  public ResponseEntity<MessageEnvelope> sendMessage(
      @Valid @RequestBody SendMessageRequest request) {
    var message =
        messageService.sendMessage(
            request.senderName(), request.senderEmail(), request.message(), request.info());
    return ResponseEntity.created(URI.create("/api/messages/" + message.getId()))
        .body(new MessageEnvelope(MessageResponse.from(message)));
  }

  @GetMapping
  public ResponseEntity<MessageListResponse> listMessages() {
    var messages = messageService.listMessages().stream().map(MessageResponse::from).toList();
    return ResponseEntity.ok(new MessageListResponse(messages));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<DeletedResponse> deleteMessage(@PathVariable UUID id) {
    messageService.deleteMessage(id);
    return ResponseEntity.ok(new DeletedResponse("Message deleted successfully"));
  }

  public record SendMessageRequest(
      @NotBlank(message = "senderName is required")
          @Size(max = 255, message = "senderName must be at most 255 characters")
          String senderName,
      @Size(max = 255) String senderEmail,
      @NotBlank(message = "message is required") String message,
      String info) {}

  public record MessageResponse(
      UUID id,
      String senderName,
      String senderEmail,
      String senderRole,
      String message,
      String info,
      boolean read,
      Instant sentAt,
      Instant createdAt) {

    public static MessageResponse from(Message message) {
      return new MessageResponse(
          message.getId(),
          message.getSenderName(),
          message.getSenderEmail(),
          message.getSenderRole(),
          message.getMessage(),
          message.getInfo(),
          message.isRead(),
          message.getSentAt(),
          message.getCreatedAt());
    }
  }

  public record MessageEnvelope(MessageResponse message) {}

  public record MessageListResponse(List<MessageResponse> messages) {}

  public record DeletedResponse(String message) {}
}
