package io.b2mash.boq.message;

import io.b2mash.boq.audit.AuditEventBuilder;
import io.b2mash.boq.audit.AuditService;
import io.b2mash.boq.exception.ResourceNotFoundException;
import io.b2mash.boq.security.ActorContext;
import io.b2mash.boq.security.Roles;
import io.b2mash.boq.taxonomy.TaxonomyNames;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Contact messages. Staff read and delete every message; any other caller only sees and deletes
 * the messages they sent.
 */
@Service
public class MessageService {

  private static final Logger log = LoggerFactory.getLogger(MessageService.class);

  private final MessageRepository messageRepository;
  private final AuditService auditService;

  public MessageService(MessageRepository messageRepository, AuditService auditService) {
    this.messageRepository = messageRepository;
    this.auditService = auditService;
  }

  @Transactional
  public Message sendMessage(String senderName, String senderEmail, String text, String info) {
    String name = TaxonomyNames.require(senderName, "senderName");
    String body = TaxonomyNames.require(text, "message");
    String role = ActorContext.getRole() != null ? ActorContext.getRole() : Roles.USER;

    var message =
        messageRepository.save(
            new Message(
                ActorContext.getActorId(),
                name,
                TaxonomyNames.trimToNull(senderEmail),
                role,
                body,
                info));

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("message.sent")
            .entityType("message")
            .entityId(message.getId())
            .details(Map.of("sender_name", name))
            .build());

    log.info("Message {} sent by {} ({})", message.getId(), message.getSenderId(), role);
    return message;
  }

  @Transactional(readOnly = true)
  public List<Message> listMessages() {
    if (ActorContext.isStaff()) {
      return messageRepository.findAllByOrderByCreatedAtDesc();
    }
    String actorId = ActorContext.getActorId();
    if (actorId == null) {
      return List.of();
    }
    return messageRepository.findBySenderIdOrderByCreatedAtDesc(actorId);
  }

  /** Foreign messages are reported as missing to non-staff callers. */
  @Transactional
  public void deleteMessage(UUID id) {
    var message =
        messageRepository
            .findById(id)
            .filter(m -> ActorContext.isStaff() || m.isSentBy(ActorContext.getActorId()))
            .orElseThrow(() -> new ResourceNotFoundException("Message", id));

    messageRepository.delete(message);

    auditService.log(
        AuditEventBuilder.builder()
            .eventType("message.deleted")
            .entityType("message")
            .entityId(id)
            .details(Map.of("sender_id", String.valueOf(message.getSenderId())))
            .build());

    log.info("Deleted message {}", id);
  }
}
