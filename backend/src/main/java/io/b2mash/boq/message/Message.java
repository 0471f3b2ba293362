package io.b2mash.boq.message;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** A contact message left by a signed-in caller for the review staff. */
@Entity
@Table(name = "messages")
public class Message {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "sender_id")
  private String senderId;

  @Column(name = "sender_name", nullable = false, length = 255)
  private String senderName;

  @Column(name = "sender_email", length = 255)
  private String senderEmail;

  @Column(name = "sender_role", length = 50)
  private String senderRole;

  @Column(name = "message", nullable = false, columnDefinition = "TEXT")
  private String message;

  @Column(name = "info", columnDefinition = "TEXT")
  private String info;

  @Column(name = "is_read", nullable = false)
  private boolean read;

  @Column(name = "sent_at", nullable = false)
  private Instant sentAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Message() {}

  public Message(
      String senderId,
      String senderName,
      String senderEmail,
      String senderRole,
      String message,
      String info) {
    this.senderId = senderId;
    this.senderName = senderName;
    this.senderEmail = senderEmail;
    this.senderRole = senderRole;
    this.message = message;
    this.info = info;
    this.read = false;
    this.sentAt = Instant.now();
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getSenderId() {
    return senderId;
  }

  public String getSenderName() {
    return senderName;
  }

  public String getSenderEmail() {
    return senderEmail;
  }

  public String getSenderRole() {
    return senderRole;
  }

  public String getMessage() {
    return message;
  }

  public String getInfo() {
    return info;
  }

  public boolean isRead() {
    return read;
  }

  public Instant getSentAt() {
    return sentAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public boolean isSentBy(String actorId) {
    return actorId != null && actorId.equals(senderId);
  }
}
