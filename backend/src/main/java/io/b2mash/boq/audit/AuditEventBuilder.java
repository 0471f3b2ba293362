package io.b2mash.boq.audit;

import io.b2mash.boq.security.ActorContext;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder for {@link AuditEventRecord}. Fills actor, source, IP address and user agent from the
 * current request when they are not set explicitly.
 *
 * <pre>{@code
 * auditService.log(AuditEventBuilder.builder()
 *     .eventType("shop.approved")
 *     .entityType("shop")
 *     .entityId(shop.getId())
 *     .build());
 * }</pre>
 */
public class AuditEventBuilder {

  private static final int MAX_USER_AGENT_LENGTH = 500;

  private String eventType;
  private String entityType;
  private UUID entityId;
  private String actorId;
  private String actorRole;
  private String source;
  private Map<String, Object> details;

  private boolean actorExplicitlySet;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder actor(String actorId, String actorRole) {
    this.actorId = actorId;
    this.actorRole = actorRole;
    this.actorExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder source(String source) {
    this.source = source;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  /**
   * Builds the record. Unless set explicitly, the actor comes from {@link ActorContext}, {@code
   * source} is "API" inside an HTTP request and "INTERNAL" otherwise, and the IP address and user
   * agent are read from the current servlet request.
   */
  public AuditEventRecord build() {
    String resolvedActorId = actorId;
    String resolvedActorRole = actorRole;
    if (!actorExplicitlySet) {
      resolvedActorId = ActorContext.getActorId();
      resolvedActorRole = ActorContext.getRole();
    }

    HttpServletRequest request = resolveHttpRequest();

    String resolvedSource = source;
    if (resolvedSource == null) {
      resolvedSource = request != null ? "API" : "INTERNAL";
    }

    String resolvedIpAddress = null;
    String resolvedUserAgent = null;
    if (request != null) {
      resolvedIpAddress = request.getRemoteAddr();
      String ua = request.getHeader("User-Agent");
      if (ua != null && ua.length() > MAX_USER_AGENT_LENGTH) {
        ua = ua.substring(0, MAX_USER_AGENT_LENGTH);
      }
      resolvedUserAgent = ua;
    }

    return new AuditEventRecord(
        eventType,
        entityType,
        entityId,
        resolvedActorId,
        resolvedActorRole,
        resolvedSource,
        resolvedIpAddress,
        resolvedUserAgent,
        details);
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}
