package io.b2mash.toil.audit;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder that constructs an {@link AuditEventRecord}. Auto-populates actor, source, IP address,
 * and user agent from the current security and request context when available.
 *
 * <p>Required fields: {@code eventType}, {@code entityType}, {@code entityId}.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("timesheet.approved")
 *     .entityType("timesheet")
 *     .entityId(timesheet.getId())
 *     .details(Map.of("toil_hours", timesheet.getTotalToilHours()))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private static final int MAX_USER_AGENT_LENGTH = 500;

  private String eventType;
  private String entityType;
  private UUID entityId;
  private String actorId;
  private String source;
  private Map<String, Object> details;

  private boolean actorIdExplicitlySet;
  private boolean sourceExplicitlySet;

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

  public AuditEventBuilder actorId(String actorId) {
    this.actorId = actorId;
    this.actorIdExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder source(String source) {
    this.source = source;
    this.sourceExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  /**
   * Builds the record. {@code actorId} defaults to the authenticated principal's name and {@code
   * source} to "API" inside an HTTP request, "INTERNAL" otherwise. Background accrual jobs have
   * neither and are recorded as SYSTEM.
   */
  public AuditEventRecord build() {
    String resolvedActorId = this.actorId;
    if (!actorIdExplicitlySet) {
      Authentication auth = SecurityContextHolder.getContext().getAuthentication();
      if (auth != null && auth.isAuthenticated()) {
        resolvedActorId = auth.getName();
      }
    }
    String resolvedActorType = resolvedActorId != null ? "USER" : "SYSTEM";

    HttpServletRequest request = resolveHttpRequest();

    String resolvedSource = this.source;
    if (!sourceExplicitlySet) {
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
        resolvedActorType,
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
