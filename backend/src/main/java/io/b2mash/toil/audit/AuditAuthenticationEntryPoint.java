package io.b2mash.toil.audit;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.oauth2.server.resource.web.BearerTokenAuthenticationEntryPoint;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Logs a structured warning for every rejected bearer token, then delegates to {@link
 * BearerTokenAuthenticationEntryPoint} for the 401. Failures are logged only, not written to
 * {@code audit_events}: an unauthenticated request has no actor to attribute.
 */
@Component
public class AuditAuthenticationEntryPoint implements AuthenticationEntryPoint {

  private static final Logger log = LoggerFactory.getLogger(AuditAuthenticationEntryPoint.class);

  private final BearerTokenAuthenticationEntryPoint delegate =
      new BearerTokenAuthenticationEntryPoint();

  @Override
  public void commence(
      HttpServletRequest request,
      HttpServletResponse response,
      AuthenticationException authException) {
    log.warn(
        "security.auth_failed: path={}, method={}, reason={}",
        request.getRequestURI(),
        request.getMethod(),
        authException.getMessage());

    delegate.commence(request, response, authException);
  }
}
