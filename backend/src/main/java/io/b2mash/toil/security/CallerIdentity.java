package io.b2mash.toil.security;

import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;

/**
 * The authenticated caller, passed explicitly into every service operation that makes a permission
 * decision.
 *
 * @param userId the JWT subject; matches {@code Employee.userId}
 * @param authorities Spring authorities held by the caller
 */
public record CallerIdentity(String userId, Set<String> authorities) {

  public CallerIdentity {
    Objects.requireNonNull(userId, "userId must not be null");
    authorities = authorities != null ? Set.copyOf(authorities) : Set.of();
  }

  public static CallerIdentity from(Authentication authentication) {
    Set<String> authorities =
        authentication.getAuthorities().stream()
            .map(GrantedAuthority::getAuthority)
            .collect(Collectors.toSet());
    return new CallerIdentity(authentication.getName(), authorities);
  }

  public static CallerIdentity user(String userId) {
    return new CallerIdentity(userId, Set.of(Roles.AUTHORITY_EMPLOYEE));
  }

  public static CallerIdentity admin(String userId) {
    return new CallerIdentity(userId, Set.of(Roles.AUTHORITY_TOIL_ADMIN));
  }

  /** Privileged callers bypass supervisor and ownership checks. */
  public boolean isPrivileged() {
    return authorities.contains(Roles.AUTHORITY_TOIL_ADMIN);
  }

  public boolean is(String otherUserId) {
    return otherUserId != null && userId.equals(otherUserId);
  }
}
