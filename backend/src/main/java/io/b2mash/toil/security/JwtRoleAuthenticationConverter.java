package io.b2mash.toil.security;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.core.convert.converter.Converter;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

@Component
public class JwtRoleAuthenticationConverter implements Converter<Jwt, AbstractAuthenticationToken> {

  static final String ROLES_CLAIM = "roles";

  private static final Map<String, String> ROLE_MAPPING =
      Map.of(
          Roles.TOIL_ADMIN, Roles.AUTHORITY_TOIL_ADMIN,
          Roles.EMPLOYEE, Roles.AUTHORITY_EMPLOYEE);

  @Override
  public AbstractAuthenticationToken convert(Jwt jwt) {
    Collection<GrantedAuthority> authorities = extractAuthorities(jwt);
    return new JwtAuthenticationToken(jwt, authorities, jwt.getSubject());
  }

  private Collection<GrantedAuthority> extractAuthorities(Jwt jwt) {
    List<String> roles = jwt.getClaimAsStringList(ROLES_CLAIM);
    if (roles == null) {
      // Every authenticated caller is at least an employee
      return List.of(new SimpleGrantedAuthority(Roles.AUTHORITY_EMPLOYEE));
    }
    List<GrantedAuthority> authorities =
        roles.stream()
            .map(ROLE_MAPPING::get)
            .filter(Objects::nonNull)
            .distinct()
            .map(authority -> (GrantedAuthority) new SimpleGrantedAuthority(authority))
            .toList();
    return authorities.isEmpty()
        ? List.of(new SimpleGrantedAuthority(Roles.AUTHORITY_EMPLOYEE))
        : authorities;
  }
}
