package io.b2mash.toil.security;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;
import org.junit.jupiter.api.Test;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jwt.Jwt;

class JwtRoleAuthenticationConverterTest {

  private final JwtRoleAuthenticationConverter converter = new JwtRoleAuthenticationConverter();

  @Test
  void convert_adminRole_grantsAdminAuthority() {
    var token = converter.convert(jwt(claims -> claims.claim("roles", List.of("toil_admin"))));

    assertThat(token.getName()).isEqualTo("user_alice");
    assertThat(authorities(token.getAuthorities())).containsExactly(Roles.AUTHORITY_TOIL_ADMIN);
    assertThat(CallerIdentity.from(token).isPrivileged()).isTrue();
  }

  @Test
  void convert_noRolesClaim_defaultsToEmployee() {
    var token = converter.convert(jwt(claims -> {}));

    assertThat(authorities(token.getAuthorities())).containsExactly(Roles.AUTHORITY_EMPLOYEE);
    assertThat(CallerIdentity.from(token).isPrivileged()).isFalse();
  }

  @Test
  void convert_unknownRoles_areIgnored() {
    var token =
        converter.convert(jwt(claims -> claims.claim("roles", List.of("billing", "employee"))));

    assertThat(authorities(token.getAuthorities())).containsExactly(Roles.AUTHORITY_EMPLOYEE);
  }

  private static Jwt jwt(Consumer<Jwt.Builder> claims) {
    var builder =
        Jwt.withTokenValue("token")
            .header("alg", "RS256")
            .subject("user_alice")
            .issuedAt(Instant.now())
            .expiresAt(Instant.now().plusSeconds(300));
    claims.accept(builder);
    return builder.build();
  }

  private static List<String> authorities(Collection<? extends GrantedAuthority> granted) {
    return granted.stream().map(GrantedAuthority::getAuthority).toList();
  }
}
