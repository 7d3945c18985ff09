package io.b2mash.toil.security;

/**
 * Role constants used across authentication and access control.
 *
 * <p>Roles arrive as plain names in the JWT {@code roles} claim. Spring authorities are the {@code
 * ROLE_} prefixed versions used by {@code @PreAuthorize}.
 */
public final class Roles {

  // JWT "roles" claim values
  public static final String TOIL_ADMIN = "toil_admin";
  public static final String EMPLOYEE = "employee";

  // Spring Security granted authorities
  public static final String AUTHORITY_TOIL_ADMIN = "ROLE_TOIL_ADMIN";
  public static final String AUTHORITY_EMPLOYEE = "ROLE_EMPLOYEE";

  private Roles() {}
}
