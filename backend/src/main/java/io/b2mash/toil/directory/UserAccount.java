package io.b2mash.toil.directory;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;

/** Login account behind a JWT subject. Only the enabled flag matters to approval routing. */
@Entity
@Table(name = "user_accounts")
public class UserAccount {

  @Id
  @Column(name = "user_id", length = 255)
  private String userId;

  @Column(name = "email", length = 255)
  private String email;

  @Column(name = "enabled", nullable = false)
  private boolean enabled;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected UserAccount() {}

  public UserAccount(String userId, String email, boolean enabled) {
    this.userId = Objects.requireNonNull(userId, "userId must not be null");
    this.email = email;
    this.enabled = enabled;
  }

  @PrePersist
  void onPrePersist() {
    var now = Instant.now();
    this.createdAt = now;
    this.updatedAt = now;
  }

  @PreUpdate
  void onPreUpdate() {
    this.updatedAt = Instant.now();
  }

  public void update(String email, boolean enabled) {
    this.email = email;
    this.enabled = enabled;
  }

  public String getUserId() {
    return userId;
  }

  public String getEmail() {
    return email;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
