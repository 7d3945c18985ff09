package io.b2mash.toil.directory;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * An employee as seen by the TOIL ledger. Ids are assigned by the HR directory that feeds this
 * table. The employee row doubles as the lock that serialises allocation changes per employee.
 */
@Entity
@Table(name = "employees")
public class Employee {

  @Id private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "user_id", unique = true, length = 255)
  private String userId;

  @Column(name = "supervisor_id")
  private UUID supervisorId;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private EmployeeStatus status;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Employee() {}

  public Employee(UUID id, String name, String userId, UUID supervisorId) {
    this.id = Objects.requireNonNull(id, "id must not be null");
    this.name = Objects.requireNonNull(name, "name must not be null");
    this.userId = userId;
    this.supervisorId = supervisorId;
    this.status = EmployeeStatus.ACTIVE;
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

  public void updateProfile(
      String name, String userId, UUID supervisorId, EmployeeStatus status) {
    this.name = Objects.requireNonNull(name, "name must not be null");
    this.userId = userId;
    this.supervisorId = supervisorId;
    this.status = status != null ? status : this.status;
  }

  public boolean isActive() {
    return status == EmployeeStatus.ACTIVE;
  }

  public boolean hasSupervisor() {
    return supervisorId != null;
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getUserId() {
    return userId;
  }

  public UUID getSupervisorId() {
    return supervisorId;
  }

  public EmployeeStatus getStatus() {
    return status;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
