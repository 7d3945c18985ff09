package io.b2mash.toil.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import java.util.UUID;

/**
 * Signed movement against one allocation: positive credits, negative debits. Entries are
 * append-only; the expiry job flips {@code is_expired} in bulk and nothing else ever changes.
 * {@code fromDate}/{@code toDate} carry the validity window of the allocation the entry belongs
 * to.
 */
@Entity
@Table(name = "leave_ledger_entries")
public class LeaveLedgerEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "employee_id", nullable = false, updatable = false)
  private UUID employeeId;

  @Column(name = "allocation_id", nullable = false, updatable = false)
  private UUID allocationId;

  @Enumerated(EnumType.STRING)
  @Column(name = "transaction_type", nullable = false, updatable = false, length = 40)
  private TransactionType transactionType;

  @Column(name = "transaction_ref", nullable = false, updatable = false)
  private UUID transactionRef;

  @Column(name = "leaves", nullable = false, updatable = false, precision = 10, scale = 3)
  private BigDecimal leaves;

  @Column(name = "is_expired", nullable = false)
  private boolean expired;

  @Column(name = "from_date", nullable = false, updatable = false)
  private LocalDate fromDate;

  @Column(name = "to_date", nullable = false, updatable = false)
  private LocalDate toDate;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected LeaveLedgerEntry() {}

  public LeaveLedgerEntry(
      UUID employeeId,
      UUID allocationId,
      TransactionType transactionType,
      UUID transactionRef,
      BigDecimal leaves,
      LocalDate fromDate,
      LocalDate toDate) {
    this.employeeId = Objects.requireNonNull(employeeId, "employeeId must not be null");
    this.allocationId = Objects.requireNonNull(allocationId, "allocationId must not be null");
    this.transactionType =
        Objects.requireNonNull(transactionType, "transactionType must not be null");
    this.transactionRef = Objects.requireNonNull(transactionRef, "transactionRef must not be null");
    this.leaves = Objects.requireNonNull(leaves, "leaves must not be null");
    this.fromDate = fromDate;
    this.toDate = toDate;
    this.expired = false;
    this.createdAt = Instant.now();
  }

  public boolean isCredit() {
    return leaves.signum() > 0;
  }

  public UUID getId() {
    return id;
  }

  public UUID getEmployeeId() {
    return employeeId;
  }

  public UUID getAllocationId() {
    return allocationId;
  }

  public TransactionType getTransactionType() {
    return transactionType;
  }

  public UUID getTransactionRef() {
    return transactionRef;
  }

  public BigDecimal getLeaves() {
    return leaves;
  }

  public boolean isExpired() {
    return expired;
  }

  public LocalDate getFromDate() {
    return fromDate;
  }

  public LocalDate getToDate() {
    return toDate;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
