package io.b2mash.toil.timesheet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.toil.ToilFixtures;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class TimesheetTest {

  private static final UUID EMPLOYEE_ID = UUID.randomUUID();
  private static final Instant NOW = Instant.parse("2025-03-14T09:00:00Z");

  @Test
  void newTimesheet_isEditableDraftWithoutToil() {
    var timesheet =
        new Timesheet(EMPLOYEE_ID, LocalDate.of(2025, 3, 10), LocalDate.of(2025, 3, 16));

    assertThat(timesheet.getStatus()).isEqualTo(TimesheetStatus.DRAFT);
    assertThat(timesheet.getToilStatus()).isEqualTo(ToilStatus.NOT_APPLICABLE);
    assertThat(timesheet.isEditable()).isTrue();
    assertThat(timesheet.hasToil()).isFalse();
  }

  @Test
  void constructor_rejectsEndBeforeStart() {
    assertThatThrownBy(
            () -> new Timesheet(EMPLOYEE_ID, LocalDate.of(2025, 3, 16), LocalDate.of(2025, 3, 10)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void requestApproval_withToil_movesToPendingAccrual() {
    var timesheet = ToilFixtures.draft(EMPLOYEE_ID, "6");

    timesheet.requestApproval(NOW);

    assertThat(timesheet.getStatus()).isEqualTo(TimesheetStatus.DRAFT);
    assertThat(timesheet.getToilStatus()).isEqualTo(ToilStatus.PENDING_ACCRUAL);
    assertThat(timesheet.isAwaitingApproval()).isTrue();
    assertThat(timesheet.isEditable()).isFalse();
  }

  @Test
  void approve_setsSubmittedAndAwaitsAccrual() {
    var timesheet = ToilFixtures.draft(EMPLOYEE_ID, "6");
    timesheet.requestApproval(NOW);

    timesheet.approve("user_boss", NOW);

    assertThat(timesheet.getStatus()).isEqualTo(TimesheetStatus.SUBMITTED);
    assertThat(timesheet.getToilStatus()).isEqualTo(ToilStatus.PENDING_ACCRUAL);
    assertThat(timesheet.getApprovedBy()).isEqualTo("user_boss");
    assertThat(timesheet.isAwaitingAccrual()).isTrue();
  }

  @Test
  void approve_withoutRequest_throws() {
    var timesheet = ToilFixtures.draft(EMPLOYEE_ID, "6");

    assertThatThrownBy(() -> timesheet.approve("user_boss", NOW))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void reject_clearsRequestAndMakesDraftEditableAgain() {
    var timesheet = ToilFixtures.draft(EMPLOYEE_ID, "6");
    timesheet.requestApproval(NOW);

    timesheet.reject("Hours not agreed in advance");

    assertThat(timesheet.isRejected()).isTrue();
    assertThat(timesheet.getApprovalRequestedAt()).isNull();
    assertThat(timesheet.isEditable()).isTrue();
    assertThat(timesheet.getRejectionReason()).isEqualTo("Hours not agreed in advance");
  }

  @Test
  void resubmitAfterRejection_clearsReason() {
    var timesheet = ToilFixtures.draft(EMPLOYEE_ID, "6");
    timesheet.requestApproval(NOW);
    timesheet.reject("Hours not agreed in advance");

    timesheet.requestApproval(NOW.plusSeconds(60));

    assertThat(timesheet.getToilStatus()).isEqualTo(ToilStatus.PENDING_ACCRUAL);
    assertThat(timesheet.getRejectionReason()).isNull();
  }

  @Test
  void markAccrued_linksAllocation() {
    var timesheet = ToilFixtures.approved(EMPLOYEE_ID, "8");
    var allocationId = UUID.randomUUID();

    timesheet.markAccrued(allocationId, BigDecimal.ONE);

    assertThat(timesheet.isAccrued()).isTrue();
    assertThat(timesheet.getToilStatus()).isEqualTo(ToilStatus.ACCRUED);
    assertThat(timesheet.getToilAllocationId()).isEqualTo(allocationId);
    assertThat(timesheet.isAwaitingAccrual()).isFalse();
  }

  @Test
  void markAccrualFailed_revertsToUnlinkedDraftButKeepsApproval() {
    var timesheet = ToilFixtures.approved(EMPLOYEE_ID, "8");

    timesheet.markAccrualFailed("LOCK_TIMEOUT: busy", true);

    assertThat(timesheet.getStatus()).isEqualTo(TimesheetStatus.DRAFT);
    assertThat(timesheet.getToilStatus()).isEqualTo(ToilStatus.PENDING_ACCRUAL);
    assertThat(timesheet.getToilAllocationId()).isNull();
    assertThat(timesheet.getApprovedAt()).isNotNull();
    assertThat(timesheet.getLastAccrualError()).isEqualTo("LOCK_TIMEOUT: busy");
    assertThat(timesheet.isLastAccrualRetryable()).isTrue();
    assertThat(timesheet.isAwaitingAccrual()).isTrue();
    assertThat(timesheet.isEditable()).isFalse();
  }

  @Test
  void markAccrualFailed_nonRetryable_clearedOnceAccrued() {
    var timesheet = ToilFixtures.approved(EMPLOYEE_ID, "8");

    timesheet.markAccrualFailed("ACCRUAL_INTEGRITY_VIOLATION: check violated", false);

    assertThat(timesheet.isLastAccrualRetryable()).isFalse();
    assertThat(timesheet.isAwaitingAccrual()).isTrue();

    timesheet.markAccrued(UUID.randomUUID(), BigDecimal.ONE);

    assertThat(timesheet.getLastAccrualError()).isNull();
    assertThat(timesheet.isLastAccrualRetryable()).isFalse();
  }

  @Test
  void markAccrualFailed_truncatesLongErrors() {
    var timesheet = ToilFixtures.approved(EMPLOYEE_ID, "8");

    timesheet.markAccrualFailed("x".repeat(5000), true);

    assertThat(timesheet.getLastAccrualError()).hasSize(1000);
  }

  @Test
  void updateUsage_onlyBetweenUsageStates() {
    var timesheet = ToilFixtures.accrued(EMPLOYEE_ID, "8", UUID.randomUUID());

    timesheet.updateUsage(ToilStatus.PARTIALLY_USED);
    assertThat(timesheet.getToilStatus()).isEqualTo(ToilStatus.PARTIALLY_USED);

    assertThatThrownBy(() -> timesheet.updateUsage(ToilStatus.CANCELLED))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void cancel_requiresSubmitted() {
    var draft = ToilFixtures.draft(EMPLOYEE_ID, "8");
    assertThatThrownBy(draft::cancel).isInstanceOf(IllegalStateException.class);

    var accrued = ToilFixtures.accrued(EMPLOYEE_ID, "8", UUID.randomUUID());
    accrued.cancel();
    assertThat(accrued.getStatus()).isEqualTo(TimesheetStatus.CANCELLED);
    assertThat(accrued.getToilStatus()).isEqualTo(ToilStatus.CANCELLED);
  }

  @Test
  void applyToilTotals_refusedOnceSubmitted() {
    var timesheet = ToilFixtures.approved(EMPLOYEE_ID, "8");

    assertThatThrownBy(() -> timesheet.applyToilTotals(BigDecimal.TEN, BigDecimal.ONE))
        .isInstanceOf(IllegalStateException.class);
  }
}
