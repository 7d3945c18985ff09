package io.b2mash.toil.allocation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.toil.RecordingTransactionManager;
import io.b2mash.toil.ToilFixtures;
import io.b2mash.toil.audit.AuditService;
import io.b2mash.toil.directory.EmployeeLockService;
import io.b2mash.toil.exception.InfrastructureException;
import io.b2mash.toil.exception.ResourceConflictException;
import io.b2mash.toil.ledger.LeaveLedgerService;
import io.b2mash.toil.timesheet.Timesheet;
import io.b2mash.toil.timesheet.TimesheetRepository;
import io.b2mash.toil.timesheet.TimesheetStatus;
import io.b2mash.toil.timesheet.ToilStatus;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;

@ExtendWith(MockitoExtension.class)
class AllocationLedgerManagerTest {

  private static final UUID EMPLOYEE_ID = UUID.randomUUID();

  @Mock private TimesheetRepository timesheetRepository;
  @Mock private LeaveAllocationRepository allocationRepository;
  @Mock private LeaveLedgerService ledgerService;
  @Mock private EmployeeLockService employeeLockService;
  @Mock private AuditService auditService;

  private RecordingTransactionManager transactionManager;
  private AllocationLedgerManager manager;

  @BeforeEach
  void setUp() {
    transactionManager = new RecordingTransactionManager();
    manager =
        new AllocationLedgerManager(
            timesheetRepository,
            allocationRepository,
            ledgerService,
            employeeLockService,
            auditService,
            ToilFixtures.properties(),
            ToilFixtures.fixedClock(),
            transactionManager);
  }

  @Test
  void accrue_firstTimesheet_createsSixMonthAllocation() {
    var timesheet = stored(ToilFixtures.approved(EMPLOYEE_ID, "8"));
    when(allocationRepository.findOpenOn(EMPLOYEE_ID, ToilFixtures.TODAY)).thenReturn(List.of());
    when(allocationRepository.save(any(LeaveAllocation.class)))
        .thenAnswer(inv -> assignId(inv.getArgument(0)));

    var result = manager.accrue(timesheet.getId());

    assertThat(result.toppedUp()).isFalse();
    assertThat(result.creditedDays()).isEqualByComparingTo("1");
    assertThat(timesheet.isAccrued()).isTrue();
    assertThat(timesheet.getToilAllocationId()).isEqualTo(result.allocationId());
    verify(employeeLockService).lock(EMPLOYEE_ID);
    verify(ledgerService)
        .appendCredit(any(LeaveAllocation.class), eq(timesheet.getId()), eq(BigDecimal.ONE));
    assertThat(transactionManager.commits()).isEqualTo(1);
  }

  @Test
  void accrue_eightThenSixHoursInSameWindow_singleAllocationOfTwoDays() {
    var first = stored(ToilFixtures.approved(EMPLOYEE_ID, "8"));
    var second = stored(ToilFixtures.approved(EMPLOYEE_ID, "6"));
    var saved = new ArrayList<LeaveAllocation>();
    when(allocationRepository.save(any(LeaveAllocation.class)))
        .thenAnswer(
            inv -> {
              LeaveAllocation allocation = assignId(inv.getArgument(0));
              if (!saved.contains(allocation)) {
                saved.add(allocation);
              }
              return allocation;
            });
    when(allocationRepository.findOpenOn(EMPLOYEE_ID, ToilFixtures.TODAY))
        .thenAnswer(inv -> List.copyOf(saved));

    var firstResult = manager.accrue(first.getId());
    var secondResult = manager.accrue(second.getId());

    assertThat(saved).hasSize(1);
    var allocation = saved.get(0);
    assertThat(firstResult.toppedUp()).isFalse();
    assertThat(secondResult.toppedUp()).isTrue();
    assertThat(secondResult.allocationId()).isEqualTo(firstResult.allocationId());
    assertThat(allocation.getNewLeavesAllocated()).isEqualByComparingTo("2");
    assertThat(allocation.getToDate()).isEqualTo(ToilFixtures.TODAY.plusMonths(6));
    assertThat(second.getToilAllocationId()).isEqualTo(allocation.getId());
  }

  @Test
  void accrue_alreadyAccrued_returnsExistingAllocation() {
    var allocationId = UUID.randomUUID();
    var timesheet = stored(ToilFixtures.accrued(EMPLOYEE_ID, "8", allocationId));

    var result = manager.accrue(timesheet.getId());

    assertThat(result.alreadyAccrued()).isTrue();
    assertThat(result.allocationId()).isEqualTo(allocationId);
    verify(allocationRepository, never()).save(any());
    verify(ledgerService, never()).appendCredit(any(), any(), any());
  }

  @Test
  void accrue_notApproved_isConflictAndLeavesTimesheetAlone() {
    var timesheet = stored(ToilFixtures.draft(EMPLOYEE_ID, "8"));

    assertThatThrownBy(() -> manager.accrue(timesheet.getId()))
        .isInstanceOf(ResourceConflictException.class)
        .hasMessageContaining("NOT_ELIGIBLE_FOR_ACCRUAL");
    assertThat(timesheet.getStatus()).isEqualTo(TimesheetStatus.DRAFT);
    assertThat(timesheet.getToilStatus()).isEqualTo(ToilStatus.NOT_APPLICABLE);
  }

  @Test
  void accrue_constraintViolation_compensatesAsNonRetryableConflict() {
    var timesheet = stored(ToilFixtures.approved(EMPLOYEE_ID, "8"));
    when(allocationRepository.findOpenOn(EMPLOYEE_ID, ToilFixtures.TODAY)).thenReturn(List.of());
    when(allocationRepository.save(any(LeaveAllocation.class)))
        .thenAnswer(inv -> assignId(inv.getArgument(0)));
    when(ledgerService.appendCredit(any(), any(), any()))
        .thenThrow(new DataIntegrityViolationException("amount check violated"));

    assertThatThrownBy(() -> manager.accrue(timesheet.getId()))
        .isInstanceOf(ResourceConflictException.class)
        .hasMessageContaining("ACCRUAL_INTEGRITY_VIOLATION");

    assertThat(timesheet.getStatus()).isEqualTo(TimesheetStatus.DRAFT);
    assertThat(timesheet.getToilStatus()).isEqualTo(ToilStatus.PENDING_ACCRUAL);
    assertThat(timesheet.getLastAccrualError()).contains("amount check violated");
    assertThat(timesheet.isLastAccrualRetryable()).isFalse();
    assertThat(transactionManager.rollbacks()).isEqualTo(1);
    assertThat(transactionManager.commits()).isEqualTo(1);
  }

  @Test
  void accrue_ledgerFailure_rollsBackAndCompensatesToDraft() {
    var timesheet = stored(ToilFixtures.approved(EMPLOYEE_ID, "8"));
    when(allocationRepository.findOpenOn(EMPLOYEE_ID, ToilFixtures.TODAY)).thenReturn(List.of());
    when(allocationRepository.save(any(LeaveAllocation.class)))
        .thenAnswer(inv -> assignId(inv.getArgument(0)));
    when(ledgerService.appendCredit(any(), any(), any()))
        .thenThrow(new QueryTimeoutException("ledger insert failed"));

    assertThatThrownBy(() -> manager.accrue(timesheet.getId()))
        .isInstanceOf(InfrastructureException.class)
        .hasMessageContaining("ACCRUAL_PERSISTENCE_FAILURE");

    assertThat(timesheet.getStatus()).isEqualTo(TimesheetStatus.DRAFT);
    assertThat(timesheet.getToilStatus()).isEqualTo(ToilStatus.PENDING_ACCRUAL);
    assertThat(timesheet.getToilAllocationId()).isNull();
    assertThat(timesheet.getLastAccrualError()).contains("ledger insert failed");
    assertThat(timesheet.isLastAccrualRetryable()).isTrue();
    assertThat(transactionManager.rollbacks()).isEqualTo(1);
    // the compensation transaction
    assertThat(transactionManager.commits()).isEqualTo(1);
    verify(auditService)
        .log(argThat(event -> event.eventType().equals("timesheet.toil_accrual_failed")));
  }

  @Test
  void accrue_lockTimeout_propagatesRetryableError() {
    var timesheet = stored(ToilFixtures.approved(EMPLOYEE_ID, "8"));
    when(employeeLockService.lock(EMPLOYEE_ID))
        .thenThrow(new InfrastructureException("LOCK_TIMEOUT", "busy", null));

    assertThatThrownBy(() -> manager.accrue(timesheet.getId()))
        .isInstanceOf(InfrastructureException.class)
        .hasMessageContaining("LOCK_TIMEOUT");
    assertThat(timesheet.getStatus()).isEqualTo(TimesheetStatus.DRAFT);
    assertThat(timesheet.isAwaitingAccrual()).isTrue();
  }

  @Test
  void releaseContribution_partiallyConsumed_isConflict() {
    var allocation = allocation("2");
    var timesheet = ToilFixtures.accrued(EMPLOYEE_ID, "8", allocation.getId());
    when(allocationRepository.findById(allocation.getId())).thenReturn(Optional.of(allocation));
    when(ledgerService.allocationBalance(allocation.getId())).thenReturn(new BigDecimal("1.5"));

    assertThatThrownBy(() -> manager.releaseContribution(timesheet))
        .isInstanceOf(ResourceConflictException.class)
        .hasMessageContaining("TOIL_CONSUMED");
    verify(ledgerService, never()).appendAllocationReversal(any(), any(), any());
    assertThat(allocation.getNewLeavesAllocated()).isEqualByComparingTo("2");
  }

  @Test
  void releaseContribution_oneOfTwoContributors_reducesByItsShareOnly() {
    var allocation = allocation("2");
    var timesheet = ToilFixtures.accrued(EMPLOYEE_ID, "6", allocation.getId());
    when(allocationRepository.findById(allocation.getId())).thenReturn(Optional.of(allocation));
    when(ledgerService.allocationBalance(allocation.getId())).thenReturn(new BigDecimal("2"));

    var result = manager.releaseContribution(timesheet);

    assertThat(result.releasedDays()).isEqualByComparingTo("1");
    assertThat(result.remainingDays()).isEqualByComparingTo("1");
    assertThat(result.cancelled()).isFalse();
    assertThat(allocation.getStatus()).isEqualTo(AllocationStatus.ACTIVE);
    verify(ledgerService).appendAllocationReversal(allocation, timesheet.getId(), BigDecimal.ONE);
  }

  @Test
  void releaseContribution_lastContributor_cancelsAllocation() {
    var allocation = allocation("1");
    var timesheet = ToilFixtures.accrued(EMPLOYEE_ID, "8", allocation.getId());
    when(allocationRepository.findById(allocation.getId())).thenReturn(Optional.of(allocation));
    when(ledgerService.allocationBalance(allocation.getId())).thenReturn(BigDecimal.ONE);

    var result = manager.releaseContribution(timesheet);

    assertThat(result.cancelled()).isTrue();
    assertThat(allocation.getStatus()).isEqualTo(AllocationStatus.CANCELLED);
  }

  @Test
  void releaseContribution_expiredAllocation_isConflict() {
    var granted = ToilFixtures.TODAY.minusMonths(7);
    var allocation =
        ToilFixtures.withId(
            new LeaveAllocation(
                EMPLOYEE_ID, granted, granted.plusMonths(6), BigDecimal.ONE, BigDecimal.TEN, null),
            UUID.randomUUID());
    var timesheet = ToilFixtures.accrued(EMPLOYEE_ID, "8", allocation.getId());
    when(allocationRepository.findById(allocation.getId())).thenReturn(Optional.of(allocation));

    assertThatThrownBy(() -> manager.releaseContribution(timesheet))
        .isInstanceOf(ResourceConflictException.class)
        .hasMessageContaining("TOIL_EXPIRED");
  }

  @Test
  void usageFor_followsRemainingBalance() {
    var two = new BigDecimal("2");
    assertThat(AllocationLedgerManager.usageFor(two, two)).isEqualTo(ToilStatus.ACCRUED);
    assertThat(AllocationLedgerManager.usageFor(two, BigDecimal.ONE))
        .isEqualTo(ToilStatus.PARTIALLY_USED);
    assertThat(AllocationLedgerManager.usageFor(two, BigDecimal.ZERO))
        .isEqualTo(ToilStatus.FULLY_USED);
  }

  private Timesheet stored(Timesheet timesheet) {
    when(timesheetRepository.findById(timesheet.getId())).thenReturn(Optional.of(timesheet));
    return timesheet;
  }

  private static LeaveAllocation allocation(String days) {
    return ToilFixtures.withId(
        new LeaveAllocation(
            EMPLOYEE_ID,
            ToilFixtures.TODAY.minusMonths(1),
            ToilFixtures.TODAY.plusMonths(5),
            new BigDecimal(days),
            new BigDecimal("14"),
            UUID.randomUUID()),
        UUID.randomUUID());
  }

  private static LeaveAllocation assignId(LeaveAllocation allocation) {
    return allocation.getId() != null
        ? allocation
        : ToilFixtures.withId(allocation, UUID.randomUUID());
  }
}
