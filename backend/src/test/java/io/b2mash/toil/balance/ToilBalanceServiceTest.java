package io.b2mash.toil.balance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.toil.ToilFixtures;
import io.b2mash.toil.consumption.AvailableAllocation;
import io.b2mash.toil.consumption.FifoConsumptionTracker;
import io.b2mash.toil.directory.EmployeeAccessPolicy;
import io.b2mash.toil.exception.ForbiddenException;
import io.b2mash.toil.exception.ValidationException;
import io.b2mash.toil.ledger.LeaveLedgerService;
import io.b2mash.toil.ledger.TransactionType;
import io.b2mash.toil.security.CallerIdentity;
import io.b2mash.toil.timesheet.TimesheetRepository;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ToilBalanceServiceTest {

  private static final UUID EMPLOYEE_ID = UUID.randomUUID();
  private static final CallerIdentity EVE = CallerIdentity.user("user_eve");
  private static final LocalDate TODAY = ToilFixtures.TODAY;

  @Mock private LeaveLedgerService ledgerService;
  @Mock private FifoConsumptionTracker consumptionTracker;
  @Mock private TimesheetRepository timesheetRepository;
  @Mock private EmployeeAccessPolicy accessPolicy;

  private ToilBalanceService service;

  @BeforeEach
  void setUp() {
    service =
        new ToilBalanceService(
            ledgerService,
            consumptionTracker,
            timesheetRepository,
            accessPolicy,
            ToilFixtures.properties(),
            ToilFixtures.fixedClock());
  }

  @Test
  void balance_combinesLedgerTotals() {
    var soon = allocation("1", TODAY.plusDays(10));
    var later = allocation("2", TODAY.plusDays(150));
    when(ledgerService.spendableBalance(EMPLOYEE_ID, TODAY, TODAY.minusMonths(6)))
        .thenReturn(new BigDecimal("3"));
    when(ledgerService.employeeTotal(EMPLOYEE_ID, TransactionType.ACCRUAL_TYPES))
        .thenReturn(new BigDecimal("5"));
    when(ledgerService.employeeTotal(EMPLOYEE_ID, TransactionType.CONSUMPTION_TYPES))
        .thenReturn(new BigDecimal("-2"));
    when(ledgerService.balanceEndingBetween(EMPLOYEE_ID, TODAY, TODAY.plusDays(30)))
        .thenReturn(new BigDecimal("1"));
    when(timesheetRepository.sumPendingToilDays(EMPLOYEE_ID)).thenReturn(new BigDecimal("0.75"));
    when(consumptionTracker.availableAllocations(EMPLOYEE_ID, TODAY))
        .thenReturn(List.of(soon, later));

    var balance = service.balance(EMPLOYEE_ID, EVE);

    verify(accessPolicy).requireReadAccess(EMPLOYEE_ID, EVE);
    assertThat(balance.asOf()).isEqualTo(TODAY);
    assertThat(balance.available()).isEqualByComparingTo("3");
    assertThat(balance.totalAccrued()).isEqualByComparingTo("5");
    assertThat(balance.totalConsumed()).isEqualByComparingTo("2");
    assertThat(balance.expiringSoon()).isEqualByComparingTo("1");
    assertThat(balance.pendingAccrual()).isEqualByComparingTo("0.75");
    assertThat(balance.earliestExpiryDate()).isEqualTo(TODAY.plusDays(10));
    assertThat(balance.allocations()).containsExactly(soon, later);
  }

  @Test
  void balance_nothingAccrued_isAllZeros() {
    when(ledgerService.spendableBalance(EMPLOYEE_ID, TODAY, TODAY.minusMonths(6)))
        .thenReturn(BigDecimal.ZERO);
    when(ledgerService.employeeTotal(EMPLOYEE_ID, TransactionType.ACCRUAL_TYPES))
        .thenReturn(BigDecimal.ZERO);
    when(ledgerService.employeeTotal(EMPLOYEE_ID, TransactionType.CONSUMPTION_TYPES))
        .thenReturn(BigDecimal.ZERO);
    when(ledgerService.balanceEndingBetween(EMPLOYEE_ID, TODAY, TODAY.plusDays(30)))
        .thenReturn(BigDecimal.ZERO);
    when(consumptionTracker.availableAllocations(EMPLOYEE_ID, TODAY)).thenReturn(List.of());

    var balance = service.balance(EMPLOYEE_ID, EVE);

    assertThat(balance.available()).isZero();
    assertThat(balance.pendingAccrual()).isZero();
    assertThat(balance.earliestExpiryDate()).isNull();
  }

  @Test
  void balance_unrelatedCaller_isForbidden() {
    var mallory = CallerIdentity.user("user_mallory");
    doThrow(new ForbiddenException("NO_ACCESS", "Access denied", "no"))
        .when(accessPolicy)
        .requireReadAccess(EMPLOYEE_ID, mallory);

    assertThatThrownBy(() -> service.balance(EMPLOYEE_ID, mallory))
        .isInstanceOf(ForbiddenException.class);
  }

  @Test
  void ledger_defaultWindow_endsTodayInclusive() {
    var start = TODAY.minusDays(120).atStartOfDay(ZoneOffset.UTC).toInstant();
    var end = Instant.parse("2025-03-15T00:00:00Z");

    assertThat(service.ledger(EMPLOYEE_ID, null, null, EVE)).isEmpty();
    verify(ledgerService).history(EMPLOYEE_ID, start, end);
  }

  @Test
  void ledger_fromAfterTo_isRejected() {
    assertThatThrownBy(() -> service.ledger(EMPLOYEE_ID, TODAY, TODAY.minusDays(1), EVE))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("INVALID_RANGE");
  }

  private static AvailableAllocation allocation(String balance, LocalDate toDate) {
    return new AvailableAllocation(
        UUID.randomUUID(),
        new BigDecimal(balance),
        new BigDecimal(balance),
        toDate.minusMonths(6),
        toDate,
        UUID.randomUUID(),
        ChronoUnit.DAYS.between(TODAY, toDate));
  }
}
