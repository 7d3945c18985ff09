package io.b2mash.toil.consumption;

import io.b2mash.toil.allocation.LeaveAllocationRepository;
import io.b2mash.toil.config.ToilProperties;
import io.b2mash.toil.ledger.LeaveLedgerService;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Lists the allocations an employee can spend, in the order they must be spent. */
@Service
public class FifoConsumptionTracker {

  private final LeaveAllocationRepository allocationRepository;
  private final LeaveLedgerService ledgerService;
  private final ToilProperties properties;

  public FifoConsumptionTracker(
      LeaveAllocationRepository allocationRepository,
      LeaveLedgerService ledgerService,
      ToilProperties properties) {
    this.allocationRepository = allocationRepository;
    this.ledgerService = ledgerService;
    this.properties = properties;
  }

  /**
   * Active, unexpired allocations with a positive ledger balance. Oldest grant first; ties go to
   * the allocation created first.
   */
  @Transactional(readOnly = true)
  public List<AvailableAllocation> availableAllocations(UUID employeeId, LocalDate today) {
    var balances = ledgerService.balancesByAllocation(employeeId);
    return allocationRepository
        .findUnexpiredInFifoOrder(employeeId, today, properties.grantCutoff(today))
        .stream()
        .map(
            allocation ->
                new AvailableAllocation(
                    allocation.getId(),
                    allocation.getNewLeavesAllocated(),
                    balances.getOrDefault(allocation.getId(), BigDecimal.ZERO),
                    allocation.getFromDate(),
                    allocation.getToDate(),
                    allocation.getSourceTimesheetId(),
                    ChronoUnit.DAYS.between(today, allocation.getToDate())))
        .filter(available -> available.balance().signum() > 0)
        .toList();
  }
}
