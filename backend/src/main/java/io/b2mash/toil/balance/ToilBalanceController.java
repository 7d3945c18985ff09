package io.b2mash.toil.balance;

import io.b2mash.toil.balance.ToilBalanceService.LedgerLine;
import io.b2mash.toil.balance.ToilBalanceService.ToilBalance;
import io.b2mash.toil.consumption.AvailableAllocation;
import io.b2mash.toil.security.CallerIdentity;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ToilBalanceController {

  private final ToilBalanceService balanceService;

  public ToilBalanceController(ToilBalanceService balanceService) {
    this.balanceService = balanceService;
  }

  @GetMapping("/api/employees/{id}/toil/balance")
  public ResponseEntity<ToilBalance> getBalance(
      @PathVariable UUID id, Authentication authentication) {
    return ResponseEntity.ok(balanceService.balance(id, CallerIdentity.from(authentication)));
  }

  @GetMapping("/api/employees/{id}/toil/ledger")
  public ResponseEntity<List<LedgerLine>> getLedger(
      @PathVariable UUID id,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
      @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
      Authentication authentication) {
    return ResponseEntity.ok(
        balanceService.ledger(id, from, to, CallerIdentity.from(authentication)));
  }

  @GetMapping("/api/employees/{id}/toil/allocations")
  public ResponseEntity<List<AvailableAllocation>> getAvailableAllocations(
      @PathVariable UUID id, Authentication authentication) {
    return ResponseEntity.ok(
        balanceService.availableAllocations(id, CallerIdentity.from(authentication)));
  }
}
