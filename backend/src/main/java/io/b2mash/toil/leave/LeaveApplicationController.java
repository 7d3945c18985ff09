package io.b2mash.toil.leave;

import io.b2mash.toil.consumption.ConsumptionSlice;
import io.b2mash.toil.leave.LeaveApplicationService.LeaveApplicationDetail;
import io.b2mash.toil.security.CallerIdentity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class LeaveApplicationController {

  private final LeaveApplicationService leaveApplicationService;

  public LeaveApplicationController(LeaveApplicationService leaveApplicationService) {
    this.leaveApplicationService = leaveApplicationService;
  }

  @PostMapping("/api/leave-applications")
  public ResponseEntity<LeaveApplicationResponse> submitLeave(
      @Valid @RequestBody LeaveApplicationRequest request, Authentication authentication) {
    var detail =
        leaveApplicationService.submit(
            request.employeeId(),
            request.fromDate(),
            request.toDate(),
            Boolean.TRUE.equals(request.halfDay()),
            request.description(),
            CallerIdentity.from(authentication));
    return ResponseEntity.created(
            URI.create("/api/leave-applications/" + detail.application().getId()))
        .body(LeaveApplicationResponse.from(detail));
  }

  @GetMapping("/api/leave-applications/mine")
  public ResponseEntity<List<LeaveApplicationResponse>> listMine(Authentication authentication) {
    var applications = leaveApplicationService.listMine(CallerIdentity.from(authentication));
    return ResponseEntity.ok(
        applications.stream()
            .map(a -> LeaveApplicationResponse.from(a, List.of(), List.of()))
            .toList());
  }

  @GetMapping("/api/leave-applications/{id}")
  public ResponseEntity<LeaveApplicationResponse> getLeave(
      @PathVariable UUID id, Authentication authentication) {
    var detail = leaveApplicationService.getApplication(id, CallerIdentity.from(authentication));
    return ResponseEntity.ok(LeaveApplicationResponse.from(detail));
  }

  @PostMapping("/api/leave-applications/{id}/cancel")
  public ResponseEntity<LeaveApplicationResponse> cancelLeave(
      @PathVariable UUID id, Authentication authentication) {
    var detail = leaveApplicationService.cancel(id, CallerIdentity.from(authentication));
    return ResponseEntity.ok(LeaveApplicationResponse.from(detail));
  }

  // --- DTOs ---

  public record LeaveApplicationRequest(
      UUID employeeId,
      @NotNull(message = "fromDate is required") LocalDate fromDate,
      @NotNull(message = "toDate is required") LocalDate toDate,
      Boolean halfDay,
      String description) {}

  public record LeaveApplicationResponse(
      UUID id,
      UUID employeeId,
      LocalDate fromDate,
      LocalDate toDate,
      boolean halfDay,
      BigDecimal totalLeaveDays,
      LeaveApplicationStatus status,
      String description,
      String leaveApprover,
      List<ConsumptionSlice> allocations,
      List<String> warnings,
      Instant createdAt) {

    public static LeaveApplicationResponse from(LeaveApplicationDetail detail) {
      return from(detail.application(), detail.slices(), detail.warnings());
    }

    public static LeaveApplicationResponse from(
        LeaveApplication application, List<ConsumptionSlice> slices, List<String> warnings) {
      return new LeaveApplicationResponse(
          application.getId(),
          application.getEmployeeId(),
          application.getFromDate(),
          application.getToDate(),
          application.isHalfDay(),
          application.getTotalLeaveDays(),
          application.getStatus(),
          application.getDescription(),
          application.getLeaveApprover(),
          slices,
          warnings,
          application.getCreatedAt());
    }
  }
}
