package io.b2mash.toil.timesheet;

import io.b2mash.toil.security.CallerIdentity;
import io.b2mash.toil.timesheet.TimesheetService.TimeLogInput;
import io.b2mash.toil.timesheet.TimesheetService.TimesheetDetail;
import io.b2mash.toil.timesheet.TimesheetService.ToilPreview;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
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
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TimesheetController {

  private final TimesheetService timesheetService;
  private final TimesheetWorkflowService workflowService;

  public TimesheetController(
      TimesheetService timesheetService, TimesheetWorkflowService workflowService) {
    this.timesheetService = timesheetService;
    this.workflowService = workflowService;
  }

  @PostMapping("/api/timesheets")
  public ResponseEntity<TimesheetResponse> createTimesheet(
      @Valid @RequestBody TimesheetRequest request, Authentication authentication) {
    var detail =
        timesheetService.createDraft(
            request.employeeId(),
            request.startDate(),
            request.endDate(),
            request.toInputs(),
            CallerIdentity.from(authentication));
    return ResponseEntity.created(URI.create("/api/timesheets/" + detail.timesheet().getId()))
        .body(TimesheetResponse.from(detail));
  }

  @PutMapping("/api/timesheets/{id}")
  public ResponseEntity<TimesheetResponse> updateTimesheet(
      @PathVariable UUID id,
      @Valid @RequestBody TimesheetRequest request,
      Authentication authentication) {
    var detail =
        timesheetService.updateDraft(
            id,
            request.startDate(),
            request.endDate(),
            request.toInputs(),
            CallerIdentity.from(authentication));
    return ResponseEntity.ok(TimesheetResponse.from(detail));
  }

  @GetMapping("/api/timesheets/{id}")
  public ResponseEntity<TimesheetResponse> getTimesheet(
      @PathVariable UUID id, Authentication authentication) {
    var detail = timesheetService.getTimesheet(id, CallerIdentity.from(authentication));
    return ResponseEntity.ok(TimesheetResponse.from(detail));
  }

  @GetMapping("/api/timesheets/mine")
  public ResponseEntity<List<TimesheetSummary>> listMine(Authentication authentication) {
    var timesheets = timesheetService.listMine(CallerIdentity.from(authentication));
    return ResponseEntity.ok(timesheets.stream().map(TimesheetSummary::from).toList());
  }

  @GetMapping("/api/timesheets/team-requests")
  public ResponseEntity<List<TimesheetSummary>> listTeamRequests(
      @RequestParam(required = false) List<ToilStatus> toilStatus,
      Authentication authentication) {
    var timesheets =
        timesheetService.listTeamRequests(CallerIdentity.from(authentication), toilStatus);
    return ResponseEntity.ok(timesheets.stream().map(TimesheetSummary::from).toList());
  }

  @GetMapping("/api/timesheets/{id}/toil-preview")
  public ResponseEntity<ToilPreview> previewToil(
      @PathVariable UUID id, Authentication authentication) {
    return ResponseEntity.ok(
        timesheetService.calculatePreview(id, CallerIdentity.from(authentication)));
  }

  @PostMapping("/api/timesheets/{id}/submit")
  public ResponseEntity<TimesheetSummary> submitForApproval(
      @PathVariable UUID id, Authentication authentication) {
    var timesheet = workflowService.submitForApproval(id, CallerIdentity.from(authentication));
    return ResponseEntity.ok(TimesheetSummary.from(timesheet));
  }

  @PutMapping("/api/timesheets/{id}/approval")
  public ResponseEntity<TimesheetSummary> setApproval(
      @PathVariable UUID id,
      @Valid @RequestBody ApprovalRequest request,
      Authentication authentication) {
    var timesheet =
        workflowService.setApproval(
            id, request.decision(), request.reason(), CallerIdentity.from(authentication));
    return ResponseEntity.ok(TimesheetSummary.from(timesheet));
  }

  @PostMapping("/api/timesheets/{id}/cancel")
  public ResponseEntity<TimesheetSummary> cancelTimesheet(
      @PathVariable UUID id, Authentication authentication) {
    var timesheet = workflowService.cancel(id, CallerIdentity.from(authentication));
    return ResponseEntity.ok(TimesheetSummary.from(timesheet));
  }

  // --- DTOs ---

  public record TimeLogRequest(
      @NotNull(message = "date is required") LocalDate date,
      @NotNull(message = "hours is required") BigDecimal hours,
      boolean billable,
      @Size(max = 100) String activityType,
      String description) {}

  public record TimesheetRequest(
      UUID employeeId,
      @NotNull(message = "startDate is required") LocalDate startDate,
      @NotNull(message = "endDate is required") LocalDate endDate,
      @NotNull(message = "timeLogs is required") List<@Valid TimeLogRequest> timeLogs) {

    List<TimeLogInput> toInputs() {
      return timeLogs.stream()
          .map(
              log ->
                  new TimeLogInput(
                      log.date(),
                      log.hours(),
                      log.billable(),
                      log.activityType(),
                      log.description()))
          .toList();
    }
  }

  public record ApprovalRequest(
      @NotNull(message = "decision is required") ApprovalDecision decision, String reason) {}

  public record TimeLogResponse(
      UUID id,
      LocalDate date,
      BigDecimal hours,
      boolean billable,
      String activityType,
      String description) {

    public static TimeLogResponse from(TimeLog log) {
      return new TimeLogResponse(
          log.getId(),
          log.getLogDate(),
          log.getHours(),
          log.isBillable(),
          log.getActivityType(),
          log.getDescription());
    }
  }

  public record TimesheetSummary(
      UUID id,
      UUID employeeId,
      LocalDate startDate,
      LocalDate endDate,
      TimesheetStatus status,
      ToilStatus toilStatus,
      BigDecimal totalToilHours,
      BigDecimal toilDays,
      UUID toilAllocationId,
      BigDecimal toilAccruedDays,
      Instant approvalRequestedAt,
      String approvedBy,
      Instant approvedAt,
      String rejectionReason,
      String lastAccrualError,
      Instant updatedAt) {

    public static TimesheetSummary from(Timesheet timesheet) {
      return new TimesheetSummary(
          timesheet.getId(),
          timesheet.getEmployeeId(),
          timesheet.getStartDate(),
          timesheet.getEndDate(),
          timesheet.getStatus(),
          timesheet.getToilStatus(),
          timesheet.getTotalToilHours(),
          timesheet.getToilDays(),
          timesheet.getToilAllocationId(),
          timesheet.getToilAccruedDays(),
          timesheet.getApprovalRequestedAt(),
          timesheet.getApprovedBy(),
          timesheet.getApprovedAt(),
          timesheet.getRejectionReason(),
          timesheet.getLastAccrualError(),
          timesheet.getUpdatedAt());
    }
  }

  public record TimesheetResponse(TimesheetSummary timesheet, List<TimeLogResponse> timeLogs) {

    public static TimesheetResponse from(TimesheetDetail detail) {
      return new TimesheetResponse(
          TimesheetSummary.from(detail.timesheet()),
          detail.logs().stream().map(TimeLogResponse::from).toList());
    }
  }
}
