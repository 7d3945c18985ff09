package io.b2mash.toil.directory;

import io.b2mash.toil.directory.EmployeeSetupService.SetupReport;
import io.b2mash.toil.directory.EmployeeTeamService.CallerRole;
import io.b2mash.toil.security.CallerIdentity;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class EmployeeController {

  private final EmployeeDirectoryService directoryService;
  private final EmployeeSetupService setupService;
  private final EmployeeTeamService teamService;
  private final EmployeeAccessPolicy accessPolicy;

  public EmployeeController(
      EmployeeDirectoryService directoryService,
      EmployeeSetupService setupService,
      EmployeeTeamService teamService,
      EmployeeAccessPolicy accessPolicy) {
    this.directoryService = directoryService;
    this.setupService = setupService;
    this.teamService = teamService;
    this.accessPolicy = accessPolicy;
  }

  @PutMapping("/api/employees/{id}")
  @PreAuthorize("hasRole('TOIL_ADMIN')")
  public ResponseEntity<EmployeeResponse> upsertEmployee(
      @PathVariable UUID id, @Valid @RequestBody UpsertEmployeeRequest request) {
    var employee =
        directoryService.upsertEmployee(
            id, request.name(), request.userId(), request.supervisorId(), request.status());
    return ResponseEntity.ok(EmployeeResponse.from(employee));
  }

  @PutMapping("/api/user-accounts/{userId}")
  @PreAuthorize("hasRole('TOIL_ADMIN')")
  public ResponseEntity<UserAccountResponse> upsertUserAccount(
      @PathVariable String userId, @Valid @RequestBody UpsertUserAccountRequest request) {
    var account = directoryService.upsertUserAccount(userId, request.email(), request.enabled());
    return ResponseEntity.ok(UserAccountResponse.from(account));
  }

  @GetMapping("/api/employees/{id}/setup")
  public ResponseEntity<SetupReport> validateSetup(
      @PathVariable UUID id, Authentication authentication) {
    accessPolicy.requireReadAccess(id, CallerIdentity.from(authentication));
    return ResponseEntity.ok(setupService.validateSetup(id));
  }

  @GetMapping("/api/employees/me/setup")
  public ResponseEntity<SetupReport> validateMySetup(Authentication authentication) {
    var self = accessPolicy.requireSelf(CallerIdentity.from(authentication));
    return ResponseEntity.ok(setupService.validateSetup(self.getId()));
  }

  @GetMapping("/api/employees/me/team")
  public ResponseEntity<List<TeamMemberResponse>> myTeam(Authentication authentication) {
    var team = teamService.myTeam(CallerIdentity.from(authentication));
    return ResponseEntity.ok(team.stream().map(TeamMemberResponse::from).toList());
  }

  @GetMapping("/api/employees/me/role")
  public ResponseEntity<CallerRole> myRole(Authentication authentication) {
    return ResponseEntity.ok(teamService.roleOf(CallerIdentity.from(authentication)));
  }

  // --- DTOs ---

  public record UpsertEmployeeRequest(
      @NotBlank(message = "name is required") @Size(max = 255) String name,
      @Size(max = 255) String userId,
      UUID supervisorId,
      EmployeeStatus status) {}

  public record UpsertUserAccountRequest(@Size(max = 255) String email, boolean enabled) {}

  public record EmployeeResponse(
      UUID id,
      String name,
      String userId,
      UUID supervisorId,
      EmployeeStatus status,
      Instant updatedAt) {

    public static EmployeeResponse from(Employee employee) {
      return new EmployeeResponse(
          employee.getId(),
          employee.getName(),
          employee.getUserId(),
          employee.getSupervisorId(),
          employee.getStatus(),
          employee.getUpdatedAt());
    }
  }

  public record TeamMemberResponse(UUID id, String name, String userId, EmployeeStatus status) {

    public static TeamMemberResponse from(Employee employee) {
      return new TeamMemberResponse(
          employee.getId(), employee.getName(), employee.getUserId(), employee.getStatus());
    }
  }

  public record UserAccountResponse(String userId, String email, boolean enabled) {

    public static UserAccountResponse from(UserAccount account) {
      return new UserAccountResponse(account.getUserId(), account.getEmail(), account.isEnabled());
    }
  }
}
