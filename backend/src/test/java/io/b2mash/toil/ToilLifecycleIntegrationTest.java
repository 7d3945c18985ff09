package io.b2mash.toil;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.toil.audit.AuditEvent;
import io.b2mash.toil.audit.AuditEventRepository;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.junit.jupiter.api.TestMethodOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.Pageable;
import org.springframework.http.MediaType;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Drives one employee's TOIL through the HTTP API: log overtime, get it approved, wait for the
 * background accrual, spend some of it, and unwind.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class ToilLifecycleIntegrationTest {

  private static final String EMPLOYEE_USER = "user_lifecycle_eve";
  private static final String SUPERVISOR_USER = "user_lifecycle_sam";
  private static final String OUTSIDER_USER = "user_lifecycle_oscar";

  @Autowired private MockMvc mockMvc;
  @Autowired private AuditEventRepository auditEventRepository;

  private final UUID employeeId = UUID.randomUUID();
  private final UUID supervisorId = UUID.randomUUID();
  private final LocalDate today = LocalDate.now();

  private String timesheetId;
  private String leaveApplicationId;

  @BeforeAll
  void setup() throws Exception {
    upsertUserAccount(SUPERVISOR_USER);
    upsertUserAccount(EMPLOYEE_USER);
    upsertEmployee(supervisorId, "Sam Supervisor", SUPERVISOR_USER, null);
    upsertEmployee(employeeId, "Eve Employee", EMPLOYEE_USER, supervisorId);
  }

  @Test
  @Order(1)
  void createTimesheet_nonBillableHours_computesToil() throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/timesheets")
                    .with(employeeJwt())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {
                          "startDate": "%s",
                          "endDate": "%s",
                          "timeLogs": [
                            {"date": "%s", "hours": 8, "billable": false, "activityType": "ops"},
                            {"date": "%s", "hours": 4, "billable": false, "activityType": "ops"},
                            {"date": "%s", "hours": 6, "billable": true, "activityType": "client"}
                          ]
                        }
                        """
                            .formatted(
                                today.minusDays(6),
                                today,
                                today.minusDays(2),
                                today.minusDays(1),
                                today.minusDays(1))))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.timesheet.status").value("DRAFT"))
            .andExpect(jsonPath("$.timesheet.totalToilHours").value(12.0))
            .andExpect(jsonPath("$.timesheet.toilDays").value(1.5))
            .andExpect(jsonPath("$.timeLogs.length()").value(3))
            .andReturn();
    timesheetId = JsonPath.read(result.getResponse().getContentAsString(), "$.timesheet.id");
  }

  @Test
  @Order(2)
  void preview_roundsAllocationUp() throws Exception {
    mockMvc
        .perform(get("/api/timesheets/" + timesheetId + "/toil-preview").with(employeeJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.toilDays").value(1.5))
        .andExpect(jsonPath("$.allocationDays").value(2))
        .andExpect(jsonPath("$.breakdown.length()").value(2));
  }

  @Test
  @Order(3)
  void submit_byOwner_awaitsApproval() throws Exception {
    mockMvc
        .perform(post("/api/timesheets/" + timesheetId + "/submit").with(employeeJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("DRAFT"))
        .andExpect(jsonPath("$.toilStatus").value("PENDING_ACCRUAL"))
        .andExpect(jsonPath("$.approvalRequestedAt").isNotEmpty());
  }

  @Test
  @Order(4)
  void supervisorQueue_listsPendingRequest() throws Exception {
    mockMvc
        .perform(get("/api/timesheets/team-requests").with(supervisorJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(1))
        .andExpect(jsonPath("$[0].id").value(timesheetId));
  }

  @Test
  @Order(5)
  void approve_byOutsider_returns403() throws Exception {
    mockMvc
        .perform(
            put("/api/timesheets/" + timesheetId + "/approval")
                .with(outsiderJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"decision\": \"approved\"}"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("NOT_SUPERVISOR"));
  }

  @Test
  @Order(6)
  void reject_withShortReason_returns422() throws Exception {
    mockMvc
        .perform(
            put("/api/timesheets/" + timesheetId + "/approval")
                .with(supervisorJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"decision\": \"rejected\", \"reason\": \"no\"}"))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("REJECTION_REASON_TOO_SHORT"));
  }

  @Test
  @Order(7)
  void approve_bySupervisor_accruesInBackground() throws Exception {
    mockMvc
        .perform(
            put("/api/timesheets/" + timesheetId + "/approval")
                .with(supervisorJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"decision\": \"approved\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("SUBMITTED"))
        .andExpect(jsonPath("$.approvedBy").value(SUPERVISOR_USER));

    awaitToilStatus("ACCRUED");

    mockMvc
        .perform(get("/api/timesheets/" + timesheetId).with(employeeJwt()))
        .andExpect(jsonPath("$.timesheet.toilAllocationId").isNotEmpty())
        .andExpect(jsonPath("$.timesheet.toilAccruedDays").value(2.0));
  }

  @Test
  @Order(8)
  void balance_afterAccrual_showsWholeDays() throws Exception {
    mockMvc
        .perform(get("/api/employees/" + employeeId + "/toil/balance").with(employeeJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.available").value(2.0))
        .andExpect(jsonPath("$.totalAccrued").value(2.0))
        .andExpect(jsonPath("$.pendingAccrual").value(0.0))
        .andExpect(jsonPath("$.allocations.length()").value(1))
        .andExpect(jsonPath("$.earliestExpiryDate").value(today.plusMonths(6).toString()));
  }

  @Test
  @Order(9)
  void balance_ofSomeoneElse_returns403() throws Exception {
    mockMvc
        .perform(get("/api/employees/" + employeeId + "/toil/balance").with(outsiderJwt()))
        .andExpect(status().isForbidden());
  }

  @Test
  @Order(10)
  void applyLeave_debitsAllocation() throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/leave-applications")
                    .with(employeeJwt())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"fromDate": "%s", "toDate": "%s", "description": "Day off"}
                        """
                            .formatted(today.plusDays(7), today.plusDays(7))))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.totalLeaveDays").value(1))
            .andExpect(jsonPath("$.leaveApprover").value(SUPERVISOR_USER))
            .andExpect(jsonPath("$.allocations.length()").value(1))
            .andReturn();
    leaveApplicationId = JsonPath.read(result.getResponse().getContentAsString(), "$.id");

    mockMvc
        .perform(get("/api/employees/" + employeeId + "/toil/balance").with(employeeJwt()))
        .andExpect(jsonPath("$.available").value(1.0))
        .andExpect(jsonPath("$.totalConsumed").value(1.0));
    mockMvc
        .perform(get("/api/timesheets/" + timesheetId).with(employeeJwt()))
        .andExpect(jsonPath("$.timesheet.toilStatus").value("PARTIALLY_USED"));
  }

  @Test
  @Order(11)
  void applyLeave_beyondBalance_returns422() throws Exception {
    mockMvc
        .perform(
            post("/api/leave-applications")
                .with(employeeJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"fromDate": "%s", "toDate": "%s"}
                    """
                        .formatted(today.plusDays(14), today.plusDays(15))))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("INSUFFICIENT_TOIL_BALANCE"));
  }

  @Test
  @Order(16)
  void applyLeave_withoutSupervisor_returns422() throws Exception {
    mockMvc
        .perform(
            post("/api/leave-applications")
                .with(supervisorJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"fromDate": "%s", "toDate": "%s"}
                    """
                        .formatted(today.plusDays(7), today.plusDays(7))))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value("SUPERVISOR_NOT_CONFIGURED"));
  }

  @Test
  @Order(12)
  void cancelTimesheet_withConsumedToil_returns409() throws Exception {
    mockMvc
        .perform(post("/api/timesheets/" + timesheetId + "/cancel").with(employeeJwt()))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("TOIL_CONSUMED"));
  }

  @Test
  @Order(13)
  void ledger_listsCreditAndDebit() throws Exception {
    mockMvc
        .perform(get("/api/employees/" + employeeId + "/toil/ledger").with(supervisorJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2))
        .andExpect(jsonPath("$[0].transactionType").value("LEAVE_APPLICATION"))
        .andExpect(jsonPath("$[1].transactionType").value("ALLOCATION"));
  }

  @Test
  @Order(14)
  void cancelLeave_thenTimesheet_unwindsEverything() throws Exception {
    mockMvc
        .perform(
            post("/api/leave-applications/" + leaveApplicationId + "/cancel").with(employeeJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("CANCELLED"));

    mockMvc
        .perform(post("/api/timesheets/" + timesheetId + "/cancel").with(employeeJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("CANCELLED"))
        .andExpect(jsonPath("$.toilStatus").value("CANCELLED"));

    mockMvc
        .perform(get("/api/employees/" + employeeId + "/toil/balance").with(employeeJwt()))
        .andExpect(jsonPath("$.available").value(0.0))
        .andExpect(jsonPath("$.allocations.length()").value(0));

    var eventTypes =
        auditEventRepository
            .findByEntity("timesheet", UUID.fromString(timesheetId), Pageable.unpaged())
            .stream()
            .map(AuditEvent::getEventType)
            .toList();
    assertThat(eventTypes)
        .contains(
            "timesheet.approval_requested",
            "timesheet.approved",
            "timesheet.toil_accrued",
            "timesheet.cancelled");
  }

  @Test
  @Order(15)
  void unauthenticated_returns401() throws Exception {
    mockMvc.perform(get("/api/timesheets/mine")).andExpect(status().isUnauthorized());
  }

  @Test
  @Order(17)
  void myTeam_ofSupervisor_listsReports() throws Exception {
    mockMvc
        .perform(get("/api/employees/me/team").with(supervisorJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(1))
        .andExpect(jsonPath("$[0].id").value(employeeId.toString()))
        .andExpect(jsonPath("$[0].name").value("Eve Employee"));
    mockMvc
        .perform(get("/api/employees/me/team").with(employeeJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(0));
  }

  @Test
  @Order(18)
  void myRole_reflectsReportingLine() throws Exception {
    mockMvc
        .perform(get("/api/employees/me/role").with(supervisorJwt()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.role").value("SUPERVISOR"))
        .andExpect(jsonPath("$.subordinatesCount").value(1));
    mockMvc
        .perform(get("/api/employees/me/role").with(employeeJwt()))
        .andExpect(jsonPath("$.role").value("EMPLOYEE"))
        .andExpect(jsonPath("$.employeeId").value(employeeId.toString()));
    mockMvc
        .perform(get("/api/employees/me/role").with(adminJwt()))
        .andExpect(jsonPath("$.role").value("HR"));
  }

  // --- Helpers ---

  private void awaitToilStatus(String expected) throws Exception {
    String current = null;
    for (int attempt = 0; attempt < 50; attempt++) {
      var result =
          mockMvc
              .perform(get("/api/timesheets/" + timesheetId).with(employeeJwt()))
              .andExpect(status().isOk())
              .andReturn();
      current = JsonPath.read(result.getResponse().getContentAsString(), "$.timesheet.toilStatus");
      if (expected.equals(current)) {
        return;
      }
      Thread.sleep(200);
    }
    assertThat(current).as("TOIL status of timesheet %s", timesheetId).isEqualTo(expected);
  }

  private void upsertUserAccount(String userId) throws Exception {
    mockMvc
        .perform(
            put("/api/user-accounts/" + userId)
                .with(adminJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"email\": \"%s@example.com\", \"enabled\": true}".formatted(userId)))
        .andExpect(status().isOk());
  }

  private void upsertEmployee(UUID id, String name, String userId, UUID supervisor)
      throws Exception {
    var supervisorJson = supervisor != null ? "\"" + supervisor + "\"" : "null";
    mockMvc
        .perform(
            put("/api/employees/" + id)
                .with(adminJwt())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "%s", "userId": "%s", "supervisorId": %s}
                    """
                        .formatted(name, userId, supervisorJson)))
        .andExpect(status().isOk());
  }

  private JwtRequestPostProcessor employeeJwt() {
    return jwt()
        .jwt(j -> j.subject(EMPLOYEE_USER))
        .authorities(List.of(new SimpleGrantedAuthority("ROLE_EMPLOYEE")));
  }

  private JwtRequestPostProcessor supervisorJwt() {
    return jwt()
        .jwt(j -> j.subject(SUPERVISOR_USER))
        .authorities(List.of(new SimpleGrantedAuthority("ROLE_EMPLOYEE")));
  }

  private JwtRequestPostProcessor outsiderJwt() {
    return jwt()
        .jwt(j -> j.subject(OUTSIDER_USER))
        .authorities(List.of(new SimpleGrantedAuthority("ROLE_EMPLOYEE")));
  }

  private JwtRequestPostProcessor adminJwt() {
    return jwt()
        .jwt(j -> j.subject("user_lifecycle_admin"))
        .authorities(List.of(new SimpleGrantedAuthority("ROLE_TOIL_ADMIN")));
  }
}
