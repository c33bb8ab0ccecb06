package io.b2mash.b2b.collab.dashboard;

import io.b2mash.b2b.collab.context.RequestScopes;
import io.b2mash.b2b.collab.dashboard.dto.DeploymentSummary;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class DashboardController {

  private final DashboardService dashboardService;

  public DashboardController(DashboardService dashboardService) {
    this.dashboardService = dashboardService;
  }

  @GetMapping("/api/dashboard")
  @PreAuthorize("hasRole('USER')")
  public ResponseEntity<DeploymentSummary> getDashboard() {
    UUID memberId = RequestScopes.requireMemberId();
    return ResponseEntity.ok(dashboardService.getDeploymentSummary(memberId));
  }
}
