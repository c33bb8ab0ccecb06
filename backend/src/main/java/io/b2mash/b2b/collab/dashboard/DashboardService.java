package io.b2mash.b2b.collab.dashboard;

import io.b2mash.b2b.collab.dashboard.dto.DeploymentSummary;
import io.b2mash.b2b.collab.dashboard.dto.RecentProject;
import io.b2mash.b2b.collab.project.DeploymentStatus;
import io.b2mash.b2b.collab.project.ProjectRepository;
import java.util.UUID;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owner-level deployment overview. Only projects the member owns and that are still active count;
 * collaborations are listed under {@code /api/me/collaborations} instead.
 */
@Service
public class DashboardService {

  private final ProjectRepository projectRepository;

  public DashboardService(ProjectRepository projectRepository) {
    this.projectRepository = projectRepository;
  }

  @Transactional(readOnly = true)
  public DeploymentSummary getDeploymentSummary(UUID memberId) {
    var recent =
        projectRepository.findTop5ByOwnerIdAndActiveTrueOrderByCreatedAtDesc(memberId).stream()
            .map(RecentProject::from)
            .toList();
    return new DeploymentSummary(
        projectRepository.countByOwnerIdAndActiveTrue(memberId),
        countWithStatus(memberId, DeploymentStatus.DEPLOYED),
        countWithStatus(memberId, DeploymentStatus.PENDING),
        countWithStatus(memberId, DeploymentStatus.FAILED),
        recent);
  }

  private long countWithStatus(UUID memberId, DeploymentStatus status) {
    return projectRepository.countByOwnerIdAndActiveTrueAndDeploymentStatus(memberId, status);
  }
}
