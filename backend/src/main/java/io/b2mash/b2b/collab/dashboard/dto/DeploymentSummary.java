package io.b2mash.b2b.collab.dashboard.dto;

import java.util.List;

/** Deployment counts over the caller's own active projects, plus the newest of them. */
public record DeploymentSummary(
    long totalProjects,
    long deployedProjects,
    long pendingProjects,
    long failedProjects,
    List<RecentProject> recentProjects) {}
