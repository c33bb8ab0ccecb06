package io.b2mash.b2b.collab.project;

import io.b2mash.b2b.collab.access.ProjectAccess;
import io.b2mash.b2b.collab.access.ProjectAccessService;
import io.b2mash.b2b.collab.access.ProjectRole;
import io.b2mash.b2b.collab.context.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/projects")
public class ProjectController {

  private final ProjectService projectService;
  private final ProjectAccessService projectAccessService;

  public ProjectController(
      ProjectService projectService, ProjectAccessService projectAccessService) {
    this.projectService = projectService;
    this.projectAccessService = projectAccessService;
  }

  @GetMapping
  @PreAuthorize("hasRole('USER')")
  public ResponseEntity<List<ProjectResponse>> listProjects() {
    UUID memberId = RequestScopes.requireMemberId();
    var projects =
        projectService.listProjects(memberId).stream().map(ProjectResponse::from).toList();
    return ResponseEntity.ok(projects);
  }

  @GetMapping("/{id}")
  @PreAuthorize("hasRole('USER')")
  public ResponseEntity<ProjectResponse> getProject(@PathVariable UUID id) {
    UUID memberId = RequestScopes.requireMemberId();
    return ResponseEntity.ok(ProjectResponse.from(projectService.getProject(id, memberId)));
  }

  @GetMapping("/{id}/access")
  @PreAuthorize("hasRole('USER')")
  public ResponseEntity<AccessResponse> getAccess(@PathVariable UUID id) {
    UUID memberId = RequestScopes.requireMemberId();
    projectAccessService.requireViewAccess(id, memberId);
    return ResponseEntity.ok(AccessResponse.from(projectAccessService.checkAccess(id, memberId)));
  }

  @PostMapping
  @PreAuthorize("hasRole('USER')")
  public ResponseEntity<ProjectResponse> createProject(
      @Valid @RequestBody CreateProjectRequest request) {
    UUID memberId = RequestScopes.requireMemberId();
    var project =
        projectService.createProject(
            request.name(), request.description(), request.deploymentSettings(), memberId);
    return ResponseEntity.created(URI.create("/api/projects/" + project.getId()))
        .body(ProjectResponse.from(new ProjectWithRole(project, ProjectRole.OWNER)));
  }

  @PutMapping("/{id}")
  @PreAuthorize("hasRole('USER')")
  public ResponseEntity<ProjectResponse> updateProject(
      @PathVariable UUID id, @Valid @RequestBody UpdateProjectRequest request) {
    UUID memberId = RequestScopes.requireMemberId();
    var status =
        request.deploymentStatus() != null
            ? DeploymentStatus.parse(request.deploymentStatus())
            : null;
    var updated =
        projectService.updateProject(
            id,
            request.name(),
            request.description(),
            request.active(),
            request.deploymentSettings(),
            status,
            memberId);
    return ResponseEntity.ok(ProjectResponse.from(updated));
  }

  @DeleteMapping("/{id}")
  @PreAuthorize("hasRole('USER')")
  public ResponseEntity<Void> deleteProject(@PathVariable UUID id) {
    UUID memberId = RequestScopes.requireMemberId();
    projectService.deleteProject(id, memberId);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  private static final String GITHUB_USERNAME = "^[a-zA-Z0-9]([a-zA-Z0-9-]){0,38}$";
  private static final String DATABASE_NAME = "^[a-zA-Z][a-zA-Z0-9_]*$";
  private static final String DOMAIN_NAME =
      "^(?:[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?\\.)+[a-zA-Z]{2,}$";
  private static final String HTTPS_URL = "^https?://\\S+$";

  public record CreateProjectRequest(
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      @Size(max = 2000, message = "description must be at most 2000 characters")
          String description,
      @Size(max = 39, message = "githubUsername must be at most 39 characters")
          @Pattern(regexp = GITHUB_USERNAME, message = "Invalid GitHub username format")
          String githubUsername,
      @Size(max = 63, message = "databaseName must be at most 63 characters")
          @Pattern(
              regexp = DATABASE_NAME,
              message =
                  "Database name must start with a letter and contain only letters, numbers and"
                      + " underscores")
          String databaseName,
      @Size(max = 253, message = "domainName must be at most 253 characters")
          @Pattern(regexp = DOMAIN_NAME, message = "Invalid domain name format")
          String domainName,
      @Size(max = 500, message = "githubLink must be at most 500 characters")
          @Pattern(regexp = HTTPS_URL, message = "githubLink must be a URL")
          String githubLink) {

    DeploymentSettings deploymentSettings() {
      return new DeploymentSettings(githubUsername, databaseName, domainName, githubLink);
    }
  }

  public record UpdateProjectRequest(
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      @Size(max = 2000, message = "description must be at most 2000 characters")
          String description,
      Boolean active,
      @Size(max = 39, message = "githubUsername must be at most 39 characters")
          @Pattern(regexp = GITHUB_USERNAME, message = "Invalid GitHub username format")
          String githubUsername,
      @Size(max = 63, message = "databaseName must be at most 63 characters")
          @Pattern(
              regexp = DATABASE_NAME,
              message =
                  "Database name must start with a letter and contain only letters, numbers and"
                      + " underscores")
          String databaseName,
      @Size(max = 253, message = "domainName must be at most 253 characters")
          @Pattern(regexp = DOMAIN_NAME, message = "Invalid domain name format")
          String domainName,
      @Size(max = 500, message = "githubLink must be at most 500 characters")
          @Pattern(regexp = HTTPS_URL, message = "githubLink must be a URL")
          String githubLink,
      String deploymentStatus) {

    DeploymentSettings deploymentSettings() {
      return new DeploymentSettings(githubUsername, databaseName, domainName, githubLink);
    }
  }

  public record ProjectResponse(
      UUID id,
      String name,
      String description,
      UUID ownerId,
      boolean active,
      String role,
      String githubUsername,
      String databaseName,
      String domainName,
      String githubLink,
      String githubRepoName,
      String deploymentUrl,
      String deploymentStatus,
      Instant createdAt,
      Instant updatedAt) {

    public static ProjectResponse from(ProjectWithRole pwr) {
      var project = pwr.project();
      return new ProjectResponse(
          project.getId(),
          project.getName(),
          project.getDescription(),
          project.getOwnerId(),
          project.isActive(),
          pwr.role().value(),
          project.getGithubUsername(),
          project.getDatabaseName(),
          project.getDomainName(),
          project.getGithubLink(),
          project.getGithubRepoName(),
          project.getDeploymentUrl(),
          project.getDeploymentStatus().value(),
          project.getCreatedAt(),
          project.getUpdatedAt());
    }
  }

  public record AccessResponse(
      String role,
      boolean canView,
      boolean canEdit,
      boolean canDelete,
      boolean canViewMembers,
      boolean canManageMembers) {

    public static AccessResponse from(ProjectAccess access) {
      return new AccessResponse(
          access.role().value(),
          access.canView(),
          access.canEdit(),
          access.canDelete(),
          access.canViewMembers(),
          access.canManageMembers());
    }
  }
}
