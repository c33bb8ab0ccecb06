package io.b2mash.b2b.collab.project;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "projects")
public class Project {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "description", length = 2000)
  private String description;

  @Column(name = "owner_id", nullable = false, updatable = false)
  private UUID ownerId;

  @Column(name = "github_username", length = 39)
  private String githubUsername;

  @Column(name = "database_name", length = 63)
  private String databaseName;

  @Column(name = "domain_name", length = 253)
  private String domainName;

  @Column(name = "github_link", length = 500)
  private String githubLink;

  @Enumerated(EnumType.STRING)
  @Column(name = "deployment_status", nullable = false, length = 20)
  private DeploymentStatus deploymentStatus;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Project() {}

  public Project(String name, String description, UUID ownerId) {
    this.name = name;
    this.description = description;
    this.ownerId = ownerId;
    this.deploymentStatus = DeploymentStatus.PENDING;
    this.active = true;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public UUID getOwnerId() {
    return ownerId;
  }

  public String getGithubUsername() {
    return githubUsername;
  }

  public String getDatabaseName() {
    return databaseName;
  }

  public String getDomainName() {
    return domainName;
  }

  public String getGithubLink() {
    return githubLink;
  }

  public DeploymentStatus getDeploymentStatus() {
    return deploymentStatus;
  }

  public DeploymentSettings getDeploymentSettings() {
    return new DeploymentSettings(githubUsername, databaseName, domainName, githubLink);
  }

  /** Last path segment of the GitHub link, or {@code null} without one. */
  public String getGithubRepoName() {
    if (githubLink == null) {
      return null;
    }
    String trimmed = githubLink.replaceAll("/+$", "");
    int slash = trimmed.lastIndexOf('/');
    return slash >= 0 && slash < trimmed.length() - 1 ? trimmed.substring(slash + 1) : null;
  }

  public String getDeploymentUrl() {
    return domainName != null ? "https://" + domainName : null;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public boolean isOwnedBy(UUID memberId) {
    return memberId != null && memberId.equals(ownerId);
  }

  /** The owner is fixed at creation. */
  public void update(String name, String description, boolean active) {
    this.name = name;
    this.description = description;
    this.active = active;
    this.updatedAt = Instant.now();
  }

  public void updateDeployment(DeploymentSettings settings, DeploymentStatus status) {
    settings.validate();
    this.githubUsername = settings.githubUsername();
    this.databaseName = settings.databaseName();
    this.domainName = settings.domainName();
    this.githubLink = settings.githubLink();
    this.deploymentStatus = status;
    this.updatedAt = Instant.now();
  }
}
