package io.b2mash.b2b.collab.collaborator;

import io.b2mash.b2b.collab.access.ProjectRole;
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
@Table(name = "collaborators")
public class Collaborator {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  @Column(name = "member_id", nullable = false, updatable = false)
  private UUID memberId;

  @Enumerated(EnumType.STRING)
  @Column(name = "role", nullable = false, length = 20)
  private CollaboratorRole role;

  /** Null when the grant was made by the system. */
  @Column(name = "added_by")
  private UUID addedBy;

  @Column(name = "added_at", nullable = false, updatable = false)
  private Instant addedAt;

  protected Collaborator() {}

  public Collaborator(UUID projectId, UUID memberId, CollaboratorRole role, UUID addedBy) {
    this.projectId = projectId;
    this.memberId = memberId;
    this.role = role;
    this.addedBy = addedBy;
    this.addedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public UUID getMemberId() {
    return memberId;
  }

  public CollaboratorRole getRole() {
    return role;
  }

  public ProjectRole projectRole() {
    return role.toProjectRole();
  }

  public void changeRole(CollaboratorRole role) {
    this.role = role;
  }

  public UUID getAddedBy() {
    return addedBy;
  }

  public Instant getAddedAt() {
    return addedAt;
  }
}
