package io.b2mash.b2b.collab.project;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProjectRepository extends JpaRepository<Project, UUID> {

  List<Project> findByOwnerIdOrderByCreatedAtDesc(UUID ownerId);

  boolean existsByOwnerIdAndName(UUID ownerId, String name);

  boolean existsByOwnerIdAndNameAndIdNot(UUID ownerId, String name, UUID id);

  long countByOwnerIdAndActiveTrue(UUID ownerId);

  long countByOwnerIdAndActiveTrueAndDeploymentStatus(UUID ownerId, DeploymentStatus status);

  List<Project> findTop5ByOwnerIdAndActiveTrueOrderByCreatedAtDesc(UUID ownerId);

  @Query(
      """
      SELECT new io.b2mash.b2b.collab.project.ProjectWithRole(p, c.role)
      FROM Project p JOIN Collaborator c ON p.id = c.projectId
      WHERE c.memberId = :memberId
      ORDER BY p.createdAt DESC
      """)
  List<ProjectWithRole> findCollaboratingProjects(@Param("memberId") UUID memberId);
}
