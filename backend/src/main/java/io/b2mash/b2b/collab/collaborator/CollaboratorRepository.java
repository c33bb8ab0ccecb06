package io.b2mash.b2b.collab.collaborator;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CollaboratorRepository extends JpaRepository<Collaborator, UUID> {

  Optional<Collaborator> findByProjectIdAndMemberId(UUID projectId, UUID memberId);

  Optional<Collaborator> findByIdAndProjectId(UUID id, UUID projectId);

  boolean existsByProjectIdAndMemberId(UUID projectId, UUID memberId);

  @Query(
      """
      SELECT new io.b2mash.b2b.collab.collaborator.CollaboratorInfo(
          c.id, c.projectId, c.memberId, m.name, m.email, c.role, c.addedBy, c.addedAt
      )
      FROM Collaborator c JOIN Member m ON c.memberId = m.id
      WHERE c.projectId = :projectId
      ORDER BY c.addedAt DESC
      """)
  List<CollaboratorInfo> findCollaboratorsWithDetails(@Param("projectId") UUID projectId);

  @Query(
      """
      SELECT new io.b2mash.b2b.collab.collaborator.CollaborationInfo(
          c.id, p.id, p.name, p.active, c.role, c.addedAt
      )
      FROM Collaborator c JOIN Project p ON c.projectId = p.id
      WHERE c.memberId = :memberId
      ORDER BY c.addedAt DESC
      """)
  List<CollaborationInfo> findCollaborationsForMember(@Param("memberId") UUID memberId);
}
