package io.b2mash.b2b.collab.invitation;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InvitationRepository extends JpaRepository<Invitation, UUID> {

  Optional<Invitation> findByToken(String token);

  boolean existsByProjectIdAndPendingInviteeId(UUID projectId, UUID inviteeId);

  boolean existsByProjectIdAndPendingEmail(UUID projectId, String email);

  List<Invitation> findByProjectIdOrderByCreatedAtDesc(UUID projectId);

  long countByProjectIdAndStatus(UUID projectId, InvitationStatus status);

  /** Pending invitations addressed to the member by id or by email address, newest first. */
  @Query(
      """
      SELECT i FROM Invitation i
      WHERE i.status = io.b2mash.b2b.collab.invitation.InvitationStatus.PENDING
        AND (i.inviteeId = :memberId OR i.email = :email)
      ORDER BY i.createdAt DESC
      """)
  List<Invitation> findPendingForRecipient(
      @Param("memberId") UUID memberId, @Param("email") String email);
}
