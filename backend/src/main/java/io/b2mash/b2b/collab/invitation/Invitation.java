package io.b2mash.b2b.collab.invitation;

import io.b2mash.b2b.collab.exception.InvalidStateException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * An offer to join a project, addressed either to a known member ({@code inviteeId}) or to a bare
 * email address. The pair {@code pendingInviteeId} / {@code pendingEmail} mirrors the recipient
 * while the invitation is pending and is cleared on every terminal transition; unique constraints
 * on those columns allow at most one pending invitation per recipient and project.
 */
@Entity
@Table(name = "invitations")
public class Invitation {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private UUID projectId;

  @Column(name = "inviter_id", nullable = false, updatable = false)
  private UUID inviterId;

  @Column(name = "invitee_id")
  private UUID inviteeId;

  @Column(name = "email", length = 255, updatable = false)
  private String email;

  @Column(name = "token", nullable = false, unique = true, length = 64, updatable = false)
  private String token;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private InvitationStatus status;

  @Column(name = "pending_invitee_id")
  private UUID pendingInviteeId;

  @Column(name = "pending_email", length = 255)
  private String pendingEmail;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "expires_at", nullable = false)
  private Instant expiresAt;

  @Column(name = "accepted_at")
  private Instant acceptedAt;

  @Column(name = "declined_at")
  private Instant declinedAt;

  @Column(name = "cancelled_at")
  private Instant cancelledAt;

  @Column(name = "cancelled_by")
  private UUID cancelledBy;

  @Column(name = "last_sent_at")
  private Instant lastSentAt;

  @Column(name = "resend_count", nullable = false)
  private int resendCount;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  protected Invitation() {}

  public Invitation(
      UUID projectId,
      UUID inviterId,
      UUID inviteeId,
      String email,
      String token,
      Instant expiresAt) {
    this.projectId = Objects.requireNonNull(projectId, "projectId must not be null");
    this.inviterId = Objects.requireNonNull(inviterId, "inviterId must not be null");
    this.inviteeId = inviteeId;
    this.email = email;
    this.token = Objects.requireNonNull(token, "token must not be null");
    this.expiresAt = Objects.requireNonNull(expiresAt, "expiresAt must not be null");
    this.status = InvitationStatus.PENDING;
    this.pendingInviteeId = inviteeId;
    this.pendingEmail = email;
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  // --- Lifecycle transitions ---

  /**
   * Marks the invitation accepted by {@code memberId}. Email-only invitations become bound to the
   * accepting member.
   */
  public void markAccepted(UUID memberId) {
    requirePending("accept");
    Objects.requireNonNull(memberId, "memberId must not be null");
    if (this.inviteeId == null) {
      this.inviteeId = memberId;
    }
    this.status = InvitationStatus.ACCEPTED;
    this.acceptedAt = Instant.now();
    leavePending();
  }

  public void markDeclined() {
    requirePending("decline");
    this.status = InvitationStatus.DECLINED;
    this.declinedAt = Instant.now();
    leavePending();
  }

  public void markCancelled(UUID cancelledBy) {
    requirePending("cancel");
    this.status = InvitationStatus.CANCELLED;
    this.cancelledBy = Objects.requireNonNull(cancelledBy, "cancelledBy must not be null");
    this.cancelledAt = Instant.now();
    leavePending();
  }

  public void markExpired() {
    requirePending("expire");
    this.status = InvitationStatus.EXPIRED;
    leavePending();
  }

  /** Pushes the deadline out for a resend. Only valid while pending. */
  public void resetExpiry(Instant newExpiresAt) {
    requirePending("resend");
    this.expiresAt = Objects.requireNonNull(newExpiresAt, "newExpiresAt must not be null");
    this.resendCount++;
    this.updatedAt = Instant.now();
  }

  public void recordSent() {
    this.lastSentAt = Instant.now();
    this.updatedAt = this.lastSentAt;
  }

  public boolean isPending() {
    return status == InvitationStatus.PENDING;
  }

  /** True once the current time is past {@code expiresAt}, whatever the status. */
  public boolean isExpired() {
    return Instant.now().isAfter(expiresAt);
  }

  /** True if {@code memberId} may act as this invitation's recipient. */
  public boolean isAddressedTo(UUID memberId) {
    return inviteeId == null || inviteeId.equals(memberId);
  }

  public void requirePending(String action) {
    if (status != InvitationStatus.PENDING) {
      throw new InvalidStateException(
          "Invalid invitation state", "Cannot " + action + " invitation in status " + status);
    }
  }

  private void leavePending() {
    this.pendingInviteeId = null;
    this.pendingEmail = null;
    this.updatedAt = Instant.now();
  }

  // --- Getters ---

  public UUID getId() {
    return id;
  }

  public UUID getProjectId() {
    return projectId;
  }

  public UUID getInviterId() {
    return inviterId;
  }

  public UUID getInviteeId() {
    return inviteeId;
  }

  public String getEmail() {
    return email;
  }

  public String getToken() {
    return token;
  }

  public InvitationStatus getStatus() {
    return status;
  }

  public UUID getPendingInviteeId() {
    return pendingInviteeId;
  }

  public String getPendingEmail() {
    return pendingEmail;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public Instant getAcceptedAt() {
    return acceptedAt;
  }

  public Instant getDeclinedAt() {
    return declinedAt;
  }

  public Instant getCancelledAt() {
    return cancelledAt;
  }

  public UUID getCancelledBy() {
    return cancelledBy;
  }

  public Instant getLastSentAt() {
    return lastSentAt;
  }

  public int getResendCount() {
    return resendCount;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public long getVersion() {
    return version;
  }
}
