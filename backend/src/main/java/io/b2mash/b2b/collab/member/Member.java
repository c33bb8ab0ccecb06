package io.b2mash.b2b.collab.member;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/** A user known to the system, keyed by the subject of their identity-provider token. */
@Entity
@Table(name = "members")
public class Member {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "subject", nullable = false, length = 255)
  private String subject;

  @Column(name = "email", nullable = false, length = 255)
  private String email;

  @Column(name = "name", length = 255)
  private String name;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Member() {}

  public Member(String subject, String email, String name) {
    this.subject = subject;
    this.email = normalizeEmail(email);
    this.name = name;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getSubject() {
    return subject;
  }

  public String getEmail() {
    return email;
  }

  public String getName() {
    return name;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  /** Applies profile values from the identity provider. Returns true if anything changed. */
  public boolean updateProfile(String email, String name) {
    String normalized = normalizeEmail(email);
    if (Objects.equals(this.email, normalized) && Objects.equals(this.name, name)) {
      return false;
    }
    this.email = normalized;
    this.name = name;
    this.updatedAt = Instant.now();
    return true;
  }

  public static String normalizeEmail(String email) {
    return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
  }
}
