package io.b2mash.b2b.collab.member;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MemberRepository extends JpaRepository<Member, UUID> {

  Optional<Member> findBySubject(String subject);

  Optional<Member> findByEmail(String email);

  /** Case-insensitive substring match on email or name, excluding one member, ordered by email. */
  @Query(
      """
      SELECT m FROM Member m
      WHERE m.id <> :excludeId
        AND (LOWER(m.email) LIKE LOWER(CONCAT('%', :query, '%'))
          OR LOWER(m.name) LIKE LOWER(CONCAT('%', :query, '%')))
      ORDER BY m.email
      """)
  List<Member> search(
      @Param("query") String query, @Param("excludeId") UUID excludeId, Pageable pageable);
}
