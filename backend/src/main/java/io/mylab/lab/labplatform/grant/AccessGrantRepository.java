package io.mylab.lab.labplatform.grant;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AccessGrantRepository extends JpaRepository<AccessGrant, UUID> {

  /**
   * The active grant for (object, org): not revoked, and either no expiry or an expiry after {@code
   * cutoff}. The partial unique index guarantees at most one unrevoked row.
   */
  @Query(
      """
      SELECT g FROM AccessGrant g
      WHERE g.objectType = :objectType
        AND g.objectId = :objectId
        AND g.grantedToOrgId = :orgId
        AND g.revokedAt IS NULL
        AND (g.expiresAt IS NULL OR g.expiresAt > :cutoff)
      """)
  Optional<AccessGrant> findActive(
      @Param("objectType") String objectType,
      @Param("objectId") UUID objectId,
      @Param("orgId") UUID orgId,
      @Param("cutoff") Instant cutoff);

  /** The unrevoked row for (object, org), whether or not it has expired. */
  Optional<AccessGrant> findByObjectTypeAndObjectIdAndGrantedToOrgIdAndRevokedAtIsNull(
      String objectType, UUID objectId, UUID grantedToOrgId);

  List<AccessGrant> findByObjectTypeAndObjectIdOrderByCreatedAtDesc(
      String objectType, UUID objectId);

  List<AccessGrant> findByObjectTypeAndObjectIdAndRevokedAtIsNotNullOrderByRevokedAtDesc(
      String objectType, UUID objectId);
}
