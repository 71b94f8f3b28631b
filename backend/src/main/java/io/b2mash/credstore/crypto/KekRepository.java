package io.b2mash.credstore.crypto;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface KekRepository extends JpaRepository<KekMetadata, UUID> {

  Optional<KekMetadata> findByScopeAndVersion(String scope, int version);

  Optional<KekMetadata> findFirstByScopeAndStatus(String scope, KekStatus status);

  List<KekMetadata> findByScopeOrderByVersionDesc(String scope);

  List<KekMetadata> findByStatus(KekStatus status);

  List<KekMetadata> findByScopeAndStatus(String scope, KekStatus status);

  @Modifying
  @Query(
      value = "INSERT INTO kek_scopes (scope) VALUES (:scope) ON CONFLICT DO NOTHING",
      nativeQuery = true)
  int registerScope(@Param("scope") String scope);

  /** Row lock that serializes KEK creation and rotation within one scope. */
  @Query(value = "SELECT scope FROM kek_scopes WHERE scope = :scope FOR UPDATE", nativeQuery = true)
  String lockScope(@Param("scope") String scope);

  @Query("SELECT COALESCE(MAX(k.version), 0) FROM KekMetadata k WHERE k.scope = :scope")
  int findMaxVersion(@Param("scope") String scope);
}
