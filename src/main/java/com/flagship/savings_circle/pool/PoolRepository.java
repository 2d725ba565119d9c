package com.flagship.savings_circle.pool;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface PoolRepository extends JpaRepository<PoolEntity, UUID> {

    /**
     * Loads a pool for a read-modify-write cycle.
     *
     * OPTIMISTIC_FORCE_INCREMENT bumps the version at commit even when the
     * pool row itself is unchanged (e.g. only a contribution was written),
     * so a concurrent writer that read the same version fails to commit.
     */
    @Lock(LockModeType.OPTIMISTIC_FORCE_INCREMENT)
    @Query("SELECT p FROM PoolEntity p WHERE p.id = :id")
    Optional<PoolEntity> findByIdForWrite(@Param("id") UUID id);

    long countByStatus(PoolStatus status);
}
