package com.narraflow.narraflow_backend.repository;

import com.narraflow.narraflow_backend.model.domain.Flow;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface FlowRepository extends JpaRepository<Flow, UUID> {

    Optional<Flow> findByIdAndDeletedAtIsNull(UUID id);

    // Row lock serializing graph edits of one flow (hub ids, jump targets, connection endpoints)
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select f from Flow f where f.id = :id")
    Optional<Flow> findByIdForUpdate(@Param("id") UUID id);

    List<Flow> findByProjectIdAndDeletedAtIsNullOrderByPositionAscNameAsc(UUID projectId);

    List<Flow> findByProjectIdAndDeletedAtIsNotNullOrderByDeletedAtDesc(UUID projectId);

    // Siblings: root level and under a parent are separate queries so no null UUID is ever bound
    List<Flow> findByProjectIdAndParentIdIsNullAndDeletedAtIsNullOrderByPositionAscNameAsc(UUID projectId);

    List<Flow> findByProjectIdAndParentIdAndDeletedAtIsNullOrderByPositionAscNameAsc(UUID projectId, UUID parentId);

    List<Flow> findByParentId(UUID parentId);

    boolean existsByProjectIdAndShortcutAndDeletedAtIsNull(UUID projectId, String shortcut);

    boolean existsByProjectIdAndShortcutAndDeletedAtIsNullAndIdNot(UUID projectId, String shortcut, UUID id);

    List<Flow> findByDeletedAtBefore(Instant cutoff);
}
