package com.narraflow.narraflow_backend.repository;

import com.narraflow.narraflow_backend.model.domain.VariableReference;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface VariableReferenceRepository extends JpaRepository<VariableReference, UUID> {

    List<VariableReference> findByFlowNodeId(UUID flowNodeId);

    List<VariableReference> findByVariableId(String variableId);

    List<VariableReference> findByFlowId(UUID flowId);

    // Rows are [ReferenceKind, Long]
    @Query("select r.kind, count(r) from VariableReference r where r.variableId = :variableId group by r.kind")
    List<Object[]> countByKind(@Param("variableId") String variableId);

    @Modifying
    @Query("delete from VariableReference r where r.flowNodeId = :nodeId")
    int deleteByNodeId(@Param("nodeId") UUID nodeId);

    @Modifying
    @Query("delete from VariableReference r where r.flowId in :flowIds")
    int deleteByFlowIds(@Param("flowIds") Collection<UUID> flowIds);

    @Modifying
    @Query("delete from VariableReference r where r.variableId = :variableId")
    int deleteByVariableId(@Param("variableId") String variableId);
}
