package com.narraflow.narraflow_backend.repository;

import com.narraflow.narraflow_backend.model.domain.FlowConnection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface FlowConnectionRepository extends JpaRepository<FlowConnection, UUID> {

    List<FlowConnection> findByFlowIdOrderByCreatedAtAsc(UUID flowId);

    @Query("select c from FlowConnection c where c.sourceNodeId = :nodeId or c.targetNodeId = :nodeId")
    List<FlowConnection> findTouching(@Param("nodeId") UUID nodeId);

    Optional<FlowConnection> findFirstByFlowIdAndSourceNodeIdAndSourcePinAndTargetNodeIdAndTargetPin(
            UUID flowId, UUID sourceNodeId, String sourcePin, UUID targetNodeId, String targetPin);

    @Modifying
    @Query("delete from FlowConnection c where c.flowId in :flowIds")
    int deleteByFlowIds(@Param("flowIds") Collection<UUID> flowIds);
}
