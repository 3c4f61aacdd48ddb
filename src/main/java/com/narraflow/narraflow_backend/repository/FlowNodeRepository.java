package com.narraflow.narraflow_backend.repository;

import com.narraflow.narraflow_backend.model.domain.FlowNode;
import com.narraflow.narraflow_backend.model.domain.NodeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface FlowNodeRepository extends JpaRepository<FlowNode, UUID> {

    Optional<FlowNode> findByIdAndDeletedAtIsNull(UUID id);

    List<FlowNode> findByFlowIdAndDeletedAtIsNullOrderByCreatedAtAsc(UUID flowId);

    List<FlowNode> findByFlowIdAndNodeTypeAndDeletedAtIsNull(UUID flowId, NodeType nodeType);

    List<FlowNode> findByFlowIdAndNodeType(UUID flowId, NodeType nodeType);

    List<FlowNode> findByFlowIdAndNodeTypeInAndDeletedAtIsNull(UUID flowId, Collection<NodeType> nodeTypes);

    long countByFlowIdAndNodeTypeAndDeletedAtIsNull(UUID flowId, NodeType nodeType);

    List<FlowNode> findByFlowIdInAndDeletedAtIsNull(Collection<UUID> flowIds);

    @Modifying
    @Query("delete from FlowNode n where n.flowId in :flowIds")
    int deleteByFlowIds(@Param("flowIds") Collection<UUID> flowIds);
}
