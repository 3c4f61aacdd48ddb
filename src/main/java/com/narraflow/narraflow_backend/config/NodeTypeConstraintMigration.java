package com.narraflow.narraflow_backend.config;

import com.narraflow.narraflow_backend.model.domain.NodeType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Rewrites the flow_nodes node_type check constraint to list every {@link NodeType}.
 * Schema update never widens a check constraint created for an older set of node types.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NodeTypeConstraintMigration {

    private final JdbcTemplate jdbcTemplate;

    @EventListener(ApplicationReadyEvent.class)
    public void updateNodeTypeConstraint() {
        try {
            String allowed = String.join("', '", Arrays.stream(NodeType.values()).map(Enum::name).toList());
            jdbcTemplate.execute("ALTER TABLE flow_nodes DROP CONSTRAINT IF EXISTS flow_nodes_node_type_check");
            jdbcTemplate.execute("ALTER TABLE flow_nodes ADD CONSTRAINT flow_nodes_node_type_check CHECK (node_type IN ('" + allowed + "'))");
            log.debug("Updated flow_nodes_node_type_check to allow all node types");
        } catch (Exception e) {
            log.warn("Could not update flow_nodes_node_type_check (constraint may already be correct): {}", e.getMessage());
        }
    }
}
