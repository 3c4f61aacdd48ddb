package com.narraflow.narraflow_backend.nodetype;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.narraflow.narraflow_backend.exception.PayloadSchemaViolationException;
import com.narraflow.narraflow_backend.model.domain.FlowNode;
import com.narraflow.narraflow_backend.model.domain.NodeType;
import com.narraflow.narraflow_backend.model.payload.NodePayload;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Closed set of node types. Converts raw JSON payloads into typed {@link NodePayload} records,
 * rejecting unknown fields, wrong JSON types and missing required fields.
 */
@Slf4j
@Component
public class NodeTypeRegistry {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final List<NodeTypeHandler> handlers;
    private final ObjectMapper strictMapper;
    private final Map<NodeType, NodeTypeHandler> registry = new EnumMap<>(NodeType.class);

    public NodeTypeRegistry(List<NodeTypeHandler> handlers, ObjectMapper objectMapper) {
        this.handlers = handlers;
        this.strictMapper = objectMapper.copy()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
                .enable(DeserializationFeature.FAIL_ON_NUMBERS_FOR_ENUMS);
    }

    @PostConstruct
    public void init() {
        handlers.forEach(handler -> registry.put(handler.supportedType(), handler));
        Set<NodeType> missing = EnumSet.allOf(NodeType.class);
        missing.removeAll(registry.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No handler registered for node types: " + missing);
        }
        log.debug("Registered {} node type handlers", registry.size());
    }

    public NodeTypeHandler get(NodeType type) {
        NodeTypeHandler handler = registry.get(type);
        if (handler == null) {
            throw new UnsupportedOperationException("No handler registered for node type: " + type);
        }
        return handler;
    }

    public NodePayload defaultPayload(NodeType type) {
        return get(type).defaultPayload();
    }

    /** Validates and normalises a raw payload. */
    public NodePayload parse(NodeType type, Map<String, Object> raw) {
        if (raw == null) {
            throw new PayloadSchemaViolationException("Payload of a " + type.wireName() + " node is required");
        }
        NodeTypeHandler handler = get(type);
        NodePayload payload;
        try {
            payload = strictMapper.convertValue(raw, handler.payloadClass());
        } catch (IllegalArgumentException e) {
            throw new PayloadSchemaViolationException(
                    "Invalid " + type.wireName() + " payload: " + rootMessage(e), e);
        }
        return handler.normalize(payload);
    }

    /** Typed view of a stored node. */
    public NodePayload read(FlowNode node) {
        return parse(node.getNodeType(), node.getPayload());
    }

    public Map<String, Object> toMap(NodePayload payload) {
        return strictMapper.convertValue(payload, MAP_TYPE);
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        // Jackson appends a source location on a new line
        int newline = message != null ? message.indexOf('\n') : -1;
        return newline > 0 ? message.substring(0, newline) : String.valueOf(message);
    }
}
