package com.narraflow.narraflow_backend.nodetype;

import com.narraflow.narraflow_backend.exception.PayloadSchemaViolationException;
import com.narraflow.narraflow_backend.model.domain.NodeType;
import com.narraflow.narraflow_backend.model.payload.NodePayload;

import java.util.UUID;
import java.util.regex.Pattern;

abstract class TypedNodeTypeHandler<P extends NodePayload> implements NodeTypeHandler {

    private static final Pattern HEX_COLOR = Pattern.compile("^#[0-9a-fA-F]{6}$");

    private final NodeType type;
    private final Class<P> payloadClass;

    protected TypedNodeTypeHandler(NodeType type, Class<P> payloadClass) {
        this.type = type;
        this.payloadClass = payloadClass;
    }

    @Override
    public NodeType supportedType() {
        return type;
    }

    @Override
    public Class<P> payloadClass() {
        return payloadClass;
    }

    @Override
    public abstract P defaultPayload();

    @Override
    public final NodePayload normalize(NodePayload payload) {
        if (!payloadClass.isInstance(payload)) {
            throw violation("expected a " + type.wireName() + " payload");
        }
        return normalizeTyped(payloadClass.cast(payload));
    }

    protected P normalizeTyped(P payload) {
        return payload;
    }

    protected PayloadSchemaViolationException violation(String detail) {
        return new PayloadSchemaViolationException("Invalid " + type.wireName() + " payload: " + detail);
    }

    protected <T> T required(T value, String field) {
        if (value == null) {
            throw violation(field + " is required");
        }
        return value;
    }

    protected String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    protected void checkHexColor(String value, String field) {
        if (value != null && !HEX_COLOR.matcher(value).matches()) {
            throw violation(field + " must be a hex color like #a1b2c3, got '" + value + "'");
        }
    }

    /** Returns the normalised UUID string, or null when blank. */
    protected String flowIdOrNull(String value, String field) {
        String trimmed = blankToNull(value);
        if (trimmed == null) {
            return null;
        }
        try {
            return UUID.fromString(trimmed).toString();
        } catch (IllegalArgumentException e) {
            throw violation(field + " is not a valid flow id: '" + trimmed + "'");
        }
    }
}
