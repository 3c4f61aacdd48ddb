package com.narraflow.narraflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body of every failed REST call and of messages sent to {@code /user/queue/errors}.
 * {@code details} carries extra context, such as the lease holder of a lock conflict.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiError(
    String error,
    String code,
    String entityId,
    Object details
) {
    public static ApiError of(String error, String code) {
        return new ApiError(error, code, null, null);
    }
}
