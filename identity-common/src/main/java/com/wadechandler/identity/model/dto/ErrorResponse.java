package com.wadechandler.identity.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Error body returned by the API. {@code details} is only present for validation failures.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String error,
        List<FieldProblem> details
) {

    public static final String ROOT_PATH = "(root)";

    public static ErrorResponse validationFailed(List<FieldProblem> details) {
        return new ErrorResponse("Validation failed", details);
    }

    public static ErrorResponse internalError() {
        return new ErrorResponse("Internal server error", null);
    }

    public record FieldProblem(String path, String message) {}
}
