package com.gbskill.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/** Body of every non-2xx response. problems lists DSL validation failures when there are any. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String message, List<String> problems) {

    public ErrorResponse(String error, String message) {
        this(error, message, null);
    }
}
