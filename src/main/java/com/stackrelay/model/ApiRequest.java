package com.stackrelay.model;

import lombok.Value;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * One logical call against the API: an operation plus its query parameters.
 */
@Value
public class ApiRequest {

    ApiOperation operation;

    /**
     * Parameters sorted by name; values are sent verbatim.
     */
    Map<String, String> parameters;

    private ApiRequest(ApiOperation operation, Map<String, String> parameters) {
        this.operation = Objects.requireNonNull(operation, "operation");
        this.parameters = Collections.unmodifiableMap(new TreeMap<>(parameters));
    }

    public static ApiRequest of(ApiOperation operation, Map<String, String> parameters) {
        return new ApiRequest(operation, parameters == null ? Map.of() : parameters);
    }

    public String parameter(String name) {
        return parameters.get(name);
    }
}
