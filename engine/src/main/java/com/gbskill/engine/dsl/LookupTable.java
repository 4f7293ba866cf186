package com.gbskill.engine.dsl;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Two-dimensional lookup table copied from a standards document.
 *
 * Each row is positionally aligned with {@code columns}; cells are numbers,
 * strings, or null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"description", "columns", "data"})
public record LookupTable(
        String             description,
        List<String>       columns,
        @JsonAlias("rows")
        List<List<Object>> data) {

    public List<String> columnsOrEmpty() {
        return columns == null ? List.of() : columns;
    }

    public List<List<Object>> rowsOrEmpty() {
        return data == null ? List.of() : data;
    }

    /** Index of the first column whose header contains {@code fragment}, or -1. */
    public int columnContaining(String fragment) {
        List<String> cols = columnsOrEmpty();
        for (int i = 0; i < cols.size(); i++) {
            if (cols.get(i) != null && cols.get(i).contains(fragment)) {
                return i;
            }
        }
        return -1;
    }
}
