package com.gbskill.engine.dsl;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Fixed four-level category hierarchy a skill assigns to every material it parses.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"primaryCategory", "secondaryCategory", "tertiaryCategory",
        "quaternaryCategory", "categoryId", "commonName"})
public record CategoryMapping(
        String primaryCategory,
        String secondaryCategory,
        String tertiaryCategory,
        String quaternaryCategory,
        String categoryId,
        @JsonAlias("canonicalName")
        String commonName) {

    public static final String UNCATEGORIZED = "未分类";

    /** Category attached to results that no skill claimed. */
    public static CategoryMapping uncategorized() {
        return new CategoryMapping(UNCATEGORIZED, "", "", "", "", "");
    }
}
