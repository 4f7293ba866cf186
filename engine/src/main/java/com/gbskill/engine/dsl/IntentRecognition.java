package com.gbskill.engine.dsl;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Recognition signals of a skill. Used only to score a skill against
 * input text, never to extract values.
 *
 * @param keywords case-insensitive substrings, each worth 1.0
 * @param patterns regular expressions, each worth 1.5 when found
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record IntentRecognition(List<String> keywords, List<String> patterns) {

    public List<String> keywordsOrEmpty() {
        return keywords == null ? List.of() : keywords;
    }

    public List<String> patternsOrEmpty() {
        return patterns == null ? List.of() : patterns;
    }
}
