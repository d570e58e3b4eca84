package com.gentoro.cdafinder.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Map;

/** One row of flat output: a single match, or the single not-found row of an expression. */
@JsonPropertyOrder({
  "originalExpression",
  "normalizedPath",
  "context",
  "dataElement",
  "template",
  "cardinality",
  "matchedTag",
  "matchedText",
  "matchedAttributes",
  "matchedPath",
  "found",
  "isAttribute"
})
public record FlatResult(
    @JsonProperty("originalExpression") String originalExpression,
    @JsonProperty("normalizedPath") String normalizedPath,
    @JsonProperty("context") String context,
    @JsonProperty("dataElement") String dataElement,
    @JsonProperty("template") String template,
    @JsonProperty("cardinality") String cardinality,
    @JsonProperty("matchedTag") String matchedTag,
    @JsonProperty("matchedText") String matchedText,
    @JsonProperty("matchedAttributes") Map<String, String> matchedAttributes,
    @JsonProperty("matchedPath") String matchedPath,
    @JsonProperty("found") boolean found,
    @JsonProperty("isAttribute") @JsonInclude(JsonInclude.Include.NON_NULL) Boolean isAttribute) {}
