package com.gentoro.cdafinder.output;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.Map;

/**
 * One matched value inside a grouped field. Attribute matches carry {@code attributeName} and
 * {@code attributeValue}, and {@code attributes} then holds only that attribute.
 */
@JsonPropertyOrder({"tag", "text", "attributes", "path", "attributeName", "attributeValue"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GroupedEntry(
    String tag,
    String text,
    Map<String, String> attributes,
    String path,
    String attributeName,
    String attributeValue) {

  @JsonIgnore
  public boolean isAttribute() {
    return attributeName != null;
  }
}
