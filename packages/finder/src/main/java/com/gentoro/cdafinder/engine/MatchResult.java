package com.gentoro.cdafinder.engine;

import com.gentoro.cdafinder.document.Node;
import java.util.Objects;

/** Outcome of evaluating one expression: an element, an attribute, or nothing at all. */
public sealed interface MatchResult
    permits MatchResult.ElementMatch, MatchResult.AttributeMatch, MatchResult.NotFound {

  static ElementMatch element(Node node) {
    return new ElementMatch(node, node.path());
  }

  static AttributeMatch attribute(Node node, String attributeName) {
    return new AttributeMatch(
        node, attributeName, node.attribute(attributeName), node.path() + "/@" + attributeName);
  }

  static NotFound notFound(String originalExpression) {
    return new NotFound(originalExpression);
  }

  default boolean found() {
    return !(this instanceof NotFound);
  }

  /** The matched node, or null for {@link NotFound}. */
  default Node node() {
    return null;
  }

  record ElementMatch(Node node, String path) implements MatchResult {
    public ElementMatch {
      Objects.requireNonNull(node, "node");
    }
  }

  record AttributeMatch(Node node, String attributeName, String attributeValue, String path)
      implements MatchResult {
    public AttributeMatch {
      Objects.requireNonNull(node, "node");
      Objects.requireNonNull(attributeName, "attributeName");
    }
  }

  /** Nothing matched; carries the raw expression exactly as supplied. */
  record NotFound(String originalExpression) implements MatchResult {}
}
