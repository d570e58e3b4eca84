package com.gentoro.cdafinder.expression;

import com.gentoro.cdafinder.document.NamespaceTable;
import com.gentoro.cdafinder.document.Node;

/** An inline predicate a node must satisfy to be selected by a {@link Step}. */
public interface StepCondition {

  boolean test(Node node);

  /** Textual form used in normalized paths. */
  String render(NamespaceTable namespaces);

  /** {@code [@name='value']}: the node carries the attribute with exactly that value. */
  record AttributeEquals(String attribute, String value) implements StepCondition {
    @Override
    public boolean test(Node node) {
      return value.equals(node.attribute(attribute));
    }

    @Override
    public String render(NamespaceTable namespaces) {
      return "[@" + attribute + "='" + value + "']";
    }
  }

  /**
   * {@code [child[@name='value']]}: the node has a direct child element carrying the attribute with
   * exactly that value.
   */
  record ChildAttributeEquals(String namespace, String child, String attribute, String value)
      implements StepCondition {
    @Override
    public boolean test(Node node) {
      for (Node c : node.children(namespace, child)) {
        if (value.equals(c.attribute(attribute))) return true;
      }
      return false;
    }

    @Override
    public String render(NamespaceTable namespaces) {
      return "["
          + Step.qualifiedName(namespaces, namespace, child)
          + "[@"
          + attribute
          + "='"
          + value
          + "']]";
    }
  }
}
