package com.gentoro.cdafinder.expression;

import com.gentoro.cdafinder.document.NamespaceTable;
import com.gentoro.cdafinder.document.Node;
import java.util.List;
import java.util.Objects;

/**
 * One location step of a converted expression.
 *
 * @param axis how candidates are selected from the context node
 * @param namespace namespace URI the element must be in, or null for no namespace
 * @param localName element local name, or null to accept any element
 * @param attribute attribute target of the step, or null when the step selects elements
 * @param predicate template predicate carried by this step, or null
 * @param conditions inline conditions every selected element must satisfy
 */
public record Step(
    Axis axis,
    String namespace,
    String localName,
    String attribute,
    TemplatePredicate predicate,
    List<StepCondition> conditions) {

  public Step {
    Objects.requireNonNull(axis, "axis");
    conditions = conditions == null ? List.of() : List.copyOf(conditions);
  }

  /** Self step that reads {@code attribute} from the context node. */
  public static Step selfAttribute(String attribute) {
    return new Step(Axis.SELF, null, null, attribute, null, List.of());
  }

  public boolean hasAttribute() {
    return attribute != null;
  }

  public boolean hasPredicate() {
    return predicate != null;
  }

  public Step withAxis(Axis newAxis) {
    return new Step(newAxis, namespace, localName, attribute, predicate, conditions);
  }

  public Step withAttribute(String newAttribute) {
    return new Step(axis, namespace, localName, newAttribute, predicate, conditions);
  }

  public Step withoutAttribute() {
    return withAttribute(null);
  }

  /** Name and condition test, independent of the axis. */
  public boolean accepts(Node node) {
    if (localName != null && !node.hasName(namespace, localName)) return false;
    for (StepCondition condition : conditions) {
      if (!condition.test(node)) return false;
    }
    return true;
  }

  /** Renders the step without its axis separator, e.g. {@code cda:code[@code='X']/@code}. */
  public String render(NamespaceTable namespaces) {
    StringBuilder sb = new StringBuilder();
    if (localName == null) {
      sb.append(axis == Axis.SELF ? "." : "*");
    } else {
      if (axis == Axis.SELF) sb.append("self::");
      sb.append(qualifiedName(namespaces, namespace, localName));
    }
    for (StepCondition condition : conditions) sb.append(condition.render(namespaces));
    if (attribute != null) sb.append("/@").append(attribute);
    return sb.toString();
  }

  static String qualifiedName(NamespaceTable namespaces, String namespace, String localName) {
    if (namespace == null) return localName;
    String prefix = namespaces.prefixFor(namespace);
    return prefix == null ? "{" + namespace + "}" + localName : prefix + ":" + localName;
  }
}
