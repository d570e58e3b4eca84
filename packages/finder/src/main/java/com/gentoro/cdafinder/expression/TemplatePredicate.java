package com.gentoro.cdafinder.expression;

import java.util.Objects;

/**
 * The {@code elem[templateId[@root='ID']]} predicate of an expression, extracted from its step.
 *
 * @param elementName local name of the element the predicate was attached to
 * @param requiredIdentifier the template identifier ({@code root}) the element must carry
 */
public record TemplatePredicate(String elementName, String requiredIdentifier) {
  public TemplatePredicate {
    Objects.requireNonNull(elementName, "elementName");
    Objects.requireNonNull(requiredIdentifier, "requiredIdentifier");
  }

  @Override
  public String toString() {
    return elementName + "[templateId[@root='" + requiredIdentifier + "']]";
  }
}
