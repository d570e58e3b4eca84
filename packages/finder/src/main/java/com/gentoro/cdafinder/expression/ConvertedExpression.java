package com.gentoro.cdafinder.expression;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The result of converting one raw path expression.
 *
 * @param original the raw expression, byte for byte as supplied
 * @param steps normalized location steps, never empty
 * @param normalizedPath textual rendering of {@code steps}
 * @param predicate the extracted template predicate, or null
 * @param predicateStepIndex index in {@code steps} of the step carrying {@code predicate}, or -1
 * @param rootAnchored whether the expression started at the document element
 */
public record ConvertedExpression(
    String original,
    List<Step> steps,
    String normalizedPath,
    TemplatePredicate predicate,
    int predicateStepIndex,
    boolean rootAnchored) {

  public ConvertedExpression {
    Objects.requireNonNull(original, "original");
    steps = List.copyOf(steps);
    if (steps.isEmpty()) throw new IllegalArgumentException("steps must not be empty");
    if ((predicate == null) != (predicateStepIndex < 0)) {
      throw new IllegalArgumentException("predicate and predicateStepIndex disagree");
    }
  }

  public Optional<TemplatePredicate> templatePredicate() {
    return Optional.ofNullable(predicate);
  }

  public boolean hasTemplatePredicate() {
    return predicate != null;
  }

  /** Identifier of the template predicate, or null. */
  public String templateIdentifier() {
    return predicate == null ? null : predicate.requiredIdentifier();
  }

  public Step lastStep() {
    return steps.get(steps.size() - 1);
  }

  public boolean isAttributePath() {
    return lastStep().hasAttribute();
  }
}
