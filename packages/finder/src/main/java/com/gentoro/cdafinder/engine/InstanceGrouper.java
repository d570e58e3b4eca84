package com.gentoro.cdafinder.engine;

import com.gentoro.cdafinder.document.Node;
import com.gentoro.cdafinder.expression.Axis;
import com.gentoro.cdafinder.expression.ConvertedExpression;
import com.gentoro.cdafinder.expression.Step;
import com.gentoro.cdafinder.logging.LoggingService;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * Evaluates a set of expressions once per occurrence of a template and collects what each
 * occurrence holds.
 *
 * <p>Every expression is evaluated relative to the occurrence root, searching below it, and every
 * match is checked with the {@link ScopeBoundaryResolver} so values of a nested template never show
 * up in the enclosing occurrence.
 */
public class InstanceGrouper {
  private static final Logger log = LoggingService.getLogger(InstanceGrouper.class);

  private final TreeMatcher matcher;
  private final TemplateLocator locator;
  private final ScopeBoundaryResolver resolver;
  private final FieldNamer namer;
  private final TemplateDescriptions descriptions;

  public InstanceGrouper(
      TreeMatcher matcher,
      TemplateLocator locator,
      ScopeBoundaryResolver resolver,
      FieldNamer namer,
      TemplateDescriptions descriptions) {
    this.matcher = Objects.requireNonNull(matcher, "matcher");
    this.locator = Objects.requireNonNull(locator, "locator");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.namer = Objects.requireNonNull(namer, "namer");
    this.descriptions = Objects.requireNonNull(descriptions, "descriptions");
  }

  /**
   * Groups {@code expressions} by the occurrences of {@code identifier} found at or below {@code
   * scope}. Expressions scoped to a different template are skipped with a warning.
   */
  public InstanceGroup group(Node scope, String identifier, List<ConvertedExpression> expressions) {
    List<ConvertedExpression> applicable = new ArrayList<>();
    for (ConvertedExpression expression : expressions) {
      if (expression.hasTemplatePredicate()
          && !identifier.equals(expression.templateIdentifier())) {
        log.warn(
            "Skipping '{}': scoped to template {}, not {}",
            expression.original(),
            expression.templateIdentifier(),
            identifier);
        continue;
      }
      applicable.add(expression);
    }

    List<String> sources = new ArrayList<>();
    for (ConvertedExpression expression : applicable) sources.add(expression.original());
    Map<String, String> keys = namer.assignKeys(sources);

    List<TemplateInstance> occurrences = locator.locate(scope, identifier);
    List<GroupedInstance> instances = new ArrayList<>();
    for (TemplateInstance occurrence : occurrences) {
      FieldRecord fields = new FieldRecord();
      for (ConvertedExpression expression : applicable) {
        List<MatchResult> matches = resolver.filter(occurrence, evaluate(occurrence, expression));
        fields.put(keys.get(expression.original()), matches);
      }
      if (fields.isEmpty()) {
        log.debug("Occurrence {} of {} holds no data, dropped", occurrence.ordinal(), identifier);
        continue;
      }
      instances.add(new GroupedInstance(occurrence, fields));
    }

    log.info(
        "Template {}: {} of {} occurrence(s) with data",
        identifier,
        instances.size(),
        occurrences.size());
    return new InstanceGroup(identifier, descriptions.describe(identifier), sources, instances);
  }

  private List<MatchResult> evaluate(TemplateInstance occurrence, ConvertedExpression expression) {
    List<Step> relative = relativeSteps(expression);
    if (relative.isEmpty()) return List.of(MatchResult.element(occurrence.root()));
    return matcher.evaluate(occurrence.root(), relative);
  }

  /**
   * Steps after the template predicate, with the first one searching below the occurrence root.
   * An attribute on the predicate step itself becomes a self step.
   */
  static List<Step> relativeSteps(ConvertedExpression expression) {
    List<Step> steps = expression.steps();
    int from = 0;
    if (expression.hasTemplatePredicate()) {
      Step predicateStep = steps.get(expression.predicateStepIndex());
      if (predicateStep.hasAttribute()) {
        return List.of(Step.selfAttribute(predicateStep.attribute()));
      }
      from = expression.predicateStepIndex() + 1;
    }
    List<Step> relative = new ArrayList<>(steps.subList(from, steps.size()));
    if (!relative.isEmpty() && relative.get(0).axis() == Axis.CHILD) {
      relative.set(0, relative.get(0).withAxis(Axis.DESCENDANT));
    }
    return relative;
  }
}
