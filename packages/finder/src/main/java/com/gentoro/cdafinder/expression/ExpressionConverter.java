package com.gentoro.cdafinder.expression;

import com.gentoro.cdafinder.config.FinderSettings;
import com.gentoro.cdafinder.document.NamespaceTable;
import com.gentoro.cdafinder.expression.PathSyntax.Condition;
import com.gentoro.cdafinder.expression.PathSyntax.Kind;
import com.gentoro.cdafinder.expression.PathSyntax.PathSegment;
import com.gentoro.cdafinder.logging.LoggingService;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * Turns raw catalog paths into {@link ConvertedExpression}s.
 *
 * <p>Conversion rules, applied in order:
 *
 * <ol>
 *   <li>The first {@code elem[templateId[@root='ID']]} predicate is extracted as the expression's
 *       {@link TemplatePredicate}; its step keeps the bare element name. Later template predicates
 *       stay ordinary inline conditions.
 *   <li>A leading step naming the document element is dropped and the expression becomes anchored
 *       at the document element.
 *   <li>Unprefixed names from {@link CdaVocabulary} are qualified with the primary namespace;
 *       prefixed names resolve through the {@link NamespaceTable}.
 *   <li>An unanchored expression whose first step names a repeating act on the child axis searches
 *       the whole document instead.
 *   <li>{@code elem/@attr} becomes the attribute target of {@code elem}.
 * </ol>
 *
 * <p>The converter keeps no state between calls.
 */
public class ExpressionConverter {
  private static final Logger log = LoggingService.getLogger(ExpressionConverter.class);

  private static final String TEMPLATE_MARKER = "templateId";
  private static final String TEMPLATE_IDENTIFIER_ATTRIBUTE = "root";

  private final PathSyntax syntax = new PathSyntax();
  private final NamespaceTable namespaces;
  private final String rootElement;

  public ExpressionConverter(NamespaceTable namespaces, String rootElement) {
    this.namespaces = Objects.requireNonNull(namespaces, "namespaces");
    this.rootElement = Objects.requireNonNull(rootElement, "rootElement");
  }

  public ExpressionConverter(FinderSettings settings) {
    this(settings.namespaces(), settings.rootElement());
  }

  public ExpressionConverter() {
    this(FinderSettings.defaults());
  }

  public NamespaceTable namespaces() {
    return namespaces;
  }

  /**
   * Converts {@code raw}.
   *
   * @throws ExpressionConversionException when the expression is empty, has neither a step
   *     separator nor an attribute marker, is malformed, or uses an unknown namespace prefix
   */
  public ConvertedExpression convert(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new ExpressionConversionException("Path expression must not be empty");
    }
    if (raw.indexOf('/') < 0 && raw.indexOf('@') < 0) {
      throw new ExpressionConversionException(
          "Path expression '%s' contains neither a step separator nor an attribute".formatted(raw));
    }

    List<PathSegment> segments = new ArrayList<>(syntax.parse(raw).segments());

    TemplatePredicate predicate = null;
    int predicateSegment = -1;
    for (int i = 0; i < segments.size() && predicate == null; i++) {
      PathSegment segment = segments.get(i);
      if (segment.kind() != Kind.ELEMENT) continue;
      List<Condition> remaining = new ArrayList<>(segment.conditions());
      for (Condition condition : segment.conditions()) {
        if (isTemplateMarker(condition)) {
          predicate = new TemplatePredicate(segment.name(), condition.value());
          predicateSegment = i;
          remaining.remove(condition);
          segments.set(i, segment.withConditions(remaining));
          break;
        }
      }
    }

    boolean anchored = false;
    PathSegment first = segments.get(0);
    if (isDocumentElement(first)) {
      anchored = true;
      if (first.conditions().isEmpty() && predicateSegment != 0) {
        segments.remove(0);
        if (predicateSegment > 0) predicateSegment--;
      } else {
        // The document element itself is constrained, so keep it as a self test.
        segments.set(0, first.withAxis(Axis.SELF));
      }
    }

    List<Step> steps = new ArrayList<>();
    int predicateStep = -1;
    for (int i = 0; i < segments.size(); i++) {
      PathSegment segment = segments.get(i);
      switch (segment.kind()) {
        case ATTRIBUTE -> {
          String attribute = segment.qualifiedName();
          Step previous = steps.isEmpty() ? null : steps.get(steps.size() - 1);
          if (segment.axis() == Axis.DESCENDANT) {
            steps.add(new Step(Axis.DESCENDANT_OR_SELF, null, null, attribute, null, List.of()));
          } else if (previous != null && !previous.hasAttribute()) {
            steps.set(steps.size() - 1, previous.withAttribute(attribute));
          } else {
            steps.add(Step.selfAttribute(attribute));
          }
        }
        case SELF -> {
          Axis axis = segment.axis() == Axis.DESCENDANT ? Axis.DESCENDANT_OR_SELF : Axis.SELF;
          steps.add(new Step(axis, null, null, null, null, List.of()));
        }
        case ELEMENT -> {
          if (i == predicateSegment) predicateStep = steps.size();
          steps.add(
              new Step(
                  segment.axis(),
                  resolveNamespace(raw, segment.prefix(), segment.name()),
                  segment.name(),
                  null,
                  i == predicateSegment ? predicate : null,
                  conditions(raw, segment.conditions())));
        }
      }
    }
    if (steps.isEmpty()) {
      // The expression named only the document element.
      steps.add(new Step(Axis.SELF, null, null, null, null, List.of()));
    }

    Step leading = steps.get(0);
    if (!anchored
        && leading.axis() == Axis.CHILD
        && leading.localName() != null
        && CdaVocabulary.isRepeatingAct(leading.localName())) {
      steps.set(0, leading.withAxis(Axis.DESCENDANT_OR_SELF));
    }

    String normalized = render(steps);
    log.trace("Converted '{}' to '{}'", raw, normalized);
    return new ConvertedExpression(raw, steps, normalized, predicate, predicateStep, anchored);
  }

  private boolean isDocumentElement(PathSegment segment) {
    return segment.kind() == Kind.ELEMENT
        && segment.axis() == Axis.CHILD
        && rootElement.equals(segment.name())
        && (segment.prefix() == null || segment.prefix().equals(namespaces.primaryPrefix()));
  }

  private boolean isTemplateMarker(Condition condition) {
    return condition.isChildCondition()
        && TEMPLATE_MARKER.equals(condition.childName())
        && TEMPLATE_IDENTIFIER_ATTRIBUTE.equals(condition.attribute())
        && (condition.childPrefix() == null
            || condition.childPrefix().equals(namespaces.primaryPrefix()));
  }

  private List<StepCondition> conditions(String raw, List<Condition> parsed) {
    List<StepCondition> out = new ArrayList<>(parsed.size());
    for (Condition c : parsed) {
      if (c.isChildCondition()) {
        out.add(
            new StepCondition.ChildAttributeEquals(
                resolveNamespace(raw, c.childPrefix(), c.childName()),
                c.childName(),
                c.attribute(),
                c.value()));
      } else {
        out.add(new StepCondition.AttributeEquals(c.attribute(), c.value()));
      }
    }
    return out;
  }

  private String resolveNamespace(String raw, String prefix, String localName) {
    if (prefix != null) {
      String uri = namespaces.uri(prefix);
      if (uri == null) {
        throw new ExpressionConversionException(
            "Unknown namespace prefix '%s' in '%s'".formatted(prefix, raw));
      }
      return uri;
    }
    return CdaVocabulary.isCdaElement(localName) ? namespaces.primaryUri() : null;
  }

  private String render(List<Step> steps) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < steps.size(); i++) {
      Step step = steps.get(i);
      boolean descendant = step.axis() == Axis.DESCENDANT || step.axis() == Axis.DESCENDANT_OR_SELF;
      if (i == 0) {
        if (step.axis() != Axis.SELF) sb.append(descendant ? ".//" : "./");
      } else {
        sb.append(descendant ? "//" : "/");
      }
      sb.append(step.render(namespaces));
    }
    return sb.toString();
  }
}
