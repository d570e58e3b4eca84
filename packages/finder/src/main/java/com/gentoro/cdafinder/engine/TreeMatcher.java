package com.gentoro.cdafinder.engine;

import com.gentoro.cdafinder.document.Node;
import com.gentoro.cdafinder.expression.Axis;
import com.gentoro.cdafinder.expression.ConvertedExpression;
import com.gentoro.cdafinder.expression.Step;
import com.gentoro.cdafinder.expression.TemplatePredicate;
import com.gentoro.cdafinder.logging.LoggingService;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.slf4j.Logger;

/**
 * Evaluates converted steps against the document tree.
 *
 * <p>Evaluation goes through a fallback chain; a strategy runs only when the previous one found
 * nothing:
 *
 * <ol>
 *   <li><b>structural</b>: steps by axis, qualified names and inline conditions;
 *   <li><b>attribute split</b> (attribute paths): select the elements of the path without its
 *       attribute, structurally or else relaxed, and keep those carrying the attribute;
 *   <li><b>relaxed</b> (element paths): names compared by local-name containment, namespaces and
 *       conditions ignored.
 * </ol>
 *
 * Results are always in document order without duplicates.
 */
public class TreeMatcher {
  private static final Logger log = LoggingService.getLogger(TreeMatcher.class);

  private final TemplateLocator locator;

  public TreeMatcher(TemplateLocator locator) {
    this.locator = Objects.requireNonNull(locator, "locator");
  }

  /**
   * Evaluates a whole expression from {@code root}. A template predicate restricts the step
   * carrying it to the located occurrences of its identifier; on the leading step of an
   * unanchored path every occurrence in the document qualifies.
   *
   * @return the matches, or a single {@link MatchResult.NotFound} with the raw expression
   */
  public List<MatchResult> match(Node root, ConvertedExpression expression) {
    List<MatchResult> results =
        expression.hasTemplatePredicate()
            ? matchThroughTemplate(root, expression)
            : evaluate(root, expression.steps());
    if (results.isEmpty()) {
      log.debug("No match for '{}'", expression.original());
      return List.of(MatchResult.notFound(expression.original()));
    }
    return results;
  }

  /** Runs the fallback chain from {@code context}; an empty step list selects the context. */
  public List<MatchResult> evaluate(Node context, List<Step> steps) {
    if (steps.isEmpty()) return List.of(MatchResult.element(context));

    List<MatchResult> structural = structural(context, steps);
    if (!structural.isEmpty()) return structural;

    Step last = steps.get(steps.size() - 1);
    if (last.hasAttribute()) {
      List<Step> elementPath = new ArrayList<>(steps);
      elementPath.set(elementPath.size() - 1, last.withoutAttribute());
      List<Node> elements = walk(context, elementPath, true);
      if (elements.isEmpty()) elements = walk(context, elementPath, false);
      List<MatchResult> out = new ArrayList<>();
      for (Node element : elements) {
        if (element.hasAttribute(last.attribute())) {
          out.add(MatchResult.attribute(element, last.attribute()));
        }
      }
      if (!out.isEmpty()) log.trace("Attribute split matched {} node(s)", out.size());
      return out;
    }

    List<MatchResult> out = new ArrayList<>();
    for (Node node : walk(context, steps, false)) out.add(MatchResult.element(node));
    if (!out.isEmpty()) log.trace("Relaxed walk matched {} node(s)", out.size());
    return out;
  }

  private List<MatchResult> structural(Node context, List<Step> steps) {
    List<Node> nodes = walk(context, steps, true);
    Step last = steps.get(steps.size() - 1);
    List<MatchResult> out = new ArrayList<>(nodes.size());
    for (Node node : nodes) {
      if (!last.hasAttribute()) {
        out.add(MatchResult.element(node));
      } else if (node.hasAttribute(last.attribute())) {
        out.add(MatchResult.attribute(node, last.attribute()));
      }
    }
    return out;
  }

  private List<MatchResult> matchThroughTemplate(Node root, ConvertedExpression expression) {
    List<Step> steps = expression.steps();
    int k = expression.predicateStepIndex();
    Step predicateStep = steps.get(k);
    TemplatePredicate predicate = predicateStep.predicate();

    List<Node> context;
    if (k == 0) {
      context = List.of(root);
    } else {
      List<Step> prefix = steps.subList(0, k);
      context = walk(root, prefix, true);
      if (context.isEmpty()) context = walk(root, prefix, false);
    }
    if (context.isEmpty()) return List.of();

    List<Step> remainder = new ArrayList<>();
    if (predicateStep.hasAttribute()) remainder.add(Step.selfAttribute(predicateStep.attribute()));
    remainder.addAll(steps.subList(k + 1, steps.size()));

    // A leading predicate step of an unanchored path accepts occurrences anywhere.
    boolean documentWide = k == 0 && !expression.rootAnchored();
    List<MatchResult> out = new ArrayList<>();
    for (TemplateInstance instance : locator.locate(root, predicate.requiredIdentifier())) {
      Node candidate = instance.root();
      if (!candidate.localName().equals(predicate.elementName())) continue;
      if (!satisfiesConditions(predicateStep, candidate)) continue;
      if (!documentWide && !positioned(candidate, context, predicateStep.axis())) continue;
      out.addAll(evaluate(candidate, remainder));
    }
    return out;
  }

  // Occurrences are matched by local name only; inline conditions still apply.
  private static boolean satisfiesConditions(Step step, Node node) {
    return step.conditions().stream().allMatch(c -> c.test(node));
  }

  private static boolean positioned(Node candidate, List<Node> context, Axis axis) {
    for (Node c : context) {
      boolean ok =
          switch (axis) {
            case CHILD -> candidate.parentIndex() == c.index();
            case DESCENDANT -> candidate.isDescendantOf(c);
            case DESCENDANT_OR_SELF ->
                candidate.index() == c.index() || candidate.isDescendantOf(c);
            case SELF -> candidate.index() == c.index();
          };
      if (ok) return true;
    }
    return false;
  }

  /**
   * Walks {@code steps} from {@code context}, ignoring attribute targets. In strict mode names are
   * compared with their namespace and conditions apply; otherwise a node qualifies when its local
   * name equals or contains the step's local name.
   */
  private static List<Node> walk(Node context, List<Step> steps, boolean strict) {
    List<Node> current = List.of(context);
    for (Step step : steps) {
      Map<Integer, Node> next = new TreeMap<>();
      for (Node node : current) {
        for (Node candidate : axisNodes(node, step.axis())) {
          if (strict ? step.accepts(candidate) : relaxedAccepts(step, candidate)) {
            next.put(candidate.index(), candidate);
          }
        }
      }
      if (next.isEmpty()) return List.of();
      current = new ArrayList<>(next.values());
    }
    return current;
  }

  private static boolean relaxedAccepts(Step step, Node node) {
    return step.localName() == null || node.localName().contains(step.localName());
  }

  private static List<Node> axisNodes(Node node, Axis axis) {
    return switch (axis) {
      case CHILD -> node.children();
      case DESCENDANT -> node.descendants();
      case DESCENDANT_OR_SELF -> {
        List<Node> out = new ArrayList<>();
        out.add(node);
        out.addAll(node.descendants());
        yield out;
      }
      case SELF -> List.of(node);
    };
  }
}
