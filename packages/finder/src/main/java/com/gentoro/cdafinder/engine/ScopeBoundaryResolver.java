package com.gentoro.cdafinder.engine;

import com.gentoro.cdafinder.document.NamespaceTable;
import com.gentoro.cdafinder.document.Node;
import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether a node found below a template occurrence belongs to that occurrence or to a
 * template nested inside it.
 *
 * <p>A candidate belongs to the occurrence unless an element strictly between the candidate and
 * the occurrence root carries a template marker with a different identifier. A marker repeating the
 * occurrence's own identifier does not cut the scope.
 */
public class ScopeBoundaryResolver {
  private final TemplateMarkers markers;

  public ScopeBoundaryResolver(NamespaceTable namespaces) {
    this.markers = new TemplateMarkers(namespaces);
  }

  /**
   * @throws IllegalStateException when {@code candidate} is not inside {@code instance}
   */
  public boolean includes(TemplateInstance instance, Node candidate) {
    Node root = instance.root();
    if (candidate.document() != root.document()) {
      throw new IllegalStateException(candidate + " belongs to another document than " + root);
    }
    if (candidate.index() == root.index()) return true;

    int limit = candidate.document().size();
    int hops = 0;
    int current = candidate.parentIndex();
    while (current != root.index()) {
      if (current < 0) {
        throw new IllegalStateException(
            candidate + " is not inside template occurrence rooted at " + root);
      }
      if (++hops > limit) {
        throw new IllegalStateException("Parent chain of " + candidate + " does not terminate");
      }
      Node ancestor = candidate.document().node(current);
      for (String id : markers.identifiers(ancestor)) {
        if (!id.equals(instance.identifier())) return false;
      }
      current = ancestor.parentIndex();
    }
    return true;
  }

  /** Keeps the matches whose node belongs to {@code instance}. */
  public List<MatchResult> filter(TemplateInstance instance, List<MatchResult> matches) {
    List<MatchResult> out = new ArrayList<>(matches.size());
    for (MatchResult match : matches) {
      if (match.found() && includes(instance, match.node())) out.add(match);
    }
    return out;
  }
}
