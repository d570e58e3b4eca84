package com.gentoro.cdafinder.engine;

import com.gentoro.cdafinder.document.NamespaceTable;
import com.gentoro.cdafinder.document.Node;
import com.gentoro.cdafinder.logging.LoggingService;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;

/**
 * Finds every occurrence of a template identifier.
 *
 * <p>A node is an occurrence when one of its direct {@code templateId} children (primary
 * namespace) has a {@code root} equal to the identifier. The element's own name is not checked.
 */
public class TemplateLocator {
  private static final Logger log = LoggingService.getLogger(TemplateLocator.class);

  private final TemplateMarkers markers;

  public TemplateLocator(NamespaceTable namespaces) {
    this.markers = new TemplateMarkers(namespaces);
  }

  /** Occurrences at or below {@code scope}, numbered 1..N in document order. */
  public List<TemplateInstance> locate(Node scope, String identifier) {
    List<TemplateInstance> out = new ArrayList<>();
    if (identifier == null) return out;
    List<Node> candidates = new ArrayList<>();
    candidates.add(scope);
    candidates.addAll(scope.descendants());
    for (Node node : candidates) {
      if (markers.carries(node, identifier)) {
        out.add(new TemplateInstance(node, out.size() + 1, identifier));
      }
    }
    log.debug("Template {} has {} occurrence(s)", identifier, out.size());
    return out;
  }
}
