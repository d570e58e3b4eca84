package com.gentoro.cdafinder.engine;

import com.gentoro.cdafinder.document.NamespaceTable;
import com.gentoro.cdafinder.document.Node;
import java.util.ArrayList;
import java.util.List;

/** Reads the {@code templateId} markers a node declares through its direct children. */
final class TemplateMarkers {
  static final String MARKER = "templateId";
  static final String IDENTIFIER = "root";

  private final String namespace;

  TemplateMarkers(NamespaceTable namespaces) {
    this.namespace = namespaces.primaryUri();
  }

  /** Identifiers of every marker child carrying a {@code root}, in document order. */
  List<String> identifiers(Node node) {
    List<String> out = new ArrayList<>();
    for (Node child : node.children(namespace, MARKER)) {
      String id = child.attribute(IDENTIFIER);
      if (id != null) out.add(id);
    }
    return out;
  }

  boolean carries(Node node, String identifier) {
    for (Node child : node.children(namespace, MARKER)) {
      if (identifier.equals(child.attribute(IDENTIFIER))) return true;
    }
    return false;
  }
}
