package com.gentoro.cdafinder.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One element of a parsed {@link CdaDocument}.
 *
 * <p>Nodes are immutable and live in the document's arena. Parent and children are held as arena
 * indices, so a node never owns its relatives; the index is also the node's position in document
 * order.
 */
public final class Node {
  private final CdaDocument document;
  private final int index;
  private final int parentIndex;
  private final String namespaceUri;
  private final String localName;
  private final String text;
  private final Map<String, String> attributes;
  private final int[] childIndices;

  Node(
      CdaDocument document,
      int index,
      int parentIndex,
      String namespaceUri,
      String localName,
      String text,
      Map<String, String> attributes,
      int[] childIndices) {
    this.document = document;
    this.index = index;
    this.parentIndex = parentIndex;
    this.namespaceUri = namespaceUri;
    this.localName = Objects.requireNonNull(localName, "localName");
    this.text = text;
    this.attributes = Collections.unmodifiableMap(attributes);
    this.childIndices = childIndices;
  }

  public CdaDocument document() {
    return document;
  }

  /** Arena index; also the pre-order position of this node in the document. */
  public int index() {
    return index;
  }

  public int parentIndex() {
    return parentIndex;
  }

  /** @return the namespace URI, or null for an element in no namespace */
  public String namespaceUri() {
    return namespaceUri;
  }

  public String localName() {
    return localName;
  }

  /** The tag in {@code {uri}local} notation, or just the local name when there is no namespace. */
  public String tag() {
    return namespaceUri == null ? localName : "{" + namespaceUri + "}" + localName;
  }

  /** Trimmed character data preceding the first child element, or null when blank. */
  public String text() {
    return text;
  }

  public Map<String, String> attributes() {
    return attributes;
  }

  public String attribute(String name) {
    return attributes.get(name);
  }

  public boolean hasAttribute(String name) {
    return attributes.containsKey(name);
  }

  public boolean isRoot() {
    return parentIndex < 0;
  }

  public Optional<Node> parent() {
    return parentIndex < 0 ? Optional.empty() : Optional.of(document.node(parentIndex));
  }

  public int childCount() {
    return childIndices.length;
  }

  public List<Node> children() {
    List<Node> out = new ArrayList<>(childIndices.length);
    for (int child : childIndices) out.add(document.node(child));
    return out;
  }

  /** Direct children with the given namespace and local name. */
  public List<Node> children(String namespace, String name) {
    List<Node> out = new ArrayList<>();
    for (int child : childIndices) {
      Node n = document.node(child);
      if (n.hasName(namespace, name)) out.add(n);
    }
    return out;
  }

  public boolean hasName(String namespace, String name) {
    return localName.equals(name) && Objects.equals(namespaceUri, namespace);
  }

  /** All descendants in document order, excluding this node. */
  public List<Node> descendants() {
    List<Node> out = new ArrayList<>();
    collectDescendants(this, out);
    return out;
  }

  private static void collectDescendants(Node node, List<Node> out) {
    for (int child : node.childIndices) {
      Node n = node.document.node(child);
      out.add(n);
      collectDescendants(n, out);
    }
  }

  /** True when this node lies strictly below {@code ancestor}. */
  public boolean isDescendantOf(Node ancestor) {
    if (ancestor.document != document) return false;
    int current = parentIndex;
    while (current >= 0) {
      if (current == ancestor.index) return true;
      current = document.node(current).parentIndex;
    }
    return false;
  }

  /**
   * Location of this node from the document element, for example {@code
   * /ClinicalDocument/component/structuredBody/component[2]/section}. A 1-based position is added
   * when the parent has more than one child with the same name.
   */
  public String path() {
    List<String> segments = new ArrayList<>();
    Node current = this;
    while (current != null) {
      String segment = current.localName;
      Optional<Node> parent = current.parent();
      if (parent.isPresent()) {
        List<Node> sameName = parent.get().children(current.namespaceUri, current.localName);
        if (sameName.size() > 1) {
          segment = segment + "[" + (sameName.indexOf(current) + 1) + "]";
        }
      }
      segments.add(segment);
      current = parent.orElse(null);
    }
    Collections.reverse(segments);
    return "/" + String.join("/", segments);
  }

  @Override
  public String toString() {
    return "Node{" + tag() + "@" + index + "}";
  }
}
