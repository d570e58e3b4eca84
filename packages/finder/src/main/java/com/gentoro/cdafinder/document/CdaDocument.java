package com.gentoro.cdafinder.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An immutable, parsed clinical document.
 *
 * <p>The document owns every {@link Node} in an arena ordered by pre-order traversal; node 0 is
 * the document element. Nodes refer to their parent and children by arena index only.
 */
public final class CdaDocument {
  private final String source;
  private final List<Node> nodes;

  private CdaDocument(String source, List<Builder.Entry> entries) {
    this.source = source;
    List<Node> arena = new ArrayList<>(entries.size());
    for (int i = 0; i < entries.size(); i++) {
      Builder.Entry e = entries.get(i);
      int[] children = e.children.stream().mapToInt(Integer::intValue).toArray();
      arena.add(
          new Node(this, i, e.parent, e.namespace, e.localName, e.text, e.attributes, children));
    }
    this.nodes = Collections.unmodifiableList(arena);
  }

  public static Builder builder(String source) {
    return new Builder(source);
  }

  /** Where the document came from (file name or a label); informational only. */
  public String source() {
    return source;
  }

  public Node root() {
    return nodes.get(0);
  }

  public Node node(int index) {
    return nodes.get(index);
  }

  public int size() {
    return nodes.size();
  }

  /** Every node in document (pre-order) order. */
  public List<Node> nodes() {
    return nodes;
  }

  /**
   * Collects nodes in pre-order. Each element must be added after its parent and before any
   * following sibling of its parent, which is exactly the order a depth-first walk produces.
   */
  public static final class Builder {
    private final String source;
    private final List<Entry> entries = new ArrayList<>();
    private boolean built;

    private Builder(String source) {
      this.source = source;
    }

    /**
     * Append an element.
     *
     * @param parent arena index of the parent, or -1 for the document element
     * @return the arena index of the new element
     */
    public int add(
        int parent,
        String namespace,
        String localName,
        Map<String, String> attributes,
        String text) {
      if (built) throw new IllegalStateException("Document already built");
      if (parent < 0) {
        if (!entries.isEmpty()) throw new IllegalStateException("Document element already added");
      } else {
        if (parent >= entries.size()) {
          throw new IllegalStateException("Unknown parent index " + parent);
        }
        if (!isOnRightmostPath(parent)) {
          throw new IllegalStateException("Elements must be added in document order");
        }
      }
      Entry entry = new Entry();
      entry.parent = parent;
      entry.namespace = namespace;
      entry.localName = localName;
      entry.attributes =
          attributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributes);
      entry.text = text;
      entries.add(entry);
      int index = entries.size() - 1;
      if (parent >= 0) entries.get(parent).children.add(index);
      return index;
    }

    /** The parent must be the last added node or one of its ancestors. */
    private boolean isOnRightmostPath(int parent) {
      int current = entries.size() - 1;
      while (current >= 0) {
        if (current == parent) return true;
        current = entries.get(current).parent;
      }
      return false;
    }

    public CdaDocument build() {
      if (entries.isEmpty()) throw new IllegalStateException("Document has no elements");
      built = true;
      return new CdaDocument(source, entries);
    }

    private static final class Entry {
      int parent;
      String namespace;
      String localName;
      Map<String, String> attributes;
      String text;
      final List<Integer> children = new ArrayList<>();
    }
  }
}
