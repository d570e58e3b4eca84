package com.gentoro.cdafinder.engine;

import com.gentoro.cdafinder.document.Node;

/**
 * One occurrence of a template in a document.
 *
 * @param root the element carrying the template marker
 * @param ordinal 1-based position among occurrences of the same identifier, in document order
 * @param identifier the template identifier
 */
public record TemplateInstance(Node root, int ordinal, String identifier) {}
