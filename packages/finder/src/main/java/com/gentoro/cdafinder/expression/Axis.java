package com.gentoro.cdafinder.expression;

/** How a step selects nodes relative to its context node. */
public enum Axis {
  /** Direct children of the context. */
  CHILD,
  /** Any node strictly below the context. */
  DESCENDANT,
  /** The context itself or any node below it. */
  DESCENDANT_OR_SELF,
  /** The context itself. */
  SELF
}
