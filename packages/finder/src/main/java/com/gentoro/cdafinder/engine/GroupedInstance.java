package com.gentoro.cdafinder.engine;

/** One template occurrence with the fields found inside its scope. */
public record GroupedInstance(TemplateInstance instance, FieldRecord fields) {
  public int ordinal() {
    return instance.ordinal();
  }
}
