package com.gentoro.cdafinder.output;

import java.util.Locale;

public enum OutputFormat {
  JSON,
  CSV,
  TEXT;

  /**
   * @throws IllegalArgumentException for anything other than json, csv or text
   */
  public static OutputFormat fromName(String name) {
    if (name == null) throw new IllegalArgumentException("Output format must not be null");
    return switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "json" -> JSON;
      case "csv" -> CSV;
      case "text" -> TEXT;
      default ->
          throw new IllegalArgumentException(
              "Unsupported output format '" + name + "' (expected json, csv or text)");
    };
  }
}
