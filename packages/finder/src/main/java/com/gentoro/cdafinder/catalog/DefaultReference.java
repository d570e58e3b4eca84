package com.gentoro.cdafinder.catalog;

import com.gentoro.cdafinder.exception.CatalogException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/** The built-in reference text used when no catalog or reference file is given. */
public final class DefaultReference {
  public static final String RESOURCE = "catalog/default-reference.txt";

  private DefaultReference() {}

  public static String text() {
    try (InputStream in = DefaultReference.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (in == null) throw new CatalogException("Missing bundled resource " + RESOURCE);
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new CatalogException("Unable to read bundled resource " + RESOURCE, e);
    }
  }
}
