package com.gentoro.cdafinder.catalog;

import com.gentoro.cdafinder.expression.ConvertedExpression;

/** A catalog entry paired with its successful conversion. */
public record ConvertedEntry(CatalogEntry entry, ConvertedExpression expression) {}
