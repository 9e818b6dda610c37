package io.intellixity.lingua.persistence.util;

import java.util.Locale;

/** English inflection rules used to derive translation table defaults from model tables. */
public final class Inflections {
  private Inflections() {}

  public static String singularize(String word) {
    if (word == null || word.isBlank()) return word;
    String w = word.toLowerCase(Locale.ROOT);
    if (w.endsWith("ies") && w.length() > 3) return w.substring(0, w.length() - 3) + "y";
    if (w.endsWith("sses") || w.endsWith("xes") || w.endsWith("ches") || w.endsWith("shes")) {
      return w.substring(0, w.length() - 2);
    }
    if (w.endsWith("s") && !w.endsWith("ss")) return w.substring(0, w.length() - 1);
    return w;
  }
}
