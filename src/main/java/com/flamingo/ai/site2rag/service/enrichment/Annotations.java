package com.flamingo.ai.site2rag.service.enrichment;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Helpers for the {@code [[...]]} context annotations the model inserts. */
public final class Annotations {

  static final Pattern ANNOTATION = Pattern.compile("\\[\\[(.*?)]]", Pattern.DOTALL);

  /** An annotation with the whitespace leading up to it. */
  private static final Pattern ANNOTATION_WITH_SPACE =
      Pattern.compile("\\s*\\[\\[(.*?)]]", Pattern.DOTALL);

  private Annotations() {
    // utility class
  }

  /**
   * Removes every annotation span together with the whitespace before it, so {@code "company
   * [[ACME]], grew"} becomes {@code "company, grew"}.
   */
  public static String strip(String text) {
    return ANNOTATION_WITH_SPACE.matcher(text).replaceAll("");
  }

  /**
   * Removes only the annotations present in {@code enhanced} but not in {@code original}.
   *
   * <p>Annotations of the original are matched in order against those of the enhanced text; each
   * enhanced annotation that equals the next unmatched original one is kept, every other one is
   * stripped with its leading whitespace. The result equals the original text when the enhancement
   * only inserted annotations.
   */
  public static String stripAdded(String original, String enhanced) {
    List<String> existing = extract(original);
    Matcher matcher = ANNOTATION_WITH_SPACE.matcher(enhanced);
    StringBuilder out = new StringBuilder();
    int next = 0;
    while (matcher.find()) {
      if (next < existing.size() && existing.get(next).equals(matcher.group(1))) {
        next++;
        matcher.appendReplacement(out, Matcher.quoteReplacement(matcher.group()));
      } else {
        matcher.appendReplacement(out, "");
      }
    }
    matcher.appendTail(out);
    return out.toString();
  }

  /** Number of annotations in {@code enhanced} beyond those already in {@code original}. */
  public static int countAdded(String original, String enhanced) {
    return Math.max(0, count(enhanced) - count(original));
  }

  /** Returns the contents of every annotation, in order. */
  public static List<String> extract(String text) {
    List<String> insertions = new ArrayList<>();
    if (text == null) {
      return insertions;
    }
    Matcher matcher = ANNOTATION.matcher(text);
    while (matcher.find()) {
      insertions.add(matcher.group(1));
    }
    return insertions;
  }

  public static int count(String text) {
    return extract(text).size();
  }
}
