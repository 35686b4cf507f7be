package com.loanrecon.server.query;

import java.util.Locale;
import java.util.regex.Pattern;

public record QueryText(String original, String normalized) {
  public QueryText {
    original = original == null ? "" : original.trim();
    normalized = normalized == null ? original.toLowerCase(Locale.ROOT) : normalized;
  }

  public static QueryText of(String text) {
    return new QueryText(text, null);
  }

  public boolean contains(String keyword) {
    return normalized.contains(keyword);
  }

  public boolean containsAny(String... keywords) {
    for (String keyword : keywords) {
      if (normalized.contains(keyword)) {
        return true;
      }
    }
    return false;
  }

  public boolean matches(Pattern pattern) {
    return pattern.matcher(normalized).find();
  }

  public boolean containsWord(String word) {
    return Pattern.compile("\\b" + Pattern.quote(word) + "\\b").matcher(normalized).find();
  }
}
