package com.loanrecon.server.query;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class QueryTextExtractor {
  private static final Pattern DECIMAL = Pattern.compile("\\d+\\.?\\d*");
  private static final Pattern INTEGER = Pattern.compile("\\d+");
  private static final Pattern IDENTIFIER_SHAPE = Pattern.compile("\\bln-?\\d+\\b");
  private static final Pattern ID_KEYWORD =
      Pattern.compile("(?i)\\b(?:id|number)\\b\\s*[:#]?\\s*(\\S+)");
  private static final Pattern BORROWER_KEYWORD =
      Pattern.compile("\\b(?:borrower|customer|name)s?\\b");
  private static final Set<String> BORROWER_FILLERS =
      Set.of("is", "named", "like", "called", "with", "equals", "contains", "containing", "=");
  private static final String TOKEN_EDGE = "^[^\\p{Alnum}]+|[^\\p{Alnum}]+$";

  private QueryTextExtractor() {}

  public static BigDecimal firstDecimal(QueryText text) {
    Matcher matcher = DECIMAL.matcher(text.normalized());
    if (!matcher.find()) {
      return BigDecimal.ZERO;
    }
    String value = matcher.group();
    if (value.endsWith(".")) {
      value = value.substring(0, value.length() - 1);
    }
    return new BigDecimal(value);
  }

  public static Optional<Integer> firstPositiveInteger(QueryText text) {
    Matcher matcher = INTEGER.matcher(text.normalized());
    while (matcher.find()) {
      try {
        int value = Integer.parseInt(matcher.group());
        if (value > 0) {
          return Optional.of(value);
        }
      } catch (NumberFormatException ex) {
        return Optional.of(Integer.MAX_VALUE);
      }
    }
    return Optional.empty();
  }

  public static boolean hasIdentifierShape(QueryText text) {
    return IDENTIFIER_SHAPE.matcher(text.normalized()).find();
  }

  public static Optional<String> loanIdentifier(QueryText text) {
    for (String token : text.original().split("\\s+")) {
      String cleaned = token.replaceAll(TOKEN_EDGE, "");
      if (cleaned.chars().anyMatch(Character::isDigit)) {
        return Optional.of(cleaned);
      }
    }
    Matcher matcher = ID_KEYWORD.matcher(text.original());
    if (matcher.find()) {
      String cleaned = matcher.group(1).replaceAll(TOKEN_EDGE, "");
      if (!cleaned.isEmpty()) {
        return Optional.of(cleaned);
      }
    }
    return Optional.empty();
  }

  public static Optional<String> borrowerFragment(QueryText text) {
    Matcher matcher = BORROWER_KEYWORD.matcher(text.normalized());
    int end = -1;
    while (matcher.find()) {
      end = matcher.end();
    }
    if (end < 0) {
      return Optional.empty();
    }
    List<String> tokens = List.of(text.normalized().substring(end).trim().split("\\s+"));
    int start = 0;
    while (start < tokens.size()) {
      String token = tokens.get(start).replaceAll("[\"':]", "");
      if (!token.isEmpty() && !BORROWER_FILLERS.contains(token)) {
        break;
      }
      start++;
    }
    String fragment =
        String.join(" ", tokens.subList(start, tokens.size()))
            .replaceAll("^[\"':\\s]+|[\"'\\s]+$", "");
    return fragment.isEmpty() ? Optional.empty() : Optional.of(fragment);
  }
}
