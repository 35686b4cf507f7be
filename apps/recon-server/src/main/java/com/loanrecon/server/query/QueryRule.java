package com.loanrecon.server.query;

import java.util.Objects;
import java.util.function.Predicate;

public record QueryRule(
    QueryCategory category, Predicate<QueryText> predicate, QueryHandler handler) {
  public QueryRule {
    Objects.requireNonNull(category, "category must not be null");
    Objects.requireNonNull(predicate, "predicate must not be null");
    Objects.requireNonNull(handler, "handler must not be null");
  }

  public boolean matches(QueryText text) {
    return predicate.test(text);
  }
}
