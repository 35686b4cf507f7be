package com.loanrecon.server.query;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record QueryMetadata(
    QueryCategory queryType, long executionTimeMs, Map<String, Object> statistics) {
  public QueryMetadata {
    statistics =
        statistics == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(statistics));
  }
}
