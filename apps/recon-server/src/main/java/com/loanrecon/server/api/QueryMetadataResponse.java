package com.loanrecon.server.api;

import com.loanrecon.server.query.QueryMetadata;
import java.util.Map;

public record QueryMetadataResponse(
    String queryType, long executionTimeMs, Map<String, Object> statistics) {
  public static QueryMetadataResponse from(QueryMetadata metadata) {
    return new QueryMetadataResponse(
        metadata.queryType().wireName(), metadata.executionTimeMs(), metadata.statistics());
  }
}
