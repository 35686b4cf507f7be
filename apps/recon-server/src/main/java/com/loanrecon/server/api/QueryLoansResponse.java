package com.loanrecon.server.api;

import com.loanrecon.server.query.LoanQueryResult;
import java.util.List;

public record QueryLoansResponse(
    boolean success,
    String message,
    List<LoanRecordResponse> data,
    int totalCount,
    QueryMetadataResponse metadata) {
  public static QueryLoansResponse from(LoanQueryResult result) {
    return new QueryLoansResponse(
        result.success(),
        result.message(),
        result.data().stream().map(LoanRecordResponse::from).toList(),
        result.totalCount(),
        QueryMetadataResponse.from(result.metadata()));
  }
}
