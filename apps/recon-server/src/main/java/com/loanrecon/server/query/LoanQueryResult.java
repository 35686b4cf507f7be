package com.loanrecon.server.query;

import com.loanrecon.domain.loans.LoanRecord;
import java.util.List;

public record LoanQueryResult(
    boolean success,
    String message,
    List<LoanRecord> data,
    int totalCount,
    QueryMetadata metadata) {
  public LoanQueryResult {
    data = data == null ? List.of() : List.copyOf(data);
  }
}
