package com.loanrecon.integration.spreadsheet;

import com.loanrecon.domain.loans.LoanRecord;
import java.util.List;

public record LoanSourceLoadResult(List<LoanRecord> records, List<LoanRowError> rowErrors) {
  public LoanSourceLoadResult {
    records = records == null ? List.of() : List.copyOf(records);
    rowErrors = rowErrors == null ? List.of() : List.copyOf(rowErrors);
  }

  public int rejectedRows() {
    return rowErrors.size();
  }
}
