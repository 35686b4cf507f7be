package com.loanrecon.server.query;

import com.loanrecon.domain.loans.LoanRecord;
import java.util.List;
import java.util.Optional;

public record QueryOutcome(List<LoanRecord> matches, Optional<String> message) {
  public QueryOutcome {
    matches = matches == null ? List.of() : matches;
    message = message == null ? Optional.empty() : message;
  }

  public static QueryOutcome of(List<LoanRecord> matches) {
    return new QueryOutcome(matches, Optional.empty());
  }

  public static QueryOutcome withMessage(List<LoanRecord> matches, String message) {
    return new QueryOutcome(matches, Optional.ofNullable(message));
  }
}
