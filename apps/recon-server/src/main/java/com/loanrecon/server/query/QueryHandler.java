package com.loanrecon.server.query;

import com.loanrecon.server.store.LoanSnapshot;

@FunctionalInterface
public interface QueryHandler {
  QueryOutcome execute(QueryText text, LoanSnapshot snapshot);
}
