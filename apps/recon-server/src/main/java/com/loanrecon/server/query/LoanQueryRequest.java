package com.loanrecon.server.query;

public record LoanQueryRequest(String query, Integer limit, Integer skip) {
  public static LoanQueryRequest of(String query) {
    return new LoanQueryRequest(query, null, null);
  }
}
