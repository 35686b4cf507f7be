package com.loanrecon.server.query;

public enum QueryCategory {
  FIND_MISMATCHES("FindMismatches"),
  DIFFERENCE_GREATER_THAN("DifferenceGreaterThan"),
  DIFFERENCE_LESS_THAN("DifferenceLessThan"),
  RECONCILED_LOANS("ReconciledLoans"),
  UNRECONCILED_LOANS("UnreconciledLoans"),
  LOAN_BY_ID("LoanByID"),
  SEARCH_BY_BORROWER("SearchByBorrower"),
  TOP_DIFFERENCES("TopDifferences"),
  BOTTOM_DIFFERENCES("BottomDifferences"),
  POSITIVE_DIFFERENCES("PositiveDifferences"),
  NEGATIVE_DIFFERENCES("NegativeDifferences"),
  SERVICER_GREATER_THAN_FNMA("ServicerGreaterThanFNMA"),
  FNMA_GREATER_THAN_SERVICER("FNMAGreaterThanServicer"),
  COUNT("Count"),
  LIST_ALL("ListAll"),
  SUMMARY("Summary"),
  UNKNOWN("Unknown");

  private final String wireName;

  QueryCategory(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }
}
