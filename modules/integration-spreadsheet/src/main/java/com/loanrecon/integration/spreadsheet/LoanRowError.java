package com.loanrecon.integration.spreadsheet;

public record LoanRowError(int rowNumber, String message) {
  public LoanRowError {
    if (rowNumber <= 0) {
      throw new IllegalArgumentException("rowNumber must be positive");
    }
    message = message == null || message.isBlank() ? "Unknown row error" : message;
  }
}
