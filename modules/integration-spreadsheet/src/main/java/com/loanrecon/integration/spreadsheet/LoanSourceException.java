package com.loanrecon.integration.spreadsheet;

public class LoanSourceException extends RuntimeException {
  public LoanSourceException(String message) {
    super(message);
  }

  public LoanSourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
