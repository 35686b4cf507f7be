package com.loanrecon.domain.loans;

public class LoanDomainException extends RuntimeException {
  public LoanDomainException(String message) {
    super(message);
  }
}
