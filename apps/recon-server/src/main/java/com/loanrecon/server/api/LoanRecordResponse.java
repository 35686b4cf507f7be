package com.loanrecon.server.api;

import com.loanrecon.domain.loans.LoanRecord;
import java.math.BigDecimal;

public record LoanRecordResponse(
    String loanId,
    String borrowerName,
    BigDecimal servicerLoanAmount,
    BigDecimal fnmaLoanAmount,
    BigDecimal differenceAmount,
    String reconciledStatus,
    boolean hasMismatch) {
  public static LoanRecordResponse from(LoanRecord record) {
    return new LoanRecordResponse(
        record.loanId(),
        record.borrowerName(),
        record.servicerLoanAmount(),
        record.fnmaLoanAmount(),
        record.differenceAmount(),
        record.reconciledStatus(),
        record.hasMismatch());
  }
}
