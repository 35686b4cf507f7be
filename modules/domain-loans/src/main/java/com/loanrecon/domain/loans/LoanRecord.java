package com.loanrecon.domain.loans;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;

public record LoanRecord(
    String loanId,
    String borrowerName,
    BigDecimal servicerLoanAmount,
    BigDecimal fnmaLoanAmount,
    BigDecimal differenceAmount,
    String reconciledStatus) {
  public static final String RECONCILED = "reconciled";

  public LoanRecord {
    if (loanId == null || loanId.isBlank()) {
      throw new LoanDomainException("loanId must not be blank");
    }
    loanId = loanId.trim();
    borrowerName = borrowerName == null ? "" : borrowerName.trim();
    Objects.requireNonNull(servicerLoanAmount, "servicerLoanAmount must not be null");
    Objects.requireNonNull(fnmaLoanAmount, "fnmaLoanAmount must not be null");
    Objects.requireNonNull(differenceAmount, "differenceAmount must not be null");
    reconciledStatus = reconciledStatus == null ? "" : reconciledStatus.trim();
  }

  public static LoanRecord withDerivedDifference(
      String loanId,
      String borrowerName,
      BigDecimal servicerLoanAmount,
      BigDecimal fnmaLoanAmount,
      String reconciledStatus) {
    Objects.requireNonNull(servicerLoanAmount, "servicerLoanAmount must not be null");
    Objects.requireNonNull(fnmaLoanAmount, "fnmaLoanAmount must not be null");
    return new LoanRecord(
        loanId,
        borrowerName,
        servicerLoanAmount,
        fnmaLoanAmount,
        servicerLoanAmount.subtract(fnmaLoanAmount),
        reconciledStatus);
  }

  public boolean hasMismatch() {
    return differenceAmount.signum() != 0;
  }

  public boolean isReconciled() {
    return RECONCILED.equals(reconciledStatus.toLowerCase(Locale.ROOT));
  }

  public BigDecimal absoluteDifference() {
    return differenceAmount.abs();
  }

  public static String normalizeKey(String key) {
    if (key == null) {
      return "";
    }
    return key.trim().toUpperCase(Locale.ROOT);
  }
}
