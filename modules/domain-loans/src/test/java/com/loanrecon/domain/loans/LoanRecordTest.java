package com.loanrecon.domain.loans;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

class LoanRecordTest {
  @Test
  void shouldTreatZeroWithScaleAsNoMismatch() {
    LoanRecord record =
        new LoanRecord(
            "LN-1",
            "Jane Doe",
            new BigDecimal("100.00"),
            new BigDecimal("100.00"),
            new BigDecimal("0.00"),
            "Reconciled");

    assertFalse(record.hasMismatch());
    assertTrue(record.isReconciled());
  }

  @Test
  void shouldFlagNonZeroDifferenceAsMismatch() {
    LoanRecord record =
        new LoanRecord(
            "LN-2",
            "John Roe",
            new BigDecimal("100.00"),
            new BigDecimal("150.00"),
            new BigDecimal("-50.00"),
            "Pending");

    assertTrue(record.hasMismatch());
    assertFalse(record.isReconciled());
    assertEquals(new BigDecimal("50.00"), record.absoluteDifference());
  }

  @Test
  void shouldDeriveDifferenceFromReportedAmounts() {
    LoanRecord record =
        LoanRecord.withDerivedDifference(
            " LN-3 ", null, new BigDecimal("250.50"), new BigDecimal("200.25"), null);

    assertEquals("LN-3", record.loanId());
    assertEquals("", record.borrowerName());
    assertEquals("", record.reconciledStatus());
    assertEquals(new BigDecimal("50.25"), record.differenceAmount());
  }

  @Test
  void shouldRejectBlankLoanId() {
    LoanDomainException ex =
        assertThrows(
            LoanDomainException.class,
            () ->
                new LoanRecord(
                    " ", "Jane", BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ZERO, "reconciled"));
    assertEquals("loanId must not be blank", ex.getMessage());
  }

  @Test
  void shouldNormalizeKeysCaseInsensitively() {
    assertEquals("LN-001234", LoanRecord.normalizeKey(" ln-001234 "));
    assertEquals("", LoanRecord.normalizeKey(null));
  }
}
