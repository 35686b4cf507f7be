package com.loanrecon.integration.spreadsheet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.loanrecon.domain.loans.LoanRecord;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class LoanRowParserTest {
  private final LoanRowParser parser = new LoanRowParser();

  @Test
  void shouldParsePositionalRow() {
    LoanRecord record =
        parser.parse(
            List.of(" LN-001 ", "Jane Doe", "1,000.50", "$900.25", "100.25", "Reconciled"));

    assertEquals("LN-001", record.loanId());
    assertEquals("Jane Doe", record.borrowerName());
    assertEquals(new BigDecimal("1000.50"), record.servicerLoanAmount());
    assertEquals(new BigDecimal("900.25"), record.fnmaLoanAmount());
    assertEquals(new BigDecimal("100.25"), record.differenceAmount());
    assertTrue(record.isReconciled());
  }

  @Test
  void shouldDeriveDifferenceWhenCellIsBlank() {
    LoanRecord record = parser.parse(List.of("LN-002", "John", "500", "750", "", "Pending"));

    assertEquals(new BigDecimal("-250"), record.differenceAmount());
  }

  @Test
  void shouldTolerateShortRowsWithoutStatus() {
    LoanRecord record = parser.parse(List.of("LN-003", "Ann", "10", "10", "0"));

    assertEquals("", record.reconciledStatus());
    assertFalse(record.hasMismatch());
  }

  @Test
  void shouldRejectMissingLoanId() {
    IllegalArgumentException ex =
        assertThrows(
            IllegalArgumentException.class,
            () -> parser.parse(List.of(" ", "Ann", "10", "10", "0", "Reconciled")));

    assertEquals("Missing required column 'LoanID'", ex.getMessage());
  }

  @Test
  void shouldRejectInvalidAmount() {
    IllegalArgumentException ex =
        assertThrows(
            IllegalArgumentException.class,
            () -> parser.parse(List.of("LN-004", "Ann", "ten", "10", "0", "Reconciled")));

    assertEquals("Column 'Servicer_LoanAmount' is not a valid decimal: ten", ex.getMessage());
  }

  @Test
  void shouldDetectBlankRows() {
    assertTrue(parser.isBlank(List.of()));
    assertTrue(parser.isBlank(Arrays.asList("", " ", null)));
    assertFalse(parser.isBlank(List.of("", "x")));
  }
}
