package com.loanrecon.integration.spreadsheet;

import com.loanrecon.domain.loans.LoanDomainException;
import com.loanrecon.domain.loans.LoanRecord;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public class LoanRowParser {
  static final int LOAN_ID = 0;
  static final int BORROWER_NAME = 1;
  static final int SERVICER_AMOUNT = 2;
  static final int FNMA_AMOUNT = 3;
  static final int DIFFERENCE_AMOUNT = 4;
  static final int RECONCILED_STATUS = 5;

  public boolean isBlank(List<String> cells) {
    if (cells == null) {
      return true;
    }
    for (String cell : cells) {
      if (cell != null && !cell.isBlank()) {
        return false;
      }
    }
    return true;
  }

  public LoanRecord parse(List<String> cells) {
    String loanId =
        optionalText(cells, LOAN_ID)
            .orElseThrow(() -> new IllegalArgumentException("Missing required column 'LoanID'"));
    String borrowerName = optionalText(cells, BORROWER_NAME).orElse("");
    BigDecimal servicerAmount = decimal(cells, SERVICER_AMOUNT, "Servicer_LoanAmount");
    BigDecimal fnmaAmount = decimal(cells, FNMA_AMOUNT, "FNMA_LoanAmount");
    String status = optionalText(cells, RECONCILED_STATUS).orElse("");

    try {
      Optional<BigDecimal> difference =
          optionalDecimal(cells, DIFFERENCE_AMOUNT, "DifferenceAmount");
      if (difference.isEmpty()) {
        return LoanRecord.withDerivedDifference(
            loanId, borrowerName, servicerAmount, fnmaAmount, status);
      }
      return new LoanRecord(
          loanId, borrowerName, servicerAmount, fnmaAmount, difference.get(), status);
    } catch (LoanDomainException ex) {
      throw new IllegalArgumentException(ex.getMessage(), ex);
    }
  }

  private static Optional<String> optionalText(List<String> cells, int index) {
    if (index >= cells.size()) {
      return Optional.empty();
    }
    String value = cells.get(index);
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  private static BigDecimal decimal(List<String> cells, int index, String column) {
    return optionalDecimal(cells, index, column)
        .orElseThrow(
            () -> new IllegalArgumentException("Missing required decimal column '" + column + "'"));
  }

  private static Optional<BigDecimal> optionalDecimal(
      List<String> cells, int index, String column) {
    return optionalText(cells, index)
        .map(
            value -> {
              String normalized = value.replace(",", "").replace("$", "").trim();
              try {
                return new BigDecimal(normalized);
              } catch (NumberFormatException ex) {
                throw new IllegalArgumentException(
                    "Column '" + column + "' is not a valid decimal: " + value, ex);
              }
            });
  }
}
