package com.loanrecon.integration.spreadsheet;

import com.loanrecon.domain.loans.LoanRecord;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public abstract class TabularLoanSourceLoader implements LoanSourceLoader {
  private static final Logger log = LoggerFactory.getLogger(TabularLoanSourceLoader.class);

  private final LoanRowParser rowParser;

  protected TabularLoanSourceLoader(LoanRowParser rowParser) {
    this.rowParser = rowParser;
  }

  @Override
  public LoanSourceLoadResult load(Path source) {
    if (source == null) {
      throw new LoanSourceException("Loan source path must not be null");
    }
    if (!Files.isRegularFile(source) || !Files.isReadable(source)) {
      throw new LoanSourceException("Loan source is missing or unreadable: " + source);
    }

    List<NumberedRow> rows;
    try {
      rows = readRows(source);
    } catch (IOException | RuntimeException ex) {
      throw new LoanSourceException(
          "Failed to read loan source " + source + ": " + ex.getMessage(), ex);
    }

    List<LoanRecord> records = new ArrayList<>(Math.max(0, rows.size() - 1));
    List<LoanRowError> rowErrors = new ArrayList<>();
    boolean headerSkipped = false;
    for (NumberedRow row : rows) {
      if (!headerSkipped) {
        headerSkipped = true;
        continue;
      }
      if (rowParser.isBlank(row.cells())) {
        continue;
      }
      try {
        records.add(rowParser.parse(row.cells()));
      } catch (IllegalArgumentException ex) {
        log.warn(
            "Skipping loan source row source={} row={} reason={}",
            source.getFileName(),
            row.rowNumber(),
            ex.getMessage());
        rowErrors.add(new LoanRowError(row.rowNumber(), ex.getMessage()));
      }
    }

    if (records.isEmpty()) {
      throw new LoanSourceException(
          "Loan source "
              + source
              + " contains no valid records (rejectedRows="
              + rowErrors.size()
              + ")");
    }
    log.info(
        "Loan source read source={} records={} rejectedRows={}",
        source.getFileName(),
        records.size(),
        rowErrors.size());
    return new LoanSourceLoadResult(records, rowErrors);
  }

  protected abstract List<NumberedRow> readRows(Path source) throws IOException;

  protected record NumberedRow(int rowNumber, List<String> cells) {
    public NumberedRow {
      cells = cells == null ? List.of() : cells;
    }
  }
}
