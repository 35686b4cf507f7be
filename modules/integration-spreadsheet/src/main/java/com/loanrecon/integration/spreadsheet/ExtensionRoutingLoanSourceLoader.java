package com.loanrecon.integration.spreadsheet;

import java.nio.file.Path;
import java.util.Locale;

public class ExtensionRoutingLoanSourceLoader implements LoanSourceLoader {
  private final LoanSourceLoader csvLoader;
  private final LoanSourceLoader workbookLoader;

  public ExtensionRoutingLoanSourceLoader(
      LoanSourceLoader csvLoader, LoanSourceLoader workbookLoader) {
    this.csvLoader = csvLoader;
    this.workbookLoader = workbookLoader;
  }

  public static ExtensionRoutingLoanSourceLoader withDefaults() {
    LoanRowParser rowParser = new LoanRowParser();
    return new ExtensionRoutingLoanSourceLoader(
        new CsvLoanSourceLoader(rowParser), new XlsxLoanSourceLoader(rowParser));
  }

  @Override
  public LoanSourceLoadResult load(Path source) {
    if (source == null || source.getFileName() == null) {
      throw new LoanSourceException("Loan source path must not be empty");
    }
    String fileName = source.getFileName().toString().toLowerCase(Locale.ROOT);
    if (fileName.endsWith(".csv")) {
      return csvLoader.load(source);
    }
    if (fileName.endsWith(".xlsx") || fileName.endsWith(".xls")) {
      return workbookLoader.load(source);
    }
    throw new LoanSourceException("Unsupported loan source type: " + source.getFileName());
  }
}
