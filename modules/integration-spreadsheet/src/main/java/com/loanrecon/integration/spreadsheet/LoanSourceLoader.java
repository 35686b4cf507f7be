package com.loanrecon.integration.spreadsheet;

import java.nio.file.Path;

public interface LoanSourceLoader {
  /** Throws {@link LoanSourceException} when the source is unreadable or has no usable row. */
  LoanSourceLoadResult load(Path source);
}
