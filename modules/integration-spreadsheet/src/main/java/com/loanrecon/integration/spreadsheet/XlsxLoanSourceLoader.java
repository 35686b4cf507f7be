package com.loanrecon.integration.spreadsheet;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

public class XlsxLoanSourceLoader extends TabularLoanSourceLoader {
  private static final int COLUMN_COUNT = 6;

  private final DataFormatter dataFormatter = new DataFormatter();

  public XlsxLoanSourceLoader(LoanRowParser rowParser) {
    super(rowParser);
  }

  @Override
  protected List<NumberedRow> readRows(Path source) throws IOException {
    List<NumberedRow> rows = new ArrayList<>();
    try (Workbook workbook = WorkbookFactory.create(source.toFile(), null, true)) {
      if (workbook.getNumberOfSheets() == 0) {
        return rows;
      }
      Sheet sheet = workbook.getSheetAt(0);
      int first = sheet.getFirstRowNum();
      int last = sheet.getLastRowNum();
      if (first < 0) {
        return rows;
      }
      for (int index = first; index <= last; index++) {
        Row row = sheet.getRow(index);
        rows.add(new NumberedRow(index + 1, cells(row)));
      }
    }
    return rows;
  }

  private List<String> cells(Row row) {
    List<String> values = new ArrayList<>(COLUMN_COUNT);
    if (row == null) {
      return values;
    }
    for (int column = 0; column < COLUMN_COUNT; column++) {
      values.add(cellText(row.getCell(column)));
    }
    return values;
  }

  private String cellText(Cell cell) {
    if (cell == null) {
      return "";
    }
    CellType type = cell.getCellType();
    if (type == CellType.FORMULA) {
      type = cell.getCachedFormulaResultType();
    }
    if (type == CellType.NUMERIC && !DateUtil.isCellDateFormatted(cell)) {
      // Formatted text would carry grouping separators and rounding from the cell style.
      return BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros().toPlainString();
    }
    if (type == CellType.STRING) {
      return cell.getStringCellValue();
    }
    return dataFormatter.formatCellValue(cell);
  }
}
