package com.loanrecon.integration.spreadsheet;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class CsvLoanSourceLoader extends TabularLoanSourceLoader {
  private final CsvMapper csvMapper;

  public CsvLoanSourceLoader(LoanRowParser rowParser) {
    super(rowParser);
    this.csvMapper =
        CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .build();
  }

  @Override
  protected List<NumberedRow> readRows(Path source) throws IOException {
    List<NumberedRow> rows = new ArrayList<>();
    try (MappingIterator<String[]> iterator =
        csvMapper
            .readerFor(String[].class)
            .with(CsvSchema.emptySchema())
            .readValues(source.toFile())) {
      int rowNumber = 0;
      while (iterator.hasNextValue()) {
        rowNumber++;
        rows.add(new NumberedRow(rowNumber, Arrays.asList(iterator.nextValue())));
      }
    }
    return rows;
  }
}
