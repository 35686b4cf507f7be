package com.loanrecon.server.query;

import com.loanrecon.domain.loans.LoanRecord;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class LoanStatisticsCalculator {
  public static final String TOTAL_AMOUNT_SERVICER = "TotalAmount_Servicer";
  public static final String TOTAL_AMOUNT_FNMA = "TotalAmount_FNMA";
  public static final String TOTAL_DIFFERENCE = "TotalDifference";
  public static final String AVERAGE_DIFFERENCE = "AverageDifference";
  public static final String MAX_DIFFERENCE = "MaxDifference";
  public static final String MIN_DIFFERENCE = "MinDifference";
  public static final String MISMATCH_COUNT = "MismatchCount";

  public Map<String, Object> calculate(List<LoanRecord> matches) {
    Map<String, Object> statistics = new LinkedHashMap<>();
    if (matches == null || matches.isEmpty()) {
      return statistics;
    }

    BigDecimal totalServicer = BigDecimal.ZERO;
    BigDecimal totalFnma = BigDecimal.ZERO;
    BigDecimal totalDifference = BigDecimal.ZERO;
    BigDecimal max = null;
    BigDecimal min = null;
    int mismatches = 0;
    for (LoanRecord record : matches) {
      totalServicer = totalServicer.add(record.servicerLoanAmount());
      totalFnma = totalFnma.add(record.fnmaLoanAmount());
      BigDecimal difference = record.differenceAmount();
      totalDifference = totalDifference.add(difference);
      max = max == null || difference.compareTo(max) > 0 ? difference : max;
      min = min == null || difference.compareTo(min) < 0 ? difference : min;
      if (record.hasMismatch()) {
        mismatches++;
      }
    }

    statistics.put(TOTAL_AMOUNT_SERVICER, totalServicer);
    statistics.put(TOTAL_AMOUNT_FNMA, totalFnma);
    statistics.put(TOTAL_DIFFERENCE, totalDifference);
    statistics.put(
        AVERAGE_DIFFERENCE,
        totalDifference.divide(BigDecimal.valueOf(matches.size()), MathContext.DECIMAL64));
    statistics.put(MAX_DIFFERENCE, max);
    statistics.put(MIN_DIFFERENCE, min);
    statistics.put(MISMATCH_COUNT, mismatches);
    return statistics;
  }
}
