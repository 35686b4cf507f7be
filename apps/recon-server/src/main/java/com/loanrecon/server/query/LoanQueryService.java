package com.loanrecon.server.query;

import com.loanrecon.domain.loans.LoanRecord;
import com.loanrecon.server.store.LoanRecordStore;
import com.loanrecon.server.store.LoanSnapshot;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoanQueryService {
  private static final Logger log = LoggerFactory.getLogger(LoanQueryService.class);
  private static final String QUERY_TOTAL_METRIC = "recon.query.total";
  private static final String QUERY_DURATION_METRIC = "recon.query.duration";

  private final LoanRecordStore store;
  private final QueryRuleCascade cascade;
  private final LoanStatisticsCalculator statisticsCalculator;
  private final MeterRegistry meterRegistry;
  private final int defaultLimit;

  public LoanQueryService(
      LoanRecordStore store,
      QueryRuleCascade cascade,
      LoanStatisticsCalculator statisticsCalculator,
      MeterRegistry meterRegistry,
      int defaultLimit) {
    this.store = store;
    this.cascade = cascade;
    this.statisticsCalculator = statisticsCalculator;
    this.meterRegistry = meterRegistry;
    this.defaultLimit = Math.max(0, defaultLimit);
  }

  public LoanQueryResult execute(LoanQueryRequest request) {
    long started = System.nanoTime();
    Timer.Sample timerSample = Timer.start(meterRegistry);
    QueryCategory category = QueryCategory.UNKNOWN;
    try {
      QueryText text = QueryText.of(request == null ? null : request.query());
      LoanSnapshot snapshot = store.snapshot();
      QueryRule rule = cascade.classify(text);
      category = rule.category();

      QueryOutcome outcome = rule.handler().execute(text, snapshot);
      List<LoanRecord> matches = outcome.matches();
      Map<String, Object> statistics = statisticsCalculator.calculate(matches);
      List<LoanRecord> page = page(matches, skipOf(request), limitOf(request));
      String message =
          outcome
              .message()
              .orElseGet(
                  () ->
                      "Found "
                          + QueryRuleCascade.formatCount(matches.size())
                          + " records matching query");

      increment(category, "success");
      log.debug(
          "Loan query executed category={} matches={} returned={} snapshotVersion={}",
          category.wireName(),
          matches.size(),
          page.size(),
          snapshot.version());
      return new LoanQueryResult(
          true,
          message,
          page,
          matches.size(),
          new QueryMetadata(category, elapsedMillis(started), statistics));
    } catch (RuntimeException ex) {
      increment(category, "error");
      log.error(
          "Loan query failed category={} query={}",
          category.wireName(),
          request == null ? null : request.query(),
          ex);
      return new LoanQueryResult(
          false,
          "Query execution failed: " + ex.getMessage(),
          List.of(),
          0,
          new QueryMetadata(category, elapsedMillis(started), Map.of()));
    } finally {
      timerSample.stop(
          Timer.builder(QUERY_DURATION_METRIC)
              .tag("category", category.wireName())
              .register(meterRegistry));
    }
  }

  private int limitOf(LoanQueryRequest request) {
    if (request == null || request.limit() == null) {
      return defaultLimit;
    }
    return Math.max(0, request.limit());
  }

  private static int skipOf(LoanQueryRequest request) {
    if (request == null || request.skip() == null) {
      return 0;
    }
    return Math.max(0, request.skip());
  }

  private static List<LoanRecord> page(List<LoanRecord> matches, int skip, int limit) {
    if (skip >= matches.size() || limit == 0) {
      return List.of();
    }
    int end = (int) Math.min((long) skip + limit, matches.size());
    return matches.subList(skip, end);
  }

  private void increment(QueryCategory category, String outcome) {
    meterRegistry
        .counter(QUERY_TOTAL_METRIC, "category", category.wireName(), "outcome", outcome)
        .increment();
  }

  private static long elapsedMillis(long started) {
    return (System.nanoTime() - started) / 1_000_000L;
  }
}
