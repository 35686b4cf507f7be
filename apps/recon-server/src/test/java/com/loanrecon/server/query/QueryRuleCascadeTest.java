package com.loanrecon.server.query;

import static com.loanrecon.server.LoanFixtures.loan;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.loanrecon.domain.loans.LoanRecord;
import com.loanrecon.server.LoanFixtures;
import com.loanrecon.server.store.LoanRecordStore;
import com.loanrecon.server.store.LoanSnapshot;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class QueryRuleCascadeTest {
  private final QueryRuleCascade cascade = QueryRuleCascade.withDefaults();
  private LoanSnapshot snapshot;

  @BeforeEach
  void setUp() {
    LoanRecordStore store = new LoanRecordStore(Clock.systemUTC());
    snapshot = store.build(LoanFixtures.portfolio());
  }

  @Test
  void shouldExposeRulesInPriorityOrder() {
    List<QueryCategory> categories =
        cascade.rules().stream().map(QueryRule::category).toList();

    assertEquals(Arrays.asList(QueryCategory.values()), categories);
  }

  @Test
  void shouldClassifyRepresentativeQueries() {
    assertCategory(QueryCategory.FIND_MISMATCHES, "Find mismatches");
    assertCategory(QueryCategory.FIND_MISMATCHES, "loans to reconcile");
    assertCategory(QueryCategory.FIND_MISMATCHES, "reconciliation issues");
    assertCategory(QueryCategory.FIND_MISMATCHES, "reconciling items");
    assertCategory(QueryCategory.FIND_MISMATCHES, "Show reconciliation breaks");
    assertCategory(QueryCategory.FIND_MISMATCHES, "show me the difference");
    assertCategory(
        QueryCategory.DIFFERENCE_GREATER_THAN, "Show loans where DifferenceAmount > 5000");
    assertCategory(QueryCategory.DIFFERENCE_GREATER_THAN, "difference greater than 100");
    assertCategory(QueryCategory.DIFFERENCE_LESS_THAN, "difference less than 100");
    assertCategory(QueryCategory.RECONCILED_LOANS, "List reconciled loans");
    assertCategory(QueryCategory.UNRECONCILED_LOANS, "List unreconciled loans");
    assertCategory(QueryCategory.UNRECONCILED_LOANS, "loans not reconciled");
    assertCategory(QueryCategory.UNRECONCILED_LOANS, "pending items");
    assertCategory(QueryCategory.LOAN_BY_ID, "Find loan LN-001234");
    assertCategory(QueryCategory.LOAN_BY_ID, "loan number 77");
    assertCategory(QueryCategory.SEARCH_BY_BORROWER, "Search borrower John Smith");
    assertCategory(QueryCategory.TOP_DIFFERENCES, "top 5");
    assertCategory(QueryCategory.BOTTOM_DIFFERENCES, "lowest 3 differences");
    assertCategory(QueryCategory.POSITIVE_DIFFERENCES, "positive difference");
    assertCategory(QueryCategory.NEGATIVE_DIFFERENCES, "negative differences");
    assertCategory(QueryCategory.SERVICER_GREATER_THAN_FNMA, "servicer amount greater than fnma");
    assertCategory(QueryCategory.FNMA_GREATER_THAN_SERVICER, "fnma amount greater than servicer");
    assertCategory(QueryCategory.FNMA_GREATER_THAN_SERVICER, "where fnma is more");
    assertCategory(QueryCategory.COUNT, "how many loans");
    assertCategory(QueryCategory.LIST_ALL, "List all loans");
    assertCategory(QueryCategory.SUMMARY, "summary");
    assertCategory(QueryCategory.SUMMARY, "summary for fy-2024");
    assertCategory(QueryCategory.UNKNOWN, "asdkjasd");
    assertCategory(QueryCategory.UNKNOWN, "");
  }

  @Test
  void shouldSkipReconciledRuleWhenTextCarriesNegation() {
    assertCategory(QueryCategory.COUNT, "reconciled count");
    assertCategory(QueryCategory.UNRECONCILED_LOANS, "loans not reconciled yet");
    assertCategory(QueryCategory.RECONCILED_LOANS, "Show reconciled loans");
  }

  @Test
  void shouldPreferMismatchRuleOverReconciledRule() {
    assertCategory(QueryCategory.FIND_MISMATCHES, "reconciled loans with a mismatch");
  }

  @Test
  void shouldReturnMismatchSubset() {
    QueryOutcome outcome = run("Find mismatches");

    assertEquals(snapshot.mismatches(), outcome.matches());
  }

  @Test
  void shouldFilterByDifferenceThreshold() {
    assertEquals(
        List.of("LN-001235", "LN-001237"), ids(run("difference greater than 5000").matches()));
    assertEquals(List.of("LN-001236"), ids(run("difference less than 0").matches()));
  }

  @Test
  void shouldMatchReconciledStatusIgnoringCase() {
    assertEquals(List.of("LN-001234", "LN-001238"), ids(run("reconciled loans").matches()));
    assertEquals(4, run("unreconciled").matches().size());
  }

  @Test
  void shouldFindLoanByIdentifier() {
    QueryOutcome outcome = run("Find loan ln-001236");

    assertEquals(List.of("LN-001236"), ids(outcome.matches()));
    assertTrue(outcome.message().isEmpty());
  }

  @Test
  void shouldExplainMissingLoan() {
    QueryOutcome outcome = run("Find loan LN-999999");

    assertTrue(outcome.matches().isEmpty());
    assertEquals("No loan found with ID LN-999999", outcome.message().orElseThrow());
  }

  @Test
  void shouldSearchBorrowerBySubstring() {
    assertEquals(
        List.of("LN-001234", "LN-001237"), ids(run("search borrower smith").matches()));
  }

  @Test
  void shouldGuideWhenBorrowerIsMissing() {
    QueryOutcome outcome = run("search borrower");

    assertTrue(outcome.matches().isEmpty());
    assertEquals(QueryRuleCascade.BORROWER_GUIDANCE, outcome.message().orElseThrow());
  }

  @Test
  void shouldRankTopDifferencesByAbsoluteValue() {
    assertEquals(List.of("LN-001235", "LN-001236"), ids(run("top 2").matches()));
    assertEquals(6, run("largest differences").matches().size());
  }

  @Test
  void shouldRankBottomDifferencesAmongMismatchesOnly() {
    assertEquals(
        List.of("LN-001239", "LN-001237", "LN-001236", "LN-001235"),
        ids(run("smallest differences").matches()));
    assertEquals(List.of("LN-001239"), ids(run("bottom 1").matches()));
  }

  @Test
  void shouldKeepInputOrderForTiedDifferences() {
    LoanSnapshot tied =
        new LoanRecordStore(Clock.systemUTC())
            .build(
                List.of(
                    loan("A-1", "a", "10", "5", "Pending"),
                    loan("B-1", "b", "5", "10", "Pending"),
                    loan("C-1", "c", "20", "0", "Pending")));

    QueryText text = QueryText.of("top 3");
    QueryOutcome outcome = cascade.classify(text).handler().execute(text, tied);

    assertEquals(List.of("C-1", "A-1", "B-1"), ids(outcome.matches()));
  }

  @Test
  void shouldFilterBySignAndParty() {
    assertEquals(3, run("positive difference").matches().size());
    assertEquals(1, run("negative difference").matches().size());
    assertEquals(3, run("servicer greater").matches().size());
    assertEquals(List.of("LN-001236"), ids(run("fnma greater than servicer").matches()));
  }

  @Test
  void shouldReportCountAndSummaryMessages() {
    QueryOutcome count = run("count");
    QueryOutcome summary = run("overview");

    assertEquals("Total count: 6 records", count.message().orElseThrow());
    assertEquals(6, count.matches().size());
    assertEquals(
        "Dataset Summary: 6 total loans, 4 mismatches (66.7%), 2 reconciled",
        summary.message().orElseThrow());
  }

  @Test
  void shouldLimitSummarySample() {
    QueryRuleCascade small = new QueryRuleCascade(10, 2, "servicer", "fnma");

    QueryOutcome outcome =
        small.classify(QueryText.of("report")).handler().execute(QueryText.of("report"), snapshot);

    assertEquals(List.of("LN-001234", "LN-001235"), ids(outcome.matches()));
  }

  @Test
  void shouldReportZeroPercentForEmptyDataset() {
    assertEquals(
        "Dataset Summary: 0 total loans, 0 mismatches (0.0%), 0 reconciled",
        QueryRuleCascade.summaryMessage(LoanSnapshot.empty()));
  }

  @Test
  void shouldFormatCountsWithThousandsSeparators() {
    assertEquals("80,000", QueryRuleCascade.formatCount(80_000));
  }

  private void assertCategory(QueryCategory expected, String query) {
    assertEquals(expected, cascade.classify(QueryText.of(query)).category(), query);
  }

  private QueryOutcome run(String query) {
    QueryText text = QueryText.of(query);
    return cascade.classify(text).handler().execute(text, snapshot);
  }

  private static List<String> ids(List<LoanRecord> records) {
    return records.stream().map(LoanRecord::loanId).toList();
  }
}
