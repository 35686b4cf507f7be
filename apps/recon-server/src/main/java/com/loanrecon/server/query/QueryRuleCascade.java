package com.loanrecon.server.query;

import com.loanrecon.domain.loans.LoanRecord;
import com.loanrecon.server.store.LoanSnapshot;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/** Ordered keyword rules; the first accepting rule decides the category. */
public class QueryRuleCascade {
  static final String UNKNOWN_MESSAGE =
      "I didn't understand that query. Try:\n"
          + "• 'Find mismatches'\n"
          + "• 'Show loans where difference > 5000'\n"
          + "• 'List unreconciled loans'\n"
          + "• 'Find loan LN-12345'\n"
          + "• 'Search borrower John Smith'\n"
          + "Type 'help' for more examples.";
  static final String BORROWER_GUIDANCE = "Please specify a borrower name to search for.";
  static final String LOAN_ID_GUIDANCE = "Please specify a loan ID to look up.";

  // any form of "reconcile" except the status words "reconciled" and "unreconciled"
  private static final Pattern RECONCILE_FORM = Pattern.compile("\\breconcil(?!ed\\b)\\w*");
  private static final String[] DIFFERENCE_QUALIFIERS = {
    ">", "<", "greater", "less", "where", "positive", "negative",
    "top", "highest", "largest", "bottom", "lowest", "smallest"
  };
  private static final Comparator<LoanRecord> BY_ABSOLUTE_DIFFERENCE =
      Comparator.comparing(LoanRecord::absoluteDifference);

  private final int defaultRankSize;
  private final int summarySampleSize;
  private final String firstPartyLabel;
  private final String secondPartyLabel;
  private final List<QueryRule> rules;

  public QueryRuleCascade(
      int defaultRankSize, int summarySampleSize, String firstPartyLabel, String secondPartyLabel) {
    this.defaultRankSize = defaultRankSize > 0 ? defaultRankSize : 10;
    this.summarySampleSize = Math.max(0, summarySampleSize);
    this.firstPartyLabel = label(firstPartyLabel, "servicer");
    this.secondPartyLabel = label(secondPartyLabel, "fnma");
    this.rules = buildRules();
  }

  public static QueryRuleCascade withDefaults() {
    return new QueryRuleCascade(10, 10, "servicer", "fnma");
  }

  public List<QueryRule> rules() {
    return rules;
  }

  public QueryRule classify(QueryText text) {
    for (QueryRule rule : rules) {
      if (rule.matches(text)) {
        return rule;
      }
    }
    // the last rule accepts any text
    throw new IllegalStateException("No query rule accepted the text");
  }

  private List<QueryRule> buildRules() {
    List<QueryRule> ordered = new ArrayList<>();
    ordered.add(
        new QueryRule(
            QueryCategory.FIND_MISMATCHES,
            text ->
                text.contains("mismatch")
                    || text.matches(RECONCILE_FORM)
                    || (text.contains("difference") && !text.containsAny(DIFFERENCE_QUALIFIERS)),
            (text, snapshot) -> QueryOutcome.of(snapshot.mismatches())));
    ordered.add(
        new QueryRule(
            QueryCategory.DIFFERENCE_GREATER_THAN,
            text -> text.contains("difference") && text.containsAny(">", "greater"),
            (text, snapshot) -> {
              BigDecimal threshold = QueryTextExtractor.firstDecimal(text);
              return QueryOutcome.of(
                  filter(snapshot, r -> r.differenceAmount().compareTo(threshold) > 0));
            }));
    ordered.add(
        new QueryRule(
            QueryCategory.DIFFERENCE_LESS_THAN,
            text -> text.contains("difference") && text.containsAny("<", "less"),
            (text, snapshot) -> {
              BigDecimal threshold = QueryTextExtractor.firstDecimal(text);
              return QueryOutcome.of(
                  filter(snapshot, r -> r.differenceAmount().compareTo(threshold) < 0));
            }));
    ordered.add(
        new QueryRule(
            QueryCategory.RECONCILED_LOANS,
            text ->
                text.contains("reconciled") && !text.contains("un") && !text.contains("not"),
            (text, snapshot) -> QueryOutcome.of(filter(snapshot, LoanRecord::isReconciled))));
    ordered.add(
        new QueryRule(
            QueryCategory.UNRECONCILED_LOANS,
            text -> text.containsAny("unreconciled", "not reconciled", "pending"),
            (text, snapshot) -> QueryOutcome.of(filter(snapshot, r -> !r.isReconciled()))));
    ordered.add(
        new QueryRule(
            QueryCategory.LOAN_BY_ID,
            text ->
                (text.contains("loan") && (text.containsWord("id") || text.containsWord("number")))
                    || QueryTextExtractor.hasIdentifierShape(text),
            this::findByIdentifier));
    ordered.add(
        new QueryRule(
            QueryCategory.SEARCH_BY_BORROWER,
            text -> text.containsAny("borrower", "customer", "name"),
            this::searchByBorrower));
    ordered.add(
        new QueryRule(
            QueryCategory.TOP_DIFFERENCES,
            text -> text.containsAny("top", "highest", "largest"),
            (text, snapshot) -> {
              List<LoanRecord> sorted = new ArrayList<>(snapshot.records());
              sorted.sort(BY_ABSOLUTE_DIFFERENCE.reversed());
              return QueryOutcome.of(head(sorted, rankSize(text)));
            }));
    ordered.add(
        new QueryRule(
            QueryCategory.BOTTOM_DIFFERENCES,
            text -> text.containsAny("bottom", "lowest", "smallest"),
            (text, snapshot) -> {
              List<LoanRecord> sorted = new ArrayList<>(snapshot.mismatches());
              sorted.sort(BY_ABSOLUTE_DIFFERENCE);
              return QueryOutcome.of(head(sorted, rankSize(text)));
            }));
    ordered.add(
        new QueryRule(
            QueryCategory.POSITIVE_DIFFERENCES,
            text -> text.contains("positive") && text.contains("difference"),
            (text, snapshot) ->
                QueryOutcome.of(filter(snapshot, r -> r.differenceAmount().signum() > 0))));
    ordered.add(
        new QueryRule(
            QueryCategory.NEGATIVE_DIFFERENCES,
            text -> text.contains("negative") && text.contains("difference"),
            (text, snapshot) ->
                QueryOutcome.of(filter(snapshot, r -> r.differenceAmount().signum() < 0))));
    ordered.add(
        new QueryRule(
            QueryCategory.SERVICER_GREATER_THAN_FNMA,
            text ->
                text.contains(firstPartyLabel)
                    && text.containsAny("greater", "more")
                    && !mentionedBefore(text, secondPartyLabel, firstPartyLabel),
            (text, snapshot) ->
                QueryOutcome.of(
                    filter(
                        snapshot,
                        r -> r.servicerLoanAmount().compareTo(r.fnmaLoanAmount()) > 0))));
    ordered.add(
        new QueryRule(
            QueryCategory.FNMA_GREATER_THAN_SERVICER,
            text -> text.contains(secondPartyLabel) && text.containsAny("greater", "more"),
            (text, snapshot) ->
                QueryOutcome.of(
                    filter(
                        snapshot,
                        r -> r.fnmaLoanAmount().compareTo(r.servicerLoanAmount()) > 0))));
    ordered.add(
        new QueryRule(
            QueryCategory.COUNT,
            text -> text.containsAny("count", "how many", "total"),
            (text, snapshot) ->
                QueryOutcome.withMessage(
                    snapshot.records(),
                    "Total count: " + formatCount(snapshot.count()) + " records")));
    ordered.add(
        new QueryRule(
            QueryCategory.LIST_ALL,
            text -> text.containsAny("all", "list", "show", "everything"),
            (text, snapshot) -> QueryOutcome.of(snapshot.records())));
    ordered.add(
        new QueryRule(
            QueryCategory.SUMMARY,
            text -> text.containsAny("summary", "overview", "report"),
            (text, snapshot) ->
                QueryOutcome.withMessage(
                    head(snapshot.records(), summarySampleSize), summaryMessage(snapshot))));
    ordered.add(
        new QueryRule(
            QueryCategory.UNKNOWN,
            text -> true,
            (text, snapshot) -> QueryOutcome.withMessage(List.of(), UNKNOWN_MESSAGE)));
    return List.copyOf(ordered);
  }

  private QueryOutcome findByIdentifier(QueryText text, LoanSnapshot snapshot) {
    return QueryTextExtractor.loanIdentifier(text)
        .map(
            loanId ->
                snapshot
                    .getByKey(loanId)
                    .map(record -> QueryOutcome.of(List.of(record)))
                    .orElseGet(() -> QueryOutcome.withMessage(List.of(), notFound(loanId))))
        .orElseGet(() -> QueryOutcome.withMessage(List.of(), LOAN_ID_GUIDANCE));
  }

  private static String notFound(String loanId) {
    return "No loan found with ID " + loanId;
  }

  private QueryOutcome searchByBorrower(QueryText text, LoanSnapshot snapshot) {
    return QueryTextExtractor.borrowerFragment(text)
        .map(
            fragment ->
                QueryOutcome.of(
                    filter(
                        snapshot,
                        r -> r.borrowerName().toLowerCase(Locale.ROOT).contains(fragment))))
        .orElseGet(() -> QueryOutcome.withMessage(List.of(), BORROWER_GUIDANCE));
  }

  private int rankSize(QueryText text) {
    return QueryTextExtractor.firstPositiveInteger(text).orElse(defaultRankSize);
  }

  static String summaryMessage(LoanSnapshot snapshot) {
    int total = snapshot.count();
    int mismatches = snapshot.mismatches().size();
    double percentage = total == 0 ? 0.0d : mismatches * 100.0d / total;
    return "Dataset Summary: "
        + formatCount(total)
        + " total loans, "
        + formatCount(mismatches)
        + " mismatches ("
        + String.format(Locale.US, "%.1f", percentage)
        + "%), "
        + formatCount(snapshot.reconciledCount())
        + " reconciled";
  }

  static String formatCount(long count) {
    return String.format(Locale.US, "%,d", count);
  }

  private static List<LoanRecord> filter(LoanSnapshot snapshot, Predicate<LoanRecord> predicate) {
    List<LoanRecord> matches = new ArrayList<>();
    for (LoanRecord record : snapshot.records()) {
      if (predicate.test(record)) {
        matches.add(record);
      }
    }
    return matches;
  }

  private static List<LoanRecord> head(List<LoanRecord> records, int size) {
    if (records.size() <= size) {
      return records;
    }
    return records.subList(0, size);
  }

  private static boolean mentionedBefore(QueryText text, String first, String second) {
    int firstIndex = text.normalized().indexOf(first);
    return firstIndex >= 0 && firstIndex < text.normalized().indexOf(second);
  }

  private static String label(String value, String fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    return value.trim().toLowerCase(Locale.ROOT);
  }
}
