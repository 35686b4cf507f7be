package com.loanrecon.server.store;

import com.loanrecon.domain.loans.LoanRecord;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class LoanSnapshot {
  private static final LoanSnapshot EMPTY =
      new LoanSnapshot(List.of(), Map.of(), List.of(), 0, 0, null, 0L);

  private final List<LoanRecord> records;
  private final Map<String, LoanRecord> byKey;
  private final List<LoanRecord> mismatches;
  private final int reconciledCount;
  private final int duplicateKeyCount;
  private final Instant builtAt;
  private final long version;

  private LoanSnapshot(
      List<LoanRecord> records,
      Map<String, LoanRecord> byKey,
      List<LoanRecord> mismatches,
      int reconciledCount,
      int duplicateKeyCount,
      Instant builtAt,
      long version) {
    this.records = records;
    this.byKey = byKey;
    this.mismatches = mismatches;
    this.reconciledCount = reconciledCount;
    this.duplicateKeyCount = duplicateKeyCount;
    this.builtAt = builtAt;
    this.version = version;
  }

  public static LoanSnapshot empty() {
    return EMPTY;
  }

  static LoanSnapshot index(Collection<LoanRecord> batch, Instant builtAt) {
    List<LoanRecord> records = new ArrayList<>(batch.size());
    Map<String, LoanRecord> byKey = new HashMap<>(Math.max(16, batch.size() * 4 / 3 + 1));
    List<LoanRecord> mismatches = new ArrayList<>();
    int reconciled = 0;
    int duplicates = 0;
    for (LoanRecord record : batch) {
      if (record == null) {
        continue;
      }
      records.add(record);
      if (byKey.put(LoanRecord.normalizeKey(record.loanId()), record) != null) {
        duplicates++;
      }
      if (record.hasMismatch()) {
        mismatches.add(record);
      }
      if (record.isReconciled()) {
        reconciled++;
      }
    }
    return new LoanSnapshot(
        Collections.unmodifiableList(records),
        Collections.unmodifiableMap(byKey),
        Collections.unmodifiableList(mismatches),
        reconciled,
        duplicates,
        builtAt,
        0L);
  }

  LoanSnapshot withVersion(long version) {
    return new LoanSnapshot(
        records, byKey, mismatches, reconciledCount, duplicateKeyCount, builtAt, version);
  }

  public List<LoanRecord> records() {
    return records;
  }

  public Optional<LoanRecord> getByKey(String key) {
    if (key == null || key.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(byKey.get(LoanRecord.normalizeKey(key)));
  }

  public List<LoanRecord> mismatches() {
    return mismatches;
  }

  public int count() {
    return records.size();
  }

  public int reconciledCount() {
    return reconciledCount;
  }

  public int duplicateKeyCount() {
    return duplicateKeyCount;
  }

  public Optional<Instant> builtAt() {
    return Optional.ofNullable(builtAt);
  }

  public long version() {
    return version;
  }
}
