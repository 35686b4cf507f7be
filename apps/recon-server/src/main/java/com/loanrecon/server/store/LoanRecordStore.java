package com.loanrecon.server.store;

import com.loanrecon.domain.loans.LoanRecord;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Holds the active {@link LoanSnapshot}; only the version bump and swap are serialized. */
public class LoanRecordStore {
  private static final Logger log = LoggerFactory.getLogger(LoanRecordStore.class);

  private final AtomicReference<LoanSnapshot> current =
      new AtomicReference<>(LoanSnapshot.empty());
  private final ReentrantLock writerLock = new ReentrantLock();
  private final Clock clock;

  public LoanRecordStore(Clock clock) {
    this.clock = clock;
  }

  public LoanSnapshot build(Collection<LoanRecord> records) {
    Objects.requireNonNull(records, "records must not be null");
    long started = System.nanoTime();
    LoanSnapshot indexed = LoanSnapshot.index(records, clock.instant());

    LoanSnapshot published;
    writerLock.lock();
    try {
      published = indexed.withVersion(current.get().version() + 1);
      current.set(published);
    } finally {
      writerLock.unlock();
    }

    if (published.duplicateKeyCount() > 0) {
      log.warn(
          "Loan snapshot contains duplicate keys version={} duplicates={} policy=last-write-wins",
          published.version(),
          published.duplicateKeyCount());
    }
    log.info(
        "Loan snapshot published version={} records={} mismatches={} elapsedMs={}",
        published.version(),
        published.count(),
        published.mismatches().size(),
        (System.nanoTime() - started) / 1_000_000L);
    return published;
  }

  public LoanSnapshot snapshot() {
    return current.get();
  }

  public Optional<LoanRecord> getByKey(String key) {
    return current.get().getByKey(key);
  }

  public List<LoanRecord> mismatchSet() {
    return current.get().mismatches();
  }

  public int count() {
    return current.get().count();
  }

  public Optional<Instant> lastBuildTime() {
    return current.get().builtAt();
  }
}
