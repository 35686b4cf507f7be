package com.loanrecon.server.dataset;

import com.loanrecon.integration.spreadsheet.LoanSourceException;
import com.loanrecon.integration.spreadsheet.LoanSourceLoadResult;
import com.loanrecon.integration.spreadsheet.LoanSourceLoader;
import com.loanrecon.server.store.LoanRecordStore;
import com.loanrecon.server.store.LoanSnapshot;
import io.micrometer.core.instrument.MeterRegistry;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DatasetService {
  private static final Logger log = LoggerFactory.getLogger(DatasetService.class);
  private static final String LOAD_TOTAL_METRIC = "recon.dataset.load.total";
  private static final String ROWS_REJECTED_METRIC = "recon.dataset.rows.rejected";

  private final LoanSourceLoader loader;
  private final LoanRecordStore store;
  private final MeterRegistry meterRegistry;

  public DatasetService(
      LoanSourceLoader loader, LoanRecordStore store, MeterRegistry meterRegistry) {
    this.loader = loader;
    this.store = store;
    this.meterRegistry = meterRegistry;
  }

  public LoanSnapshot load(Path source) {
    long started = System.nanoTime();
    LoanSourceLoadResult result;
    try {
      result = loader.load(source);
    } catch (LoanSourceException ex) {
      meterRegistry.counter(LOAD_TOTAL_METRIC, "outcome", "failure").increment();
      throw new DatasetLoadException("Failed to load loan dataset from " + source, ex);
    }

    LoanSnapshot snapshot = store.build(result.records());
    meterRegistry.counter(ROWS_REJECTED_METRIC).increment(result.rejectedRows());
    meterRegistry.counter(LOAD_TOTAL_METRIC, "outcome", "success").increment();
    log.info(
        "Loan dataset loaded source={} records={} rejectedRows={} version={} elapsedMs={}",
        source,
        snapshot.count(),
        result.rejectedRows(),
        snapshot.version(),
        (System.nanoTime() - started) / 1_000_000L);
    return snapshot;
  }

  public Optional<LoanSnapshot> reload(Path source) {
    try {
      return Optional.of(load(source));
    } catch (DatasetLoadException ex) {
      log.warn(
          "Loan dataset reload failed, keeping version={} source={} error={}",
          store.snapshot().version(),
          source,
          ex.getCause() == null ? ex.getMessage() : ex.getCause().getMessage());
      return Optional.empty();
    }
  }

  public DatasetStatistics statistics() {
    LoanSnapshot snapshot = store.snapshot();
    return new DatasetStatistics(
        snapshot.count(), snapshot.builtAt().orElse(null), snapshot.builtAt().isPresent());
  }
}
