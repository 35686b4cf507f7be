package com.loanrecon.server.dataset;

import com.loanrecon.server.config.ReconServerProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    prefix = "recon.dataset.reload",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = false)
public class DatasetReloadScheduler {
  private static final Logger log = LoggerFactory.getLogger(DatasetReloadScheduler.class);

  private final DatasetService datasetService;
  private final ReconServerProperties properties;
  private final AtomicReference<FileTime> lastSeen = new AtomicReference<>();

  public DatasetReloadScheduler(DatasetService datasetService, ReconServerProperties properties) {
    this.datasetService = datasetService;
    this.properties = properties;
  }

  @Scheduled(
      fixedDelayString = "${recon.dataset.reload.fixed-delay-ms:60000}",
      initialDelayString = "${recon.dataset.reload.fixed-delay-ms:60000}")
  public void reloadIfChanged() {
    Path source = DatasetBootstrap.datasetPath(properties);
    FileTime modified;
    try {
      modified = Files.getLastModifiedTime(source);
    } catch (IOException ex) {
      log.warn("Loan dataset not readable for reload source={} error={}", source, ex.getMessage());
      return;
    }

    FileTime previous = lastSeen.getAndSet(modified);
    if (previous == null) {
      Instant loadedAt = datasetService.statistics().lastLoadTime();
      if (loadedAt != null && !modified.toInstant().isAfter(loadedAt)) {
        return;
      }
    } else if (previous.equals(modified)) {
      return;
    }
    log.info("Loan dataset changed, reloading source={} modified={}", source, modified);
    datasetService.reload(source);
  }
}
