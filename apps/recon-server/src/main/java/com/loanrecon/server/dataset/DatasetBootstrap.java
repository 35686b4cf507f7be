package com.loanrecon.server.dataset;

import com.loanrecon.server.config.ReconServerProperties;
import java.nio.file.Path;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class DatasetBootstrap implements ApplicationRunner {
  private final DatasetService datasetService;
  private final ReconServerProperties properties;

  public DatasetBootstrap(DatasetService datasetService, ReconServerProperties properties) {
    this.datasetService = datasetService;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    datasetService.load(datasetPath(properties));
  }

  static Path datasetPath(ReconServerProperties properties) {
    String path = properties.getDataset().getPath();
    if (path == null || path.isBlank()) {
      throw new DatasetLoadException("Property recon.dataset.path must be set");
    }
    return Path.of(path.trim());
  }
}
