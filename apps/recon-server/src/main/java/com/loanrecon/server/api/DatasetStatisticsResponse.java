package com.loanrecon.server.api;

import com.loanrecon.server.dataset.DatasetStatistics;
import java.time.Instant;

public record DatasetStatisticsResponse(
    int totalRecords, Instant lastLoadTime, boolean dataLoaded) {
  public static DatasetStatisticsResponse from(DatasetStatistics statistics) {
    return new DatasetStatisticsResponse(
        statistics.totalRecords(), statistics.lastLoadTime(), statistics.dataLoaded());
  }
}
