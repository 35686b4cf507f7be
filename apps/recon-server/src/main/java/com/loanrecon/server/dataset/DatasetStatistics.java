package com.loanrecon.server.dataset;

import java.time.Instant;

public record DatasetStatistics(int totalRecords, Instant lastLoadTime, boolean dataLoaded) {}
