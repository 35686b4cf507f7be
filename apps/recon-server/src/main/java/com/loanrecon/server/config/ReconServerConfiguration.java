package com.loanrecon.server.config;

import com.loanrecon.integration.spreadsheet.ExtensionRoutingLoanSourceLoader;
import com.loanrecon.integration.spreadsheet.LoanSourceLoader;
import com.loanrecon.server.dataset.DatasetService;
import com.loanrecon.server.query.LoanQueryService;
import com.loanrecon.server.query.LoanStatisticsCalculator;
import com.loanrecon.server.query.QueryRuleCascade;
import com.loanrecon.server.store.LoanRecordStore;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ReconServerConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock reconServerClock() {
    return Clock.systemUTC();
  }

  @Bean
  @ConditionalOnMissingBean
  public LoanRecordStore loanRecordStore(Clock reconServerClock) {
    return new LoanRecordStore(reconServerClock);
  }

  @Bean
  @ConditionalOnMissingBean
  public LoanSourceLoader loanSourceLoader() {
    return ExtensionRoutingLoanSourceLoader.withDefaults();
  }

  @Bean
  @ConditionalOnMissingBean
  public DatasetService datasetService(
      LoanSourceLoader loanSourceLoader,
      LoanRecordStore loanRecordStore,
      MeterRegistry meterRegistry) {
    return new DatasetService(loanSourceLoader, loanRecordStore, meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean
  public QueryRuleCascade queryRuleCascade(ReconServerProperties properties) {
    ReconServerProperties.Query query = properties.getQuery();
    return new QueryRuleCascade(
        query.getDefaultRankSize(),
        query.getSummarySampleSize(),
        query.getFirstPartyLabel(),
        query.getSecondPartyLabel());
  }

  @Bean
  @ConditionalOnMissingBean
  public LoanQueryService loanQueryService(
      LoanRecordStore loanRecordStore,
      QueryRuleCascade queryRuleCascade,
      MeterRegistry meterRegistry,
      ReconServerProperties properties) {
    return new LoanQueryService(
        loanRecordStore,
        queryRuleCascade,
        new LoanStatisticsCalculator(),
        meterRegistry,
        properties.getQuery().getDefaultLimit());
  }
}
