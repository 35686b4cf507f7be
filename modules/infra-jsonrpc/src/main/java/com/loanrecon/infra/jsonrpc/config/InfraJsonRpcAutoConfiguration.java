package com.loanrecon.infra.jsonrpc.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loanrecon.infra.jsonrpc.dispatch.JsonRpcDispatcher;
import com.loanrecon.infra.jsonrpc.dispatch.JsonRpcMethodHandler;
import com.loanrecon.infra.jsonrpc.observability.JsonRpcTelemetry;
import com.loanrecon.infra.jsonrpc.observability.MicrometerJsonRpcTelemetry;
import com.loanrecon.infra.jsonrpc.observability.NoOpJsonRpcTelemetry;
import com.loanrecon.infra.jsonrpc.serde.JsonRpcMessageCodec;
import com.loanrecon.infra.jsonrpc.serde.JsonRpcObjectMapperFactory;
import com.loanrecon.infra.jsonrpc.session.JsonRpcSessionLoop;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(
    afterName = {
      "org.springframework.boot.actuate.autoconfigure.metrics."
          + "CompositeMeterRegistryAutoConfiguration",
      "org.springframework.boot.actuate.autoconfigure.metrics.export.simple."
          + "SimpleMetricsExportAutoConfiguration"
    })
@EnableConfigurationProperties(InfraJsonRpcProperties.class)
public class InfraJsonRpcAutoConfiguration {
  @Bean
  @ConditionalOnMissingBean(name = "jsonRpcObjectMapper")
  public ObjectMapper jsonRpcObjectMapper() {
    return JsonRpcObjectMapperFactory.create();
  }

  @Bean
  @ConditionalOnMissingBean
  public JsonRpcMessageCodec jsonRpcMessageCodec(
      @Qualifier("jsonRpcObjectMapper") ObjectMapper jsonRpcObjectMapper) {
    return new JsonRpcMessageCodec(jsonRpcObjectMapper);
  }

  @Bean
  @ConditionalOnClass(MeterRegistry.class)
  @ConditionalOnBean(MeterRegistry.class)
  @ConditionalOnMissingBean(JsonRpcTelemetry.class)
  public JsonRpcTelemetry micrometerJsonRpcTelemetry(MeterRegistry meterRegistry) {
    return new MicrometerJsonRpcTelemetry(meterRegistry);
  }

  @Bean
  @ConditionalOnMissingBean(JsonRpcTelemetry.class)
  public JsonRpcTelemetry noOpJsonRpcTelemetry() {
    return new NoOpJsonRpcTelemetry();
  }

  @Bean
  @ConditionalOnMissingBean
  public JsonRpcDispatcher jsonRpcDispatcher(
      ObjectProvider<JsonRpcMethodHandler> methodHandlers, JsonRpcTelemetry jsonRpcTelemetry) {
    return new JsonRpcDispatcher(methodHandlers.orderedStream().toList(), jsonRpcTelemetry);
  }

  @Bean
  @ConditionalOnMissingBean
  public JsonRpcSessionLoop jsonRpcSessionLoop(
      JsonRpcMessageCodec jsonRpcMessageCodec,
      JsonRpcDispatcher jsonRpcDispatcher,
      JsonRpcTelemetry jsonRpcTelemetry) {
    return new JsonRpcSessionLoop(jsonRpcMessageCodec, jsonRpcDispatcher, jsonRpcTelemetry);
  }
}
