package com.loanrecon.infra.jsonrpc.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;

public class MicrometerJsonRpcTelemetry implements JsonRpcTelemetry {
  private final MeterRegistry meterRegistry;

  public MicrometerJsonRpcTelemetry(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  @Override
  public void onRequestSuccess(String method, long durationNanos) {
    Counter.builder("jsonrpc.request.total")
        .description("Total JSON-RPC requests by outcome")
        .tag("method", safeValue(method))
        .tag("outcome", "success")
        .register(meterRegistry)
        .increment();

    Timer.builder("jsonrpc.request.duration")
        .description("JSON-RPC request handling latency")
        .tag("method", safeValue(method))
        .register(meterRegistry)
        .record(Math.max(0L, durationNanos), TimeUnit.NANOSECONDS);
  }

  @Override
  public void onRequestFailure(String method, int errorCode, Throwable error) {
    Counter.builder("jsonrpc.request.total")
        .description("Total JSON-RPC requests by outcome")
        .tag("method", safeValue(method))
        .tag("outcome", "failure")
        .tag("code", Integer.toString(errorCode))
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();
  }

  @Override
  public void onDecodeFailure(Throwable error) {
    Counter.builder("jsonrpc.decode.failure.total")
        .description("Total request lines rejected before dispatch")
        .tag("error", safeError(error))
        .register(meterRegistry)
        .increment();
  }

  private static String safeValue(String value) {
    if (value == null || value.isBlank()) {
      return "unknown";
    }
    return value;
  }

  private static String safeError(Throwable error) {
    if (error == null) {
      return "none";
    }
    return error.getClass().getSimpleName();
  }
}
