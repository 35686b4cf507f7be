package com.loanrecon.infra.jsonrpc.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "infra.jsonrpc")
public class InfraJsonRpcProperties {
  private Duration shutdownTimeout = Duration.ofSeconds(5);
  private String threadName = "jsonrpc-session";

  public Duration getShutdownTimeout() {
    return shutdownTimeout;
  }

  public void setShutdownTimeout(Duration shutdownTimeout) {
    this.shutdownTimeout = shutdownTimeout;
  }

  public String getThreadName() {
    return threadName;
  }

  public void setThreadName(String threadName) {
    this.threadName = threadName;
  }

  public Duration effectiveShutdownTimeout() {
    if (shutdownTimeout == null || shutdownTimeout.isNegative()) {
      return Duration.ZERO;
    }
    return shutdownTimeout;
  }

  public String effectiveThreadName() {
    if (threadName == null || threadName.isBlank()) {
      return "jsonrpc-session";
    }
    return threadName;
  }
}
