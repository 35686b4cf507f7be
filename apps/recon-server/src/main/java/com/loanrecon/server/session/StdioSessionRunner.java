package com.loanrecon.server.session;

import com.loanrecon.infra.jsonrpc.config.InfraJsonRpcProperties;
import com.loanrecon.infra.jsonrpc.session.JsonRpcSessionLoop;
import com.loanrecon.infra.jsonrpc.session.JsonRpcSessionSummary;
import jakarta.annotation.PreDestroy;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(Ordered.LOWEST_PRECEDENCE)
@ConditionalOnProperty(
    prefix = "recon.session.stdio",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true)
public class StdioSessionRunner implements ApplicationRunner {
  private static final Logger log = LoggerFactory.getLogger(StdioSessionRunner.class);

  private final JsonRpcSessionLoop sessionLoop;
  private final InfraJsonRpcProperties jsonRpcProperties;
  private final InputStream input;
  private final OutputStream output;
  private final ExecutorService executor;
  private final CompletableFuture<JsonRpcSessionSummary> completion = new CompletableFuture<>();

  @Autowired
  public StdioSessionRunner(
      JsonRpcSessionLoop sessionLoop, InfraJsonRpcProperties jsonRpcProperties) {
    this(sessionLoop, jsonRpcProperties, System.in, System.out);
  }

  StdioSessionRunner(
      JsonRpcSessionLoop sessionLoop,
      InfraJsonRpcProperties jsonRpcProperties,
      InputStream input,
      OutputStream output) {
    this.sessionLoop = sessionLoop;
    this.jsonRpcProperties = jsonRpcProperties;
    this.input = input;
    this.output = output;
    String threadName = jsonRpcProperties.effectiveThreadName();
    this.executor =
        Executors.newSingleThreadExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, threadName);
              thread.setDaemon(true);
              return thread;
            });
  }

  @Override
  public void run(ApplicationArguments args) {
    executor.execute(this::serve);
  }

  private void serve() {
    BufferedReader reader =
        new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
    Writer writer = new BufferedWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
    try {
      JsonRpcSessionSummary summary = sessionLoop.run(reader, writer);
      log.info(
          "Stdio session finished requests={} errors={} endOfInput={}",
          summary.requests(),
          summary.errors(),
          summary.endOfInput());
      completion.complete(summary);
    } catch (IOException | RuntimeException ex) {
      log.error("Stdio session terminated by I/O failure", ex);
      completion.completeExceptionally(ex);
    }
  }

  public JsonRpcSessionSummary awaitCompletion() throws InterruptedException {
    try {
      return completion.get();
    } catch (ExecutionException ex) {
      throw new IllegalStateException("Stdio session failed", ex.getCause());
    }
  }

  @PreDestroy
  public void stop() {
    boolean drained = sessionLoop.stop(jsonRpcProperties.effectiveShutdownTimeout());
    executor.shutdownNow();
    if (!drained) {
      log.warn("Stdio session stopped before the in-flight response was written");
    }
  }
}
