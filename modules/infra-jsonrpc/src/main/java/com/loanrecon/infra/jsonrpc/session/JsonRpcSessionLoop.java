package com.loanrecon.infra.jsonrpc.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.loanrecon.infra.jsonrpc.contract.JsonRpcErrorCodes;
import com.loanrecon.infra.jsonrpc.contract.JsonRpcRequest;
import com.loanrecon.infra.jsonrpc.contract.JsonRpcResponse;
import com.loanrecon.infra.jsonrpc.dispatch.JsonRpcDispatcher;
import com.loanrecon.infra.jsonrpc.observability.JsonRpcTelemetry;
import com.loanrecon.infra.jsonrpc.serde.JsonRpcDecodingException;
import com.loanrecon.infra.jsonrpc.serde.JsonRpcMessageCodec;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class JsonRpcSessionLoop {
  private static final Logger log = LoggerFactory.getLogger(JsonRpcSessionLoop.class);

  private final JsonRpcMessageCodec codec;
  private final JsonRpcDispatcher dispatcher;
  private final JsonRpcTelemetry telemetry;
  private final AtomicBoolean stopping = new AtomicBoolean(false);
  private final ReentrantLock inFlight = new ReentrantLock();

  public JsonRpcSessionLoop(
      JsonRpcMessageCodec codec, JsonRpcDispatcher dispatcher, JsonRpcTelemetry telemetry) {
    this.codec = codec;
    this.dispatcher = dispatcher;
    this.telemetry = telemetry;
  }

  public JsonRpcSessionSummary run(BufferedReader reader, Writer writer) throws IOException {
    long requests = 0L;
    long errors = 0L;
    log.info("JSON-RPC session started methods={}", dispatcher.methods());
    while (!stopping.get()) {
      String line = reader.readLine();
      if (line == null) {
        log.info("JSON-RPC session reached end of input requests={} errors={}", requests, errors);
        return new JsonRpcSessionSummary(requests, errors, true);
      }
      if (line.isBlank()) {
        continue;
      }

      inFlight.lock();
      try {
        JsonRpcResponse response = handleLine(line);
        writer.write(encodeSafely(response));
        writer.write('\n');
        writer.flush();
        requests++;
        if (response.hasError()) {
          errors++;
        }
      } finally {
        inFlight.unlock();
      }
    }
    log.info("JSON-RPC session stopped requests={} errors={}", requests, errors);
    return new JsonRpcSessionSummary(requests, errors, false);
  }

  /** Returns {@code false} when the in-flight request did not finish within the timeout. */
  public boolean stop(Duration timeout) {
    stopping.set(true);
    long waitMillis = timeout == null ? 0L : Math.max(0L, timeout.toMillis());
    try {
      if (inFlight.tryLock(waitMillis, TimeUnit.MILLISECONDS)) {
        inFlight.unlock();
        return true;
      }
      log.warn("JSON-RPC in-flight request did not finish within {}ms", waitMillis);
      return false;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  public boolean isStopping() {
    return stopping.get();
  }

  JsonRpcResponse handleLine(String line) {
    JsonNode requestId = null;
    try {
      JsonRpcRequest request = codec.decodeRequest(line);
      requestId = request.id();
      return dispatcher.dispatch(request);
    } catch (JsonRpcDecodingException ex) {
      telemetry.onDecodeFailure(ex);
      log.warn("Rejected malformed JSON-RPC line message={}", ex.getMessage());
      return JsonRpcResponse.failure(
          ex.requestId(), JsonRpcErrorCodes.INTERNAL_ERROR, ex.getMessage());
    } catch (RuntimeException ex) {
      log.error("Unexpected failure handling JSON-RPC line id={}", requestId, ex);
      return JsonRpcResponse.failure(requestId, JsonRpcErrorCodes.INTERNAL_ERROR, describe(ex));
    }
  }

  private String encodeSafely(JsonRpcResponse response) {
    try {
      return codec.encode(response);
    } catch (RuntimeException ex) {
      log.error("Failed to encode JSON-RPC response id={}", response.id(), ex);
      return codec.encode(
          JsonRpcResponse.failure(
              response.id(), JsonRpcErrorCodes.INTERNAL_ERROR, "Failed to encode response"));
    }
  }

  private static String describe(Throwable error) {
    String message = error.getMessage();
    return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
  }
}
