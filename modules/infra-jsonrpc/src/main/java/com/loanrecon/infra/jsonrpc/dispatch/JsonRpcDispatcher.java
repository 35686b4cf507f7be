package com.loanrecon.infra.jsonrpc.dispatch;

import com.loanrecon.infra.jsonrpc.contract.JsonRpcErrorCodes;
import com.loanrecon.infra.jsonrpc.contract.JsonRpcRequest;
import com.loanrecon.infra.jsonrpc.contract.JsonRpcResponse;
import com.loanrecon.infra.jsonrpc.observability.JsonRpcTelemetry;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class JsonRpcDispatcher {
  private static final Logger log = LoggerFactory.getLogger(JsonRpcDispatcher.class);
  private static final String UNKNOWN_METHOD_TAG = "unknown";

  private final Map<String, JsonRpcMethodHandler> handlers;
  private final JsonRpcTelemetry telemetry;

  public JsonRpcDispatcher(List<JsonRpcMethodHandler> handlers, JsonRpcTelemetry telemetry) {
    Map<String, JsonRpcMethodHandler> byMethod = new LinkedHashMap<>();
    for (JsonRpcMethodHandler handler : handlers) {
      JsonRpcMethodHandler previous = byMethod.putIfAbsent(handler.method(), handler);
      if (previous != null) {
        throw new IllegalStateException(
            "Duplicate JSON-RPC handler for method: " + handler.method());
      }
    }
    this.handlers = Collections.unmodifiableMap(byMethod);
    this.telemetry = telemetry;
  }

  public Set<String> methods() {
    return handlers.keySet();
  }

  public JsonRpcResponse dispatch(JsonRpcRequest request) {
    long started = System.nanoTime();
    String method = request.method();
    JsonRpcMethodHandler handler = handlers.get(method);
    if (handler == null) {
      telemetry.onRequestFailure(UNKNOWN_METHOD_TAG, JsonRpcErrorCodes.METHOD_NOT_FOUND, null);
      log.warn("JSON-RPC method not found method={} id={}", method, request.id());
      return JsonRpcResponse.failure(
          request.id(), JsonRpcErrorCodes.METHOD_NOT_FOUND, "Method not found: " + method);
    }

    try {
      Object result = handler.handle(request.params());
      telemetry.onRequestSuccess(method, System.nanoTime() - started);
      return JsonRpcResponse.success(request.id(), result);
    } catch (JsonRpcException ex) {
      telemetry.onRequestFailure(method, ex.code(), ex);
      log.warn(
          "JSON-RPC request rejected method={} id={} code={} message={}",
          method,
          request.id(),
          ex.code(),
          ex.getMessage());
      return JsonRpcResponse.failure(request.id(), ex.code(), ex.getMessage());
    } catch (Exception ex) {
      telemetry.onRequestFailure(method, JsonRpcErrorCodes.INTERNAL_ERROR, ex);
      log.error("JSON-RPC request failed method={} id={}", method, request.id(), ex);
      return JsonRpcResponse.failure(
          request.id(), JsonRpcErrorCodes.INTERNAL_ERROR, describe(ex));
    }
  }

  static String describe(Throwable error) {
    String message = error.getMessage();
    if (message == null || message.isBlank()) {
      return error.getClass().getSimpleName();
    }
    return message;
  }
}
