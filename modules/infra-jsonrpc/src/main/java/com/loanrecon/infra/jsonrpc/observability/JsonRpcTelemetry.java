package com.loanrecon.infra.jsonrpc.observability;

public interface JsonRpcTelemetry {
  void onRequestSuccess(String method, long durationNanos);

  void onRequestFailure(String method, int errorCode, Throwable error);

  void onDecodeFailure(Throwable error);
}
