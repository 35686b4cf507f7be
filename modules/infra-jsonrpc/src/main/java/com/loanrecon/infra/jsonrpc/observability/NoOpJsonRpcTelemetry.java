package com.loanrecon.infra.jsonrpc.observability;

public class NoOpJsonRpcTelemetry implements JsonRpcTelemetry {
    @Override
    public void onRequestSuccess(String method, long durationNanos) {
    }

    @Override
    public void onRequestFailure(String method, int errorCode, Throwable error) {
    }

    @Override
    public void onDecodeFailure(Throwable error) {
    }
}
