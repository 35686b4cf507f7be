package com.loanrecon.infra.jsonrpc.contract;

public record JsonRpcError(int code, String message) {
  public JsonRpcError {
    message = message == null || message.isBlank() ? "Unknown error" : message;
  }
}
