package com.loanrecon.infra.jsonrpc.contract;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record JsonRpcResponse(String jsonrpc, JsonNode id, Object result, JsonRpcError error) {
  public static final String VERSION = "2.0";

  public static JsonRpcResponse success(JsonNode id, Object result) {
    return new JsonRpcResponse(VERSION, id, result, null);
  }

  public static JsonRpcResponse failure(JsonNode id, int code, String message) {
    return new JsonRpcResponse(VERSION, id, null, new JsonRpcError(code, message));
  }

  public boolean hasError() {
    return error != null;
  }
}
