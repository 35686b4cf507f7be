package com.loanrecon.infra.jsonrpc.contract;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

public record JsonRpcRequest(String jsonrpc, JsonNode id, String method, JsonNode params) {
  public JsonRpcRequest {
    Objects.requireNonNull(method, "method must not be null");
    if (id != null && id.isNull()) {
      id = null;
    }
    if (params != null && params.isNull()) {
      params = null;
    }
  }

  public static JsonRpcRequest of(JsonNode id, String method, JsonNode params) {
    return new JsonRpcRequest(JsonRpcResponse.VERSION, id, method, params);
  }
}
