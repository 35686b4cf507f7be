package com.loanrecon.infra.jsonrpc.serde;

import com.fasterxml.jackson.databind.JsonNode;

public class JsonRpcDecodingException extends RuntimeException {
  private final transient JsonNode requestId;

  public JsonRpcDecodingException(String message, JsonNode requestId) {
    super(message);
    this.requestId = requestId;
  }

  public JsonRpcDecodingException(String message, JsonNode requestId, Throwable cause) {
    super(message, cause);
    this.requestId = requestId;
  }

  public JsonNode requestId() {
    return requestId;
  }
}
