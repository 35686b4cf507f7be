package com.loanrecon.infra.jsonrpc.serde;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loanrecon.infra.jsonrpc.contract.JsonRpcErrorCodes;
import com.loanrecon.infra.jsonrpc.contract.JsonRpcRequest;
import com.loanrecon.infra.jsonrpc.contract.JsonRpcResponse;
import com.loanrecon.infra.jsonrpc.dispatch.JsonRpcException;

public class JsonRpcMessageCodec {
  private final ObjectMapper objectMapper;

  public JsonRpcMessageCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public JsonRpcRequest decodeRequest(String line) {
    if (line == null || line.isBlank()) {
      throw new JsonRpcDecodingException("Request line must not be blank", null);
    }
    JsonNode root = parseRoot(line);
    JsonNode id = root.get("id");
    if (id != null && !id.isNull() && !id.isTextual() && !id.isNumber()) {
      throw new JsonRpcDecodingException("Field 'id' must be a string or number", null);
    }

    JsonNode method = root.get("method");
    if (method == null || !method.isTextual() || method.asText().isBlank()) {
      throw new JsonRpcDecodingException("Missing required field 'method'", id);
    }

    JsonNode params = root.get("params");
    if (params != null && !params.isNull() && !params.isObject() && !params.isArray()) {
      throw new JsonRpcDecodingException("Field 'params' must be an object or array", id);
    }

    JsonNode version = root.get("jsonrpc");
    String jsonrpc = version == null || version.isNull() ? null : version.asText();
    return new JsonRpcRequest(jsonrpc, id, method.asText(), params);
  }

  public String encode(JsonRpcResponse response) {
    return toJson(response);
  }

  public String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to encode JSON-RPC payload", ex);
    }
  }

  public <T> T readParams(JsonNode params, Class<T> type) {
    JsonNode source = params == null || params.isNull() ? objectMapper.createObjectNode() : params;
    try {
      return objectMapper.treeToValue(source, type);
    } catch (JsonProcessingException | IllegalArgumentException ex) {
      throw new JsonRpcException(
          JsonRpcErrorCodes.INVALID_PARAMS,
          "Invalid params for " + type.getSimpleName() + ": " + originalMessage(ex));
    }
  }

  private JsonNode parseRoot(String line) {
    JsonNode root;
    try {
      root = objectMapper.readTree(line);
    } catch (JsonProcessingException ex) {
      throw new JsonRpcDecodingException("Invalid JSON: " + originalMessage(ex), null, ex);
    }
    if (root == null || !root.isObject()) {
      throw new JsonRpcDecodingException("JSON-RPC request must be a JSON object", null);
    }
    return root;
  }

  private static String originalMessage(Exception ex) {
    if (ex instanceof JsonProcessingException processingException) {
      return processingException.getOriginalMessage();
    }
    return ex.getMessage();
  }
}
