package com.loanrecon.infra.jsonrpc.dispatch;

import com.fasterxml.jackson.databind.JsonNode;

public interface JsonRpcMethodHandler {
  String method();

  Object handle(JsonNode params) throws Exception;
}
