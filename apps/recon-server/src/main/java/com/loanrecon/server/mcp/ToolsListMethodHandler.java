package com.loanrecon.server.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.loanrecon.infra.jsonrpc.dispatch.JsonRpcMethodHandler;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class ToolsListMethodHandler implements JsonRpcMethodHandler {
  private final ToolRegistry toolRegistry;

  public ToolsListMethodHandler(ToolRegistry toolRegistry) {
    this.toolRegistry = toolRegistry;
  }

  @Override
  public String method() {
    return "tools/list";
  }

  @Override
  public Map<String, Object> handle(JsonNode params) {
    return Map.of("tools", toolRegistry.definitions());
  }
}
