package com.loanrecon.server.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.loanrecon.server.api.ToolDefinition;

/** A tool advertised by {@code tools/list} and invoked through {@code tools/call}. */
public interface McpTool {
  ToolDefinition definition();

  Object call(JsonNode arguments) throws Exception;

  default String name() {
    return definition().name();
  }
}
