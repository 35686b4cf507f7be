package com.loanrecon.server.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.loanrecon.infra.jsonrpc.contract.JsonRpcErrorCodes;
import com.loanrecon.infra.jsonrpc.dispatch.JsonRpcException;
import com.loanrecon.infra.jsonrpc.dispatch.JsonRpcMethodHandler;
import com.loanrecon.infra.jsonrpc.serde.JsonRpcMessageCodec;
import com.loanrecon.server.api.ToolCallResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ToolsCallMethodHandler implements JsonRpcMethodHandler {
  private static final Logger log = LoggerFactory.getLogger(ToolsCallMethodHandler.class);

  private final ToolRegistry toolRegistry;
  private final JsonRpcMessageCodec codec;

  public ToolsCallMethodHandler(ToolRegistry toolRegistry, JsonRpcMessageCodec codec) {
    this.toolRegistry = toolRegistry;
    this.codec = codec;
  }

  @Override
  public String method() {
    return "tools/call";
  }

  @Override
  public ToolCallResult handle(JsonNode params) throws Exception {
    ToolCallParams call = codec.readParams(params, ToolCallParams.class);
    if (call.name() == null || call.name().isBlank()) {
      throw new JsonRpcException(JsonRpcErrorCodes.INVALID_PARAMS, "Missing required param 'name'");
    }
    McpTool tool =
        toolRegistry
            .find(call.name())
            .orElseThrow(
                () ->
                    new JsonRpcException(
                        JsonRpcErrorCodes.INVALID_PARAMS, "Unknown tool: " + call.name()));

    JsonNode arguments = call.arguments();
    if (arguments == null || arguments.isNull()) {
      arguments = JsonNodeFactory.instance.objectNode();
    } else if (!arguments.isObject()) {
      throw new JsonRpcException(
          JsonRpcErrorCodes.INVALID_PARAMS, "Param 'arguments' must be an object");
    }

    log.debug("Calling tool name={}", tool.name());
    return ToolCallResult.text(codec.toJson(tool.call(arguments)));
  }
}
