package com.loanrecon.server.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.loanrecon.infra.jsonrpc.dispatch.JsonRpcMethodHandler;
import com.loanrecon.server.config.ReconServerProperties;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class InitializeMethodHandler implements JsonRpcMethodHandler {
  private static final Logger log = LoggerFactory.getLogger(InitializeMethodHandler.class);

  private final ReconServerProperties properties;

  public InitializeMethodHandler(ReconServerProperties properties) {
    this.properties = properties;
  }

  @Override
  public String method() {
    return "initialize";
  }

  @Override
  public Map<String, Object> handle(JsonNode params) {
    ReconServerProperties.Server server = properties.getServer();
    if (params != null && params.hasNonNull("clientInfo")) {
      log.info("MCP client initialized clientInfo={}", params.get("clientInfo"));
    }

    Map<String, Object> serverInfo = new LinkedHashMap<>();
    serverInfo.put("name", server.getName());
    serverInfo.put("version", server.getVersion());
    Map<String, Object> capabilities = new LinkedHashMap<>();
    capabilities.put("tools", Map.of());
    capabilities.put("resources", Map.of());

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("protocolVersion", server.getProtocolVersion());
    result.put("serverInfo", serverInfo);
    result.put("capabilities", capabilities);
    return result;
  }
}
