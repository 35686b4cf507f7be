package com.loanrecon.server.mcp;

import com.loanrecon.server.api.ToolDefinition;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class ToolRegistry {
  private final Map<String, McpTool> toolsByName;

  @Autowired
  public ToolRegistry(ObjectProvider<McpTool> tools) {
    this(tools.orderedStream().toList());
  }

  public ToolRegistry(List<McpTool> tools) {
    Map<String, McpTool> byName = new LinkedHashMap<>();
    for (McpTool tool : tools) {
      if (byName.putIfAbsent(tool.name(), tool) != null) {
        throw new IllegalStateException("Duplicate tool name: " + tool.name());
      }
    }
    this.toolsByName = Collections.unmodifiableMap(byName);
  }

  public List<ToolDefinition> definitions() {
    return toolsByName.values().stream().map(McpTool::definition).toList();
  }

  public Optional<McpTool> find(String name) {
    if (name == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(toolsByName.get(name));
  }
}
