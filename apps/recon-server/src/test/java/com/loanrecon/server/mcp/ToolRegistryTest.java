package com.loanrecon.server.mcp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.loanrecon.server.api.ToolDefinition;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolRegistryTest {

  @Test
  void shouldKeepRegistrationOrderInDefinitions() {
    McpTool first = tool("first");
    McpTool second = tool("second");

    ToolRegistry registry = new ToolRegistry(List.of(first, second));

    assertEquals(
        List.of("first", "second"),
        registry.definitions().stream().map(ToolDefinition::name).toList());
    assertSame(second, registry.find("second").orElseThrow());
  }

  @Test
  void shouldReturnEmptyForUnknownOrNullName() {
    ToolRegistry registry = new ToolRegistry(List.of(tool("first")));

    assertTrue(registry.find("missing").isEmpty());
    assertTrue(registry.find(null).isEmpty());
  }

  @Test
  void shouldRejectDuplicateToolNames() {
    IllegalStateException ex =
        assertThrows(
            IllegalStateException.class,
            () -> new ToolRegistry(List.of(tool("dup"), tool("dup"))));

    assertEquals("Duplicate tool name: dup", ex.getMessage());
  }

  private static McpTool tool(String name) {
    return new McpTool() {
      @Override
      public ToolDefinition definition() {
        return new ToolDefinition(name, "test tool", Map.of("type", "object"));
      }

      @Override
      public Object call(JsonNode arguments) {
        return Map.of("tool", name);
      }
    };
  }
}
