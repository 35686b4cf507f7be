package com.loanrecon.server.mcp;

import com.fasterxml.jackson.databind.JsonNode;

public record ToolCallParams(String name, JsonNode arguments) {}
