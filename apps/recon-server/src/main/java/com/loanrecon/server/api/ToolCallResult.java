package com.loanrecon.server.api;

import java.util.List;

public record ToolCallResult(List<TextContent> content) {
  public static ToolCallResult text(String text) {
    return new ToolCallResult(List.of(TextContent.text(text)));
  }
}
