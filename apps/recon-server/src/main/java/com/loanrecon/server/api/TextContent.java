package com.loanrecon.server.api;

public record TextContent(String type, String text) {
  public static TextContent text(String text) {
    return new TextContent("text", text);
  }
}
