package com.loanrecon.infra.jsonrpc.contract;

public final class JsonRpcErrorCodes {
  public static final int INVALID_PARAMS = -32602;
  public static final int METHOD_NOT_FOUND = -32601;
  // Catch-all: malformed lines and handler failures both map here.
  public static final int INTERNAL_ERROR = -32603;

  private JsonRpcErrorCodes() {}
}
