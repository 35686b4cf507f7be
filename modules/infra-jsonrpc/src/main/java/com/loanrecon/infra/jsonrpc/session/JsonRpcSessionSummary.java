package com.loanrecon.infra.jsonrpc.session;

public record JsonRpcSessionSummary(long requests, long errors, boolean endOfInput) {}
