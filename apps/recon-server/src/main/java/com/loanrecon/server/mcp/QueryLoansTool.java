package com.loanrecon.server.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.loanrecon.infra.jsonrpc.contract.JsonRpcErrorCodes;
import com.loanrecon.infra.jsonrpc.dispatch.JsonRpcException;
import com.loanrecon.infra.jsonrpc.serde.JsonRpcMessageCodec;
import com.loanrecon.server.api.QueryLoansResponse;
import com.loanrecon.server.api.ToolDefinition;
import com.loanrecon.server.query.LoanQueryRequest;
import com.loanrecon.server.query.LoanQueryService;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(1)
public class QueryLoansTool implements McpTool {
  public static final String NAME = "query_loans";

  private final LoanQueryService queryService;
  private final JsonRpcMessageCodec codec;

  public QueryLoansTool(LoanQueryService queryService, JsonRpcMessageCodec codec) {
    this.queryService = queryService;
    this.codec = codec;
  }

  @Override
  public ToolDefinition definition() {
    Map<String, Object> properties = new LinkedHashMap<>();
    properties.put("query", property("string", "Natural language query"));
    properties.put("limit", property("integer", "Max results to return"));
    properties.put("skip", property("integer", "Records to skip"));
    Map<String, Object> schema = new LinkedHashMap<>();
    schema.put("type", "object");
    schema.put("properties", properties);
    schema.put("required", List.of("query"));
    return new ToolDefinition(NAME, "Query loan data with natural language", schema);
  }

  @Override
  public QueryLoansResponse call(JsonNode arguments) {
    LoanQueryRequest request = codec.readParams(arguments, LoanQueryRequest.class);
    if (request.query() == null) {
      throw new JsonRpcException(
          JsonRpcErrorCodes.INVALID_PARAMS, "Missing required argument 'query' for " + NAME);
    }
    return QueryLoansResponse.from(queryService.execute(request));
  }

  private static Map<String, Object> property(String type, String description) {
    Map<String, Object> property = new LinkedHashMap<>();
    property.put("type", type);
    property.put("description", description);
    return property;
  }
}
