package com.loanrecon.server.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.loanrecon.server.api.DatasetStatisticsResponse;
import com.loanrecon.server.api.ToolDefinition;
import com.loanrecon.server.dataset.DatasetService;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2)
public class GetStatisticsTool implements McpTool {
  public static final String NAME = "get_statistics";

  private final DatasetService datasetService;

  public GetStatisticsTool(DatasetService datasetService) {
    this.datasetService = datasetService;
  }

  @Override
  public ToolDefinition definition() {
    Map<String, Object> schema = new LinkedHashMap<>();
    schema.put("type", "object");
    schema.put("properties", Map.of());
    return new ToolDefinition(NAME, "Get overall dataset statistics", schema);
  }

  @Override
  public DatasetStatisticsResponse call(JsonNode arguments) {
    return DatasetStatisticsResponse.from(datasetService.statistics());
  }
}
