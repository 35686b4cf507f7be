package com.loanrecon.server.mcp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.loanrecon.infra.jsonrpc.dispatch.JsonRpcDispatcher;
import com.loanrecon.infra.jsonrpc.observability.NoOpJsonRpcTelemetry;
import com.loanrecon.infra.jsonrpc.serde.JsonRpcMessageCodec;
import com.loanrecon.infra.jsonrpc.serde.JsonRpcObjectMapperFactory;
import com.loanrecon.infra.jsonrpc.session.JsonRpcSessionLoop;
import com.loanrecon.integration.spreadsheet.LoanSourceLoader;
import com.loanrecon.server.LoanFixtures;
import com.loanrecon.server.config.ReconServerProperties;
import com.loanrecon.server.dataset.DatasetService;
import com.loanrecon.server.query.LoanQueryService;
import com.loanrecon.server.query.LoanStatisticsCalculator;
import com.loanrecon.server.query.QueryRuleCascade;
import com.loanrecon.server.store.LoanRecordStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.BufferedReader;
import java.io.StringReader;
import java.io.StringWriter;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class McpSessionTest {
  private final ObjectMapper objectMapper = JsonRpcObjectMapperFactory.create();
  private JsonRpcSessionLoop loop;

  @BeforeEach
  void setUp() {
    JsonRpcMessageCodec codec = new JsonRpcMessageCodec(objectMapper);
    SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    LoanRecordStore store = new LoanRecordStore(Clock.systemUTC());
    store.build(LoanFixtures.portfolio());
    LoanQueryService queryService =
        new LoanQueryService(
            store,
            QueryRuleCascade.withDefaults(),
            new LoanStatisticsCalculator(),
            meterRegistry,
            100);
    DatasetService datasetService =
        new DatasetService(
            org.mockito.Mockito.mock(LoanSourceLoader.class), store, meterRegistry);
    ToolRegistry toolRegistry =
        new ToolRegistry(
            List.of(
                new QueryLoansTool(queryService, codec), new GetStatisticsTool(datasetService)));
    NoOpJsonRpcTelemetry telemetry = new NoOpJsonRpcTelemetry();
    JsonRpcDispatcher dispatcher =
        new JsonRpcDispatcher(
            List.of(
                new InitializeMethodHandler(new ReconServerProperties()),
                new ToolsListMethodHandler(toolRegistry),
                new ToolsCallMethodHandler(toolRegistry, codec)),
            telemetry);
    loop = new JsonRpcSessionLoop(codec, dispatcher, telemetry);
  }

  @Test
  void shouldAnswerInitializeWithServerDescriptor() throws Exception {
    JsonNode response =
        session("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{}}").get(0);

    assertEquals(1, response.path("id").asInt());
    JsonNode result = response.path("result");
    assertEquals("2024-11-05", result.path("protocolVersion").asText());
    assertEquals("loan-recon-server", result.path("serverInfo").path("name").asText());
    assertTrue(result.path("capabilities").has("tools"));
    assertTrue(result.path("capabilities").has("resources"));
  }

  @Test
  void shouldListBothTools() throws Exception {
    JsonNode tools =
        session("{\"jsonrpc\":\"2.0\",\"id\":\"t\",\"method\":\"tools/list\"}")
            .get(0)
            .path("result")
            .path("tools");

    assertEquals(2, tools.size());
    assertEquals("query_loans", tools.get(0).path("name").asText());
    assertEquals("query", tools.get(0).path("inputSchema").path("required").get(0).asText());
    assertEquals("get_statistics", tools.get(1).path("name").asText());
    assertEquals("object", tools.get(1).path("inputSchema").path("type").asText());
  }

  @Test
  void shouldWrapQueryResultAsTextContent() throws Exception {
    JsonNode response =
        session(
                "{\"jsonrpc\":\"2.0\",\"id\":\"q1\",\"method\":\"tools/call\",\"params\":"
                    + "{\"name\":\"query_loans\",\"arguments\":"
                    + "{\"query\":\"Find loan LN-001234\",\"limit\":5}}}")
            .get(0);

    JsonNode content = response.path("result").path("content").get(0);
    assertEquals("text", content.path("type").asText());
    JsonNode payload = objectMapper.readTree(content.path("text").asText());
    assertTrue(payload.path("success").asBoolean());
    assertEquals(1, payload.path("totalCount").asInt());
    assertEquals("LoanByID", payload.path("metadata").path("queryType").asText());
    JsonNode record = payload.path("data").get(0);
    assertEquals("LN-001234", record.path("loanId").asText());
    assertEquals("John Smith", record.path("borrowerName").asText());
    assertFalse(record.path("hasMismatch").asBoolean());
    assertTrue(payload.path("metadata").path("statistics").has("TotalAmount_Servicer"));
  }

  @Test
  void shouldReturnDatasetStatistics() throws Exception {
    JsonNode response =
        session(
                "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/call\","
                    + "\"params\":{\"name\":\"get_statistics\"}}")
            .get(0);

    JsonNode payload =
        objectMapper.readTree(response.path("result").path("content").get(0).path("text").asText());
    assertEquals(6, payload.path("totalRecords").asInt());
    assertTrue(payload.path("dataLoaded").asBoolean());
    assertTrue(payload.path("lastLoadTime").isTextual());
  }

  @Test
  void shouldRecoverAfterUnparseableLine() throws Exception {
    List<JsonNode> responses =
        session(
            "{\"jsonrpc\":\"2.0\",\"id\":\"1\",\"method\":",
            "{\"jsonrpc\":\"2.0\",\"id\":\"2\",\"method\":\"tools/call\",\"params\":"
                + "{\"name\":\"query_loans\",\"arguments\":{\"query\":\"asdkjasd\"}}}");

    assertEquals(2, responses.size());
    assertEquals(-32603, responses.get(0).path("error").path("code").asInt());
    assertFalse(responses.get(0).has("id"));
    JsonNode payload =
        objectMapper.readTree(
            responses.get(1).path("result").path("content").get(0).path("text").asText());
    assertTrue(payload.path("success").asBoolean());
    assertEquals("Unknown", payload.path("metadata").path("queryType").asText());
    assertEquals(0, payload.path("data").size());
  }

  @Test
  void shouldRejectInvalidToolCalls() throws Exception {
    List<JsonNode> responses =
        session(
            "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/call\","
                + "\"params\":{\"name\":\"drop\"}}",
            "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/call\",\"params\":{}}",
            "{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"tools/call\","
                + "\"params\":{\"name\":\"query_loans\",\"arguments\":{}}}",
            "{\"jsonrpc\":\"2.0\",\"id\":4,\"method\":\"resources/list\"}");

    assertEquals(-32602, responses.get(0).path("error").path("code").asInt());
    assertEquals("Unknown tool: drop", responses.get(0).path("error").path("message").asText());
    assertEquals(-32602, responses.get(1).path("error").path("code").asInt());
    assertEquals(-32602, responses.get(2).path("error").path("code").asInt());
    assertEquals(-32601, responses.get(3).path("error").path("code").asInt());
    assertEquals(4, responses.get(3).path("id").asInt());
  }

  private List<JsonNode> session(String... lines) throws Exception {
    StringWriter output = new StringWriter();
    loop.run(new BufferedReader(new StringReader(String.join("\n", lines) + "\n")), output);
    List<JsonNode> responses = new ArrayList<>();
    for (String line : output.toString().split("\n")) {
      if (!line.isBlank()) {
        responses.add(objectMapper.readTree(line));
      }
    }
    return responses;
  }
}
