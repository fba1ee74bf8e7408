package org.energysaving.datapipeline.resources.timeseries;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import org.energysaving.datapipeline.api.exceptions.DatabaseException;
import org.energysaving.datapipeline.api.exceptions.InvalidResponseException;
import org.energysaving.datapipeline.api.timeseries.Point;
import org.energysaving.datapipeline.api.timeseries.QueryResult;
import org.energysaving.datapipeline.api.timeseries.RawSeries;
import org.energysaving.datapipeline.api.timeseries.TimePrecision;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.typesafe.config.ConfigFactory;

/**
 * Tests {@link InfluxTimeSeriesStore} against a local HTTP stub.
 */
@Tag("unit")
class InfluxTimeSeriesStoreTest {

    private static final String QUERY_RESPONSE = "{\"results\": [{\"statement_id\": 0, \"series\": [{"
        + "\"name\": \"temperature\", \"tags\": {\"device\": \"s1\"}, \"columns\": [\"time\", \"value\"],"
        + "\"values\": [[\"2024-01-01T00:00:00Z\", 21.5], [\"2024-01-01T00:01:00Z\", null]]}]}]}";

    private HttpServer server;
    private InfluxTimeSeriesStore store;
    private final AtomicReference<String> lastQuery = new AtomicReference<>();
    private final AtomicReference<String> lastBody = new AtomicReference<>();
    private final AtomicReference<String> lastMethod = new AtomicReference<>();
    private volatile int status = 200;
    private volatile String responseBody = QUERY_RESPONSE;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        store = new InfluxTimeSeriesStore(ConfigFactory.parseMap(Map.of(
            "url", "http://127.0.0.1:" + server.getAddress().getPort() + "/",
            "database", "energy_saving",
            "timeoutSeconds", 5)));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        lastMethod.set(exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath());
        lastQuery.set(URLDecoder.decode(exchange.getRequestURI().getRawQuery(), StandardCharsets.UTF_8));
        lastBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        byte[] body = responseBody.getBytes(StandardCharsets.UTF_8);
        if (status == 204) {
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return;
        }
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    @Test
    void query_shouldSendStatementAndParseSeries() {
        // When
        QueryResult result = store.query("select value from temperature group by device", TimePrecision.SECONDS);

        // Then
        assertThat(lastMethod.get()).isEqualTo("GET /query");
        assertThat(lastQuery.get()).contains("db=energy_saving")
            .contains("q=select value from temperature group by device")
            .contains("epoch=s");
        RawSeries series = result.series().get(0);
        assertThat(series.measurement()).isEqualTo("temperature");
        assertThat(series.tag("device")).isEqualTo("s1");
        assertThat(series.rows()).containsExactly(
            new RawSeries.Row("2024-01-01T00:00:00Z", 21.5),
            new RawSeries.Row("2024-01-01T00:01:00Z", null));
    }

    @Test
    void writePoints_shouldPostLineProtocol() {
        // Given
        status = 204;
        Point point = new Point("temperature", Instant.parse("2024-01-01T00:00:00Z"), Map.of("device", "s1"), 21.5);

        // When
        boolean accepted = store.writePoints(List.of(point), TimePrecision.SECONDS);

        // Then
        assertThat(accepted).isTrue();
        assertThat(lastMethod.get()).isEqualTo("POST /write");
        assertThat(lastQuery.get()).contains("precision=s");
        assertThat(lastBody.get()).isEqualTo("temperature,device=s1 value=21.5 1704067200");
    }

    @Test
    void writePoints_shouldSkipEmptyBatch() {
        assertThat(store.writePoints(List.of(), TimePrecision.SECONDS)).isTrue();
        assertThat(lastMethod.get()).isNull();
    }

    @Test
    void execute_shouldPostStatement() {
        responseBody = "{\"results\": [{\"statement_id\": 0}]}";

        store.execute("drop series from temperature");

        assertThat(lastMethod.get()).isEqualTo("POST /query");
        assertThat(lastQuery.get()).contains("q=drop series from temperature");
    }

    @Test
    void errors_shouldBecomeDatabaseExceptions() {
        status = 400;
        responseBody = "{\"error\": \"database not found: energy_saving\"}";

        assertThatThrownBy(() -> store.query("select value from temperature", TimePrecision.NONE))
            .isInstanceOf(DatabaseException.class)
            .hasMessage("database not found: energy_saving");
    }

    @Test
    void unreachableStore_shouldBecomeDatabaseException() {
        InfluxTimeSeriesStore unreachable = new InfluxTimeSeriesStore(ConfigFactory.parseMap(Map.of(
            "url", "http://127.0.0.1:1", "database", "energy_saving", "timeoutSeconds", 2)));

        assertThatThrownBy(() -> unreachable.query("select value from temperature", TimePrecision.NONE))
            .isInstanceOf(DatabaseException.class);
    }

    @Test
    void parseQueryResponse_shouldRejectUnexpectedShapes() {
        assertThat(InfluxTimeSeriesStore.parseQueryResponse("{\"results\": [{}]}").isEmpty()).isTrue();
        assertThatThrownBy(() -> InfluxTimeSeriesStore.parseQueryResponse("not json"))
            .isInstanceOf(InvalidResponseException.class);
        assertThatThrownBy(() -> InfluxTimeSeriesStore.parseQueryResponse("{\"data\": []}"))
            .isInstanceOf(InvalidResponseException.class);
        assertThatThrownBy(() -> InfluxTimeSeriesStore.parseQueryResponse(
            "{\"results\": [{\"series\": [{\"name\": \"t\", \"columns\": [\"value\"]}]}]}"))
            .isInstanceOf(InvalidResponseException.class);
        assertThatThrownBy(() -> InfluxTimeSeriesStore.parseQueryResponse("{\"results\": [{\"error\": \"bad\"}]}"))
            .isInstanceOf(DatabaseException.class)
            .hasMessage("bad");
    }

    @Test
    void parseQueryResponse_shouldKeepScalarTypes() {
        QueryResult result = InfluxTimeSeriesStore.parseQueryResponse("{\"results\": [{\"series\": [{"
            + "\"name\": \"door_open\", \"columns\": [\"time\", \"value\"],"
            + "\"values\": [[1704067200, true], [1704067260, 3], [1704067320, \"open\"]]}]}]}");

        assertThat(result.series().get(0).rows()).extracting(RawSeries.Row::value)
            .containsExactly(true, 3L, "open");
        assertThat(result.series().get(0).rows().get(0).time()).isEqualTo(1704067200L);
    }
}
