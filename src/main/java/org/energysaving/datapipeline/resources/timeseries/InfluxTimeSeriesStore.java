package org.energysaving.datapipeline.resources.timeseries;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.energysaving.datapipeline.api.exceptions.DatabaseException;
import org.energysaving.datapipeline.api.exceptions.InvalidResponseException;
import org.energysaving.datapipeline.api.timeseries.ITimeSeriesStore;
import org.energysaving.datapipeline.api.timeseries.Point;
import org.energysaving.datapipeline.api.timeseries.QueryResult;
import org.energysaving.datapipeline.api.timeseries.RawSeries;
import org.energysaving.datapipeline.api.timeseries.TimePrecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;

/**
 * Time-series store backed by the InfluxDB 1.x HTTP API.
 * <p>
 * Every call opens its own {@link HttpClient}. Transport failures and non-2xx answers are
 * reported as {@link DatabaseException}; answers that are not the expected
 * {@code results[].series[]} document as {@link InvalidResponseException}.
 * <p>
 * <strong>Configuration:</strong>
 * <ul>
 *   <li>{@code url} (default {@code http://localhost:8086})</li>
 *   <li>{@code database} (required)</li>
 *   <li>{@code username}, {@code password} (optional)</li>
 *   <li>{@code timeoutSeconds} (default 30)</li>
 * </ul>
 */
public class InfluxTimeSeriesStore implements ITimeSeriesStore {

    private static final Logger log = LoggerFactory.getLogger(InfluxTimeSeriesStore.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String url;
    private final String database;
    private final String username;
    private final String password;
    private final Duration timeout;

    public InfluxTimeSeriesStore(Config options) {
        if (!options.hasPath("database")) {
            throw new IllegalArgumentException("'database' must be configured for the time-series store.");
        }
        String configuredUrl = options.hasPath("url") ? options.getString("url") : "http://localhost:8086";
        this.url = configuredUrl.endsWith("/") ? configuredUrl.substring(0, configuredUrl.length() - 1) : configuredUrl;
        this.database = options.getString("database");
        this.username = options.hasPath("username") ? options.getString("username") : null;
        this.password = options.hasPath("password") ? options.getString("password") : null;
        this.timeout = Duration.ofSeconds(options.hasPath("timeoutSeconds") ? options.getInt("timeoutSeconds") : 30);
    }

    @Override
    public QueryResult query(String query, TimePrecision precision) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", query);
        if (precision != TimePrecision.NONE) {
            params.put("epoch", precision.getCode());
        }
        log.debug("Executing query on {}: {}", database, query);
        HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/query", params)).GET());
        return parseQueryResponse(response.body());
    }

    @Override
    public boolean writePoints(List<Point> points, TimePrecision precision) {
        if (points.isEmpty()) {
            return true;
        }
        Map<String, String> params = new LinkedHashMap<>();
        if (precision != TimePrecision.NONE) {
            params.put("precision", precision.getCode());
        }
        String body = LineProtocol.encode(points, precision);
        HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/write", params))
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8)));
        boolean accepted = response.statusCode() == 204 || response.statusCode() == 200;
        log.debug("Wrote {} points to {} (status {})", points.size(), database, response.statusCode());
        return accepted;
    }

    @Override
    public void execute(String statement) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("q", statement);
        log.debug("Executing statement on {}: {}", database, statement);
        HttpResponse<String> response = send(HttpRequest.newBuilder(uri("/query", params))
            .POST(HttpRequest.BodyPublishers.noBody()));
        parseQueryResponse(response.body());
    }

    /**
     * Parses a {@code /query} answer.
     *
     * @param body Response body
     * @return Series of the first statement
     * @throws DatabaseException if the store reported an error
     * @throws InvalidResponseException if the document has an unexpected shape
     */
    static QueryResult parseQueryResponse(String body) {
        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new InvalidResponseException("Time-series store returned malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new InvalidResponseException("Time-series store returned no JSON object");
        }
        if (root.hasNonNull("error")) {
            throw new DatabaseException(root.get("error").asText());
        }
        JsonNode results = root.get("results");
        if (results == null || !results.isArray()) {
            throw new InvalidResponseException("Time-series store response has no results array");
        }
        List<RawSeries> series = new ArrayList<>();
        for (JsonNode result : results) {
            if (result.hasNonNull("error")) {
                throw new DatabaseException(result.get("error").asText());
            }
            JsonNode resultSeries = result.get("series");
            if (resultSeries == null) {
                continue;
            }
            if (!resultSeries.isArray()) {
                throw new InvalidResponseException("Time-series store response has a non-array series field");
            }
            for (JsonNode entry : resultSeries) {
                series.add(parseSeries(entry));
            }
        }
        return new QueryResult(series);
    }

    private static RawSeries parseSeries(JsonNode entry) {
        JsonNode columns = entry.get("columns");
        if (!entry.hasNonNull("name") || columns == null || !columns.isArray()) {
            throw new InvalidResponseException("Series without name or columns in time-series store response");
        }
        int timeIndex = -1;
        int valueIndex = -1;
        for (int i = 0; i < columns.size(); i++) {
            String column = columns.get(i).asText();
            if ("time".equals(column)) {
                timeIndex = i;
            } else if (valueIndex < 0) {
                valueIndex = i;
            }
        }
        if (timeIndex < 0 || valueIndex < 0) {
            throw new InvalidResponseException("Series " + entry.get("name").asText() + " lacks a time or value column");
        }
        Map<String, String> tags = new LinkedHashMap<>();
        JsonNode tagNode = entry.get("tags");
        if (tagNode != null && tagNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = tagNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                tags.put(field.getKey(), field.getValue().isNull() ? null : field.getValue().asText());
            }
        }
        List<RawSeries.Row> rows = new ArrayList<>();
        JsonNode values = entry.get("values");
        if (values != null) {
            for (JsonNode row : values) {
                rows.add(new RawSeries.Row(scalar(row.get(timeIndex)), scalar(row.get(valueIndex))));
            }
        }
        return new RawSeries(entry.get("name").asText(), tags, rows);
    }

    private static Object scalar(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isIntegralNumber()) {
            return node.longValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        return node.asText();
    }

    private URI uri(String path, Map<String, String> params) {
        StringBuilder uri = new StringBuilder(url).append(path).append("?db=").append(encode(database));
        if (username != null) {
            uri.append("&u=").append(encode(username)).append("&p=").append(encode(password == null ? "" : password));
        }
        params.forEach((key, value) -> uri.append('&').append(key).append('=').append(encode(value)));
        return URI.create(uri.toString());
    }

    private HttpResponse<String> send(HttpRequest.Builder request) {
        HttpClient client = HttpClient.newBuilder().connectTimeout(timeout).build();
        try {
            HttpResponse<String> response = client.send(request.timeout(timeout).build(),
                HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 300) {
                String message = "Time-series store answered HTTP " + response.statusCode();
                try {
                    JsonNode error = MAPPER.readTree(response.body());
                    if (error != null && error.hasNonNull("error")) {
                        message = error.get("error").asText();
                    }
                } catch (JsonProcessingException e) {
                    log.debug("Error body is not JSON: {}", response.body());
                }
                throw new DatabaseException(message);
            }
            return response;
        } catch (IOException e) {
            throw new DatabaseException("Time-series store at " + url + " unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DatabaseException("Interrupted while calling time-series store at " + url, e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
