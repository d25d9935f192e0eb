package io.github.yok.forcelink.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.annotations.VisibleForTesting;
import io.github.yok.forcelink.config.ApiConfig;
import io.github.yok.forcelink.exception.ForceLinkException;
import io.github.yok.forcelink.exception.PermanentApiException;
import io.github.yok.forcelink.exception.QueryException;
import io.github.yok.forcelink.exception.TransientApiException;
import io.github.yok.forcelink.exception.TransportException;
import io.github.yok.forcelink.model.QueryPage;
import io.github.yok.forcelink.model.RecordOutcome;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * {@link RemoteObjectStore} backed by the REST API.
 *
 * <p>
 * Bulk writes use the SObject Collections resource with {@code allOrNone=false}, so each record
 * succeeds or fails on its own. Query results are flattened: nested relationship objects become
 * dotted columns such as {@code Account.Name} and the {@code attributes} element is dropped.
 * </p>
 */
@Slf4j
public class RestObjectStore implements RemoteObjectStore {

    private static final String JSON = "application/json";

    private final ApiConfig apiConfig;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public RestObjectStore(ApiConfig apiConfig, HttpClient httpClient) {
        this(apiConfig, httpClient, new ObjectMapper());
    }

    @VisibleForTesting
    RestObjectStore(ApiConfig apiConfig, HttpClient httpClient, ObjectMapper objectMapper) {
        this.apiConfig = apiConfig;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<RecordOutcome> insert(Session session, String objectName,
            List<Map<String, String>> records) {
        String body = collectionBody(objectName, records);
        JsonNode result =
                send(session, request(session, "/composite/sobjects").POST(publisher(body)));
        return toOutcomes(result, records.size());
    }

    @Override
    public List<RecordOutcome> update(Session session, String objectName,
            List<Map<String, String>> records) {
        String body = collectionBody(objectName, records);
        JsonNode result = send(session,
                request(session, "/composite/sobjects").method("PATCH", publisher(body)));
        return toOutcomes(result, records.size());
    }

    @Override
    public List<RecordOutcome> upsert(Session session, String objectName, String externalIdField,
            List<Map<String, String>> records) {
        String body = collectionBody(objectName, records);
        String path = "/composite/sobjects/" + encode(objectName) + "/" + encode(externalIdField);
        JsonNode result =
                send(session, request(session, path).method("PATCH", publisher(body)));
        return toOutcomes(result, records.size());
    }

    @Override
    public List<RecordOutcome> delete(Session session, List<String> ids) {
        String path = "/composite/sobjects?allOrNone=false&ids="
                + encode(String.join(",", ids));
        JsonNode result = send(session, request(session, path).DELETE());
        return toOutcomes(result, ids.size());
    }

    @Override
    public QueryPage query(Session session, String soql) {
        try {
            return toPage(send(session, request(session, "/query?q=" + encode(soql)).GET()));
        } catch (PermanentApiException e) {
            throw new QueryException("Query rejected: " + e.getMessage(), e);
        }
    }

    @Override
    public QueryPage queryMore(Session session, String nextToken) {
        HttpRequest.Builder builder =
                HttpRequest.newBuilder(URI.create(session.getInstanceUrl() + nextToken)).GET();
        try {
            return toPage(send(session, builder));
        } catch (PermanentApiException e) {
            throw new QueryException("Fetching next query page failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Set<String> describeFields(Session session, String objectName) {
        JsonNode result = send(session,
                request(session, "/sobjects/" + encode(objectName) + "/describe").GET());
        Set<String> fields = new LinkedHashSet<>();
        for (JsonNode field : result.path("fields")) {
            fields.add(field.path("name").asText());
        }
        return fields;
    }

    private HttpRequest.Builder request(Session session, String path) {
        return HttpRequest.newBuilder(
                URI.create(session.getInstanceUrl() + "/services/data/v" + apiConfig.getVersion()
                        + path));
    }

    private static HttpRequest.BodyPublisher publisher(String body) {
        return HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    @VisibleForTesting
    String collectionBody(String objectName, List<Map<String, String>> records) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("allOrNone", false);
        ArrayNode array = root.putArray("records");
        for (Map<String, String> record : records) {
            ObjectNode node = array.addObject();
            node.putObject("attributes").put("type", objectName);
            record.forEach((field, value) -> {
                // Blank cells leave the remote value untouched
                if (StringUtils.isNotEmpty(value)) {
                    node.put(field, value);
                }
            });
        }
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new ForceLinkException("Failed to serialize request body", e);
        }
    }

    private JsonNode send(Session session, HttpRequest.Builder builder) {
        HttpRequest request = builder.timeout(apiConfig.getTimeoutDuration())
                .header("Authorization", "Bearer " + session.getAccessToken())
                .header("Accept", JSON).header("Content-Type", JSON).build();
        log.debug("{} {}", request.method(), request.uri());
        HttpResponse<String> response;
        try {
            response = httpClient.send(request,
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new TransientApiException("Request timed out: " + request.uri(), e);
        } catch (IOException e) {
            throw new TransportException("Request failed: " + request.uri(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Request interrupted: " + request.uri(), e);
        }
        int status = response.statusCode();
        String responseBody = response.body();
        if (status == 401) {
            throw new TransportException("Session rejected: " + errorMessage(responseBody), true);
        }
        if (ErrorClassifier.isTransientStatus(status)) {
            throw new TransientApiException(
                    "HTTP " + status + ": " + errorMessage(responseBody));
        }
        if (status >= 400) {
            throw new PermanentApiException(
                    "HTTP " + status + ": " + errorMessage(responseBody));
        }
        if (StringUtils.isBlank(responseBody)) {
            return objectMapper.nullNode();
        }
        try {
            return objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new PermanentApiException("Unreadable response from " + request.uri(), e);
        }
    }

    // Error bodies look like [{"message": "...", "errorCode": "..."}]
    private String errorMessage(String responseBody) {
        if (StringUtils.isBlank(responseBody)) {
            return "(no body)";
        }
        try {
            JsonNode node = objectMapper.readTree(responseBody);
            JsonNode first = node.isArray() && node.size() > 0 ? node.get(0) : node;
            String code = first.path("errorCode").asText("");
            String message = first.path("message").asText("");
            if (!message.isEmpty()) {
                return code.isEmpty() ? message : code + ": " + message;
            }
        } catch (JsonProcessingException e) {
            log.debug("Error body is not JSON: {}", e.getOriginalMessage());
        }
        return StringUtils.abbreviate(responseBody, 500);
    }

    private List<RecordOutcome> toOutcomes(JsonNode result, int expected) {
        if (!result.isArray() || result.size() != expected) {
            throw new PermanentApiException("Expected " + expected + " results but the store"
                    + " returned " + (result.isArray() ? result.size() : 0));
        }
        List<RecordOutcome> outcomes = new ArrayList<>(expected);
        for (JsonNode item : result) {
            if (item.path("success").asBoolean(false)) {
                outcomes.add(RecordOutcome.succeeded(item.path("id").asText(null)));
                continue;
            }
            List<String> codes = new ArrayList<>();
            List<String> messages = new ArrayList<>();
            for (JsonNode error : item.path("errors")) {
                String code = error.path("statusCode").asText("");
                codes.add(code);
                String text = code.isEmpty() ? "" : code + ": ";
                text += error.path("message").asText("Unknown error");
                if (error.path("fields").size() > 0) {
                    text += " " + error.path("fields");
                }
                messages.add(text);
            }
            String reason = messages.isEmpty() ? "Unknown error" : String.join("; ", messages);
            outcomes.add(ErrorClassifier.isTransient(codes) ? RecordOutcome.transientFailure(reason)
                    : RecordOutcome.permanentFailure(reason));
        }
        return outcomes;
    }

    private QueryPage toPage(JsonNode result) {
        Set<String> fieldNames = new LinkedHashSet<>();
        List<Map<String, String>> records = new ArrayList<>();
        for (JsonNode record : result.path("records")) {
            Map<String, String> flat = new LinkedHashMap<>();
            flatten("", record, flat);
            fieldNames.addAll(flat.keySet());
            records.add(flat);
        }
        String next = null;
        if (!result.path("done").asBoolean(true)) {
            next = StringUtils.trimToNull(result.path("nextRecordsUrl").asText(null));
        }
        return new QueryPage(new ArrayList<>(fieldNames), records, next);
    }

    private static void flatten(String prefix, JsonNode node, Map<String, String> out) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if ("attributes".equals(field.getKey())) {
                continue;
            }
            String name = prefix + field.getKey();
            JsonNode value = field.getValue();
            if (value.isObject()) {
                flatten(name + ".", value, out);
            } else if (value.isNull() || value.isMissingNode()) {
                out.put(name, "");
            } else if (value.isValueNode()) {
                out.put(name, value.asText());
            } else {
                out.put(name, value.toString());
            }
        }
    }
}
