package com.di.logsift.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.elasticsearch.client.Request;
import org.elasticsearch.client.Response;
import org.elasticsearch.client.ResponseException;
import org.elasticsearch.client.RestClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link DocumentStore} over the Elasticsearch low-level REST client. The same endpoints are
 * served by OpenSearch, so either cluster works.
 *
 * <p>The {@link RestClient} is Spring Boot's auto-configured client
 * ({@code spring.elasticsearch.uris}, {@code username}, {@code password},
 * {@code socket-timeout}).
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "logsift.store.type", havingValue = "elasticsearch", matchIfMissing = true)
public class ElasticsearchDocumentStore implements DocumentStore {

    private static final String IGNORE = "ignore";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public ElasticsearchDocumentStore(RestClient restClient, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean ping() {
        try {
            Response response = restClient.performRequest(new Request("HEAD", "/"));
            return response.getStatusLine().getStatusCode() == 200;
        } catch (IOException e) {
            log.debug("[STORE] ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public boolean indexExists(String index) {
        Request request = new Request("HEAD", "/" + index);
        request.addParameter(IGNORE, "404");
        return execute(request, "index exists " + index).getStatusLine().getStatusCode() == 200;
    }

    @Override
    public void createIndex(String index, Map<String, Object> body) {
        Request request = new Request("PUT", "/" + index);
        request.setJsonEntity(toJson(body));
        execute(request, "create index " + index);
        log.info("[STORE] created index {}", index);
    }

    @Override
    public void deleteIndex(String index) {
        Request request = new Request("DELETE", "/" + index);
        request.addParameter(IGNORE, "404");
        execute(request, "delete index " + index);
    }

    @Override
    public void refresh(String index) {
        execute(new Request("POST", "/" + index + "/_refresh"), "refresh " + index);
    }

    @Override
    @SuppressWarnings("unchecked")
    public Optional<Map<String, Object>> get(String index, String id) {
        Request request = new Request("GET", "/" + index + "/_doc/" + encode(id));
        request.addParameter(IGNORE, "404");
        Response response = execute(request, "get " + index + "/" + id);
        if (response.getStatusLine().getStatusCode() == 404) {
            return Optional.empty();
        }
        JsonNode body = read(response);
        if (!body.path("found").asBoolean(false)) {
            return Optional.empty();
        }
        return Optional.of(objectMapper.convertValue(body.path("_source"), Map.class));
    }

    @Override
    public Map<String, Map<String, Object>> multiGet(String index, List<String> ids, List<String> sourceFields) {
        if (ids.isEmpty()) {
            return new LinkedHashMap<>();
        }
        Request request = new Request("POST", "/" + index + "/_mget");
        if (sourceFields != null && !sourceFields.isEmpty()) {
            request.addParameter("_source_includes", String.join(",", sourceFields));
        }
        request.setJsonEntity(toJson(Map.of("ids", ids)));
        return ElasticsearchRequests.parseMultiGet(read(execute(request, "mget " + index)), objectMapper);
    }

    @Override
    public void put(String index, String id, Map<String, Object> document) {
        Request request = new Request("PUT", "/" + index + "/_doc/" + encode(id));
        request.setJsonEntity(toJson(document));
        execute(request, "put " + index + "/" + id);
    }

    @Override
    public List<BulkItemResult> bulk(List<BulkOperation> operations) {
        if (operations.isEmpty()) {
            return List.of();
        }
        Request request = new Request("POST", "/_bulk");
        request.setJsonEntity(ElasticsearchRequests.bulkBody(operations, objectMapper));
        return ElasticsearchRequests.parseBulkResponse(read(execute(request, "bulk of " + operations.size())));
    }

    @Override
    public List<ScanHit> search(String index, StoreQuery query, int size) {
        Request request = new Request("POST", "/" + index + "/_search");
        request.setJsonEntity(toJson(ElasticsearchRequests.searchBody(query, size)));
        return ElasticsearchRequests.parseHits(read(execute(request, "search " + index)), objectMapper);
    }

    @Override
    public ScrollPage openScroll(ScanRequest scan) {
        Request request = new Request("POST", "/" + scan.getIndex() + "/_search");
        request.addParameter("scroll", ElasticsearchRequests.keepAlive(scan.getKeepAlive()));
        request.setJsonEntity(toJson(ElasticsearchRequests.scanBody(scan)));
        return ElasticsearchRequests.parseScrollPage(read(execute(request, "scan " + scan.getIndex())), objectMapper);
    }

    @Override
    public ScrollPage continueScroll(String scrollId, Duration keepAlive) {
        Request request = new Request("POST", "/_search/scroll");
        request.setJsonEntity(toJson(ElasticsearchRequests.scrollBody(scrollId, keepAlive)));
        return ElasticsearchRequests.parseScrollPage(read(execute(request, "scroll")), objectMapper);
    }

    @Override
    public void clearScroll(String scrollId) {
        Request request = new Request("DELETE", "/_search/scroll");
        request.addParameter(IGNORE, "404");
        request.setJsonEntity(toJson(Map.of("scroll_id", List.of(scrollId))));
        execute(request, "clear scroll");
    }

    @Override
    public IndexTuning readTuning(String index) {
        Request request = new Request("GET", "/" + index + "/_settings");
        return ElasticsearchRequests.parseTuning(read(execute(request, "read settings " + index)), index);
    }

    @Override
    public void applyTuning(String index, IndexTuning tuning) {
        Request request = new Request("PUT", "/" + index + "/_settings");
        request.setJsonEntity(toJson(ElasticsearchRequests.tuningBody(tuning)));
        execute(request, "apply settings " + index);
    }

    // ------------------------------------------------------------------ //
    // Transport helpers                                                  //
    // ------------------------------------------------------------------ //

    private Response execute(Request request, String description) {
        try {
            return restClient.performRequest(request);
        } catch (ResponseException e) {
            int status = e.getResponse().getStatusLine().getStatusCode();
            throw new StoreException(description + " failed with status " + status + ": " + e.getMessage(), status, e);
        } catch (IOException e) {
            throw new StoreException(description + " failed: " + e.getMessage(), StoreException.NO_RESPONSE, e);
        }
    }

    private JsonNode read(Response response) {
        if (response.getEntity() == null) {
            return objectMapper.createObjectNode();
        }
        try (InputStream content = response.getEntity().getContent()) {
            return objectMapper.readTree(content);
        } catch (IOException e) {
            throw new StoreException("Could not read store response: " + e.getMessage(), StoreException.NO_RESPONSE, e);
        }
    }

    private String toJson(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new StoreException("Could not serialize request: " + e.getOriginalMessage(), 400, e);
        }
    }

    private static String encode(String id) {
        return URLEncoder.encode(id, StandardCharsets.UTF_8);
    }
}
