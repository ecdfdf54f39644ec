package com.linlay.agentgateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentgateway.model.Capability;
import com.linlay.agentgateway.model.api.ChatEnvelope;
import com.linlay.agentgateway.model.api.DocumentEnvelope;
import com.linlay.agentgateway.model.metadata.AgentMetadata;
import com.linlay.agentgateway.model.metadata.AgentUsed;
import com.linlay.agentgateway.model.metadata.DocumentMetadata;
import com.linlay.agentgateway.model.metadata.RetrievalMetadata;
import com.linlay.agentgateway.model.metadata.RetrievalSource;
import com.linlay.agentgateway.model.metadata.RoutingInfo;
import com.linlay.agentgateway.model.metadata.SmartRouteMetadata;
import com.linlay.agentgateway.model.metadata.SqlInfo;
import com.linlay.agentgateway.model.metadata.StructuredQueryMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps each agent's native JSON onto the gateway envelopes. {@code success} and {@code response}
 * pass through untouched; recognised metadata is copied as-is and absent fields stay absent.
 */
@Component
public class ResponseNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ResponseNormalizer.class);

    static final String AGENT_FAILURE_FALLBACK = "Agent reported a failure without details";

    private final ObjectMapper objectMapper;

    public ResponseNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ChatEnvelope normalize(Capability capability, JsonNode body) {
        JsonNode root = requireObject(capability, body);
        boolean success = root.path("success").asBoolean(false);
        String response = textOrNull(root.get("response"));
        if (response == null) {
            response = success ? "" : failureDescription(root);
        }
        AgentMetadata metadata = switch (capability) {
            case STRUCTURED_QUERY -> structuredQuery(capability, root);
            case RETRIEVAL -> retrieval(capability, root.get("sources"));
            case SMART_ROUTE -> smartRoute(capability, root);
            case DOCUMENT_UNDERSTANDING -> document(capability, root);
        };
        return ChatEnvelope.of(success, response, timestamp(root), metadata);
    }

    public DocumentEnvelope normalizeDocument(JsonNode body) {
        Capability capability = Capability.DOCUMENT_UNDERSTANDING;
        JsonNode root = requireObject(capability, body);
        boolean success = root.path("success").asBoolean(false);
        String error = success ? null : failureDescription(root);
        return DocumentEnvelope.of(success, document(capability, root), timestamp(root), error);
    }

    private StructuredQueryMetadata structuredQuery(Capability capability, JsonNode root) {
        JsonNode sqlInfo = root.get("sql_info");
        if (isAbsent(sqlInfo)) {
            return null;
        }
        SqlInfo typed = convert(capability, sqlInfo, SqlInfo.class);
        log.debug("Agent reported sql_info capability={}, queriesCount={}", capability.key(), typed.queriesCount());
        return new StructuredQueryMetadata(typed, sqlInfo.deepCopy());
    }

    private RetrievalMetadata retrieval(Capability capability, JsonNode sources) {
        if (isAbsent(sources)) {
            return null;
        }
        if (!sources.isArray()) {
            throw malformed(capability, "sources is not an array");
        }
        List<RetrievalSource> items = new ArrayList<>();
        for (JsonNode source : sources) {
            items.add(convert(capability, source, RetrievalSource.class));
        }
        return new RetrievalMetadata(List.copyOf(items));
    }

    private SmartRouteMetadata smartRoute(Capability capability, JsonNode root) {
        String agentUsed = textOrNull(root.get("agent_used"));
        JsonNode routingNode = root.has("routing_info") ? root.get("routing_info") : root.get("routing");
        RoutingInfo routing = isAbsent(routingNode) ? null : convert(capability, routingNode, RoutingInfo.class);

        StructuredQueryMetadata database = structuredQuery(capability, root);
        JsonNode sources = root.get("sources");
        if (isAbsent(sources)) {
            sources = root.path("rag_info").get("sources");
        }
        RetrievalMetadata retrieval = retrieval(capability, sources);

        AgentUsed parsed = AgentUsed.parse(agentUsed).orElse(null);
        if (agentUsed != null && parsed == null) {
            log.warn("Smart agent reported unknown agent_used={}", agentUsed);
        } else if (parsed != null) {
            if (parsed.expectsDatabase() && database == null) {
                log.debug("Smart agent used database but returned no sql_info");
            }
            if (parsed.expectsRetrieval() && retrieval == null) {
                log.debug("Smart agent used rag but returned no sources");
            }
        }
        if (agentUsed == null && routing == null && database == null && retrieval == null) {
            return null;
        }
        return new SmartRouteMetadata(agentUsed, routing, database, retrieval);
    }

    private DocumentMetadata document(Capability capability, JsonNode root) {
        return new DocumentMetadata(
                textOrNull(root.get("extracted_text")),
                textOrNull(root.get("analysis")),
                stringList(capability, root.get("recommendations")),
                stringList(capability, root.get("alerts"))
        );
    }

    private List<String> stringList(Capability capability, JsonNode node) {
        if (isAbsent(node)) {
            return List.of();
        }
        if (!node.isArray()) {
            throw malformed(capability, "expected an array of strings");
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            String value = textOrNull(item);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }

    private <T> T convert(Capability capability, JsonNode node, Class<T> type) {
        if (!node.isObject()) {
            throw malformed(capability, type.getSimpleName() + " is not an object");
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException ex) {
            log.warn("Malformed {} from capability={}", type.getSimpleName(), capability.key());
            throw GatewayException.downstreamError(capability, ex);
        }
    }

    private JsonNode requireObject(Capability capability, JsonNode body) {
        if (body == null || !body.isObject()) {
            throw malformed(capability, "response body is not a JSON object");
        }
        return body;
    }

    private String failureDescription(JsonNode root) {
        for (String field : List.of("error", "detail", "message")) {
            String value = textOrNull(root.get(field));
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return AGENT_FAILURE_FALLBACK;
    }

    private String timestamp(JsonNode root) {
        String timestamp = textOrNull(root.get("timestamp"));
        return timestamp == null || timestamp.isBlank() ? Instant.now().toString() : timestamp;
    }

    private GatewayException malformed(Capability capability, String detail) {
        log.warn("Malformed response from capability={}: {}", capability.key(), detail);
        return GatewayException.downstreamError(capability, null);
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    private static String textOrNull(JsonNode node) {
        if (isAbsent(node)) {
            return null;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
