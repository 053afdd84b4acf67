package com.reviewmerge.infrastructure.consolidation.normalize;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.reviewmerge.domain.consolidation.model.*;
import com.reviewmerge.infrastructure.consolidation.InvalidInputException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Reads the raw JSON input shape into typed {@link SourceReport}s.
 *
 * <pre>
 * [ { "source": "...", "data": { "findings": [...], "recommendations": [...], "risks": [...],
 *                                "metrics": {...}, "ranked_actions": [...] } }, ... ]
 * </pre>
 *
 * Only the top level is strict: it must be an array of objects. Everything below is tolerated;
 * missing or wrong-typed fields fall back to empty/default values.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SourceReportReader {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    // Only fields with a typed home are lifted out of extra
    private static final Set<String> SEVERITY_ITEM_KEYS = Set.of("category", "description", "severity");
    private static final Set<String> RECOMMENDATION_KEYS = Set.of("category", "description", "priority");
    private static final Set<String> ACTION_KEYS = Set.of("action", "rank");

    private final ObjectMapper objectMapper;

    public List<SourceReport> read(JsonNode root) {
        if (root == null || !root.isArray()) {
            throw new InvalidInputException("Consolidation input must be a JSON array of source reports");
        }

        List<SourceReport> reports = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            JsonNode entry = root.get(i);
            if (!entry.isObject()) {
                throw new InvalidInputException(
                        "Source report at index " + i + " must be a JSON object, got " + entry.getNodeType());
            }
            reports.add(readReport(entry));
        }
        return reports;
    }

    private SourceReport readReport(JsonNode entry) {
        String source = text(entry, "source");
        JsonNode data = entry.path("data");
        if (!data.isObject()) {
            log.debug("[Reader] Source '{}' has no data object, treating as empty", source);
            data = objectMapper.createObjectNode();
        }

        List<Finding> findings = new ArrayList<>();
        for (JsonNode node : objects(data, "findings")) {
            findings.add(new Finding(text(node, "category"), text(node, "description"),
                    text(node, "severity"), extra(node, SEVERITY_ITEM_KEYS)));
        }

        List<Recommendation> recommendations = new ArrayList<>();
        for (JsonNode node : objects(data, "recommendations")) {
            recommendations.add(new Recommendation(text(node, "category"), text(node, "description"),
                    text(node, "priority"), extra(node, RECOMMENDATION_KEYS)));
        }

        List<Risk> risks = new ArrayList<>();
        for (JsonNode node : objects(data, "risks")) {
            risks.add(new Risk(text(node, "category"), text(node, "description"),
                    text(node, "severity"), extra(node, SEVERITY_ITEM_KEYS)));
        }

        List<RankedAction> actions = new ArrayList<>();
        for (JsonNode node : objects(data, "ranked_actions", "rankedActions")) {
            actions.add(new RankedAction(text(node, "action"), rank(node.get("rank")), extra(node, ACTION_KEYS)));
        }

        return new SourceReport(source, findings, recommendations, risks, readMetrics(source, data), actions);
    }

    private SourceMetrics readMetrics(String source, JsonNode data) {
        JsonNode metrics = data.path("metrics");
        if (!metrics.isObject() || metrics.isEmpty()) {
            return null;
        }

        Double confidence = null;
        JsonNode confidenceNode = metrics.get("confidence");
        if (confidenceNode != null && !confidenceNode.isNull()) {
            confidence = toDouble(confidenceNode);
            if (confidence == null) {
                log.warn("[Reader] Source '{}' reported non-numeric confidence '{}', ignoring",
                        source, confidenceNode.asText());
            }
        }

        Map<String, Long> stats = new LinkedHashMap<>();
        JsonNode statsNode = firstPresent(metrics, "summary_stats", "summaryStats");
        if (statsNode.isObject()) {
            statsNode.fields().forEachRemaining(e -> stats.put(e.getKey(), toLong(e.getValue())));
        }

        List<String> priorities = new ArrayList<>();
        JsonNode prioritiesNode = firstPresent(metrics, "top_priorities", "topPriorities");
        if (prioritiesNode.isArray()) {
            for (JsonNode p : prioritiesNode) {
                if (p.isValueNode() && !p.isNull()) {
                    priorities.add(p.asText());
                }
            }
        }

        return new SourceMetrics(confidence, text(metrics, "coverage"), stats, priorities);
    }

    // =========================================================================
    //  Internal Helpers
    // =========================================================================

    /**
     * Object elements of the first array found under any of the keys. Non-object elements are skipped.
     */
    private List<JsonNode> objects(JsonNode parent, String... keys) {
        JsonNode array = firstPresent(parent, keys);
        if (!array.isArray()) {
            return List.of();
        }
        List<JsonNode> result = new ArrayList<>(array.size());
        for (JsonNode node : array) {
            if (node.isObject()) {
                result.add(node);
            }
        }
        return result;
    }

    private JsonNode firstPresent(JsonNode parent, String... keys) {
        for (String key : keys) {
            JsonNode node = parent.get(key);
            if (node != null && !node.isNull()) {
                return node;
            }
        }
        return objectMapper.missingNode();
    }

    /**
     * Scalar field as text, null when absent or not a scalar.
     */
    private static String text(JsonNode node, String key) {
        JsonNode value = node.get(key);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        return value.asText();
    }

    private Map<String, Object> extra(JsonNode node, Set<String> knownKeys) {
        ObjectNode copy = ((ObjectNode) node).deepCopy();
        copy.remove(knownKeys);
        if (copy.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> converted = objectMapper.convertValue(copy, MAP_TYPE);
        // Map.copyOf rejects null values
        converted.values().removeIf(Objects::isNull);
        return converted;
    }

    private static int rank(JsonNode node) {
        Double value = node == null ? null : toDouble(node);
        return value != null ? value.intValue() : RankedAction.DEFAULT_RANK;
    }

    private static Double toDouble(JsonNode node) {
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(value) ? value : null;
    }

    /**
     * Counter value; integral input keeps full long precision, fractions truncate, junk is 0.
     */
    private static long toLong(JsonNode node) {
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.asLong();
        }
        if (node.isTextual()) {
            try {
                return Long.parseLong(node.asText().trim());
            } catch (NumberFormatException e) {
                return truncated(node);
            }
        }
        return truncated(node);
    }

    private static long truncated(JsonNode node) {
        Double value = toDouble(node);
        return value != null ? value.longValue() : 0L;
    }
}
