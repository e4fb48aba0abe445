/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.io.codec;

import ai.evacortex.p3if.core.engine.ExternalFramework;
import ai.evacortex.p3if.core.engine.ExternalPatternData;
import ai.evacortex.p3if.core.engine.ExternalRelationshipData;
import ai.evacortex.p3if.core.exceptions.FrameworkImportException;
import ai.evacortex.p3if.core.model.Pattern;
import ai.evacortex.p3if.core.model.PatternType;
import ai.evacortex.p3if.core.model.Relationship;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Reads and writes the framework exchange document:
 * <pre>
 * { "patterns": [...], "relationships": [...],
 *   "framework_metadata": { "exported_at", "schema_version", "checksum", ... } }
 * </pre>
 * The checksum is an xxHash64 over the compact encoding of the two arrays. Documents without a
 * checksum are accepted as-is.
 */
public class FrameworkJsonCodec {

    private static final Logger log = LoggerFactory.getLogger(FrameworkJsonCodec.class);

    public static final String SCHEMA_VERSION = "2.0";

    private final ObjectMapper mapper;

    public FrameworkJsonCodec() {
        this(JsonMappers.create());
    }

    public FrameworkJsonCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String export(Collection<Pattern> patterns, Collection<Relationship> relationships) {
        ArrayNode patternNodes = mapper.valueToTree(patterns);
        ArrayNode relationshipNodes = mapper.valueToTree(relationships);

        ObjectNode meta = mapper.createObjectNode();
        meta.put("exported_at", Instant.now().toString());
        meta.put("schema_version", SCHEMA_VERSION);
        meta.put("pattern_count", patterns.size());
        meta.put("relationship_count", relationships.size());
        meta.put("checksum", checksum(patternNodes, relationshipNodes));

        ObjectNode root = mapper.createObjectNode();
        root.set("patterns", patternNodes);
        root.set("relationships", relationshipNodes);
        root.set("framework_metadata", meta);
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode framework document", e);
        }
    }

    /**
     * Decodes an exchange document without touching any store.
     *
     * @throws FrameworkImportException on malformed JSON, undecodable records or checksum mismatch
     */
    public FrameworkDocument read(String json) {
        JsonNode root = parse(json);
        JsonNode patternNodes = arrayOrEmpty(root, "patterns");
        JsonNode relationshipNodes = arrayOrEmpty(root, "relationships");
        JsonNode meta = root.path("framework_metadata");

        String expected = meta.path("checksum").asText(null);
        if (expected != null) {
            String actual = checksum(patternNodes, relationshipNodes);
            if (!expected.equalsIgnoreCase(actual)) {
                throw new FrameworkImportException("Checksum mismatch: document says " + expected
                        + ", content hashes to " + actual);
            }
        }

        List<Pattern> patterns = new ArrayList<>();
        for (JsonNode node : patternNodes) {
            patterns.add(decode(node, Pattern.class, "pattern"));
        }
        List<Relationship> relationships = new ArrayList<>();
        for (JsonNode node : relationshipNodes) {
            relationships.add(decode(node, Relationship.class, "relationship"));
        }
        return new FrameworkDocument(patterns, relationships,
                parseInstant(meta.path("exported_at").asText(null)),
                meta.path("schema_version").asText(null));
    }

    /**
     * Decodes a multiplex payload: one array per dimension key plus an optional
     * {@code relationships} array. Unknown dimension keys are logged and ignored. An item that cannot
     * be decoded is recorded on the result instead of failing the whole payload.
     *
     * @throws FrameworkImportException if the payload itself is not a JSON object
     */
    public ExternalFramework readExternal(String json) {
        JsonNode root = parse(json);
        Map<PatternType, List<ExternalPatternData>> patterns = new EnumMap<>(PatternType.class);
        List<ExternalRelationshipData> relationships = new ArrayList<>();
        List<String> badPatterns = new ArrayList<>();
        List<String> badRelationships = new ArrayList<>();

        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isArray()) continue;
            if ("relationships".equals(field.getKey())) {
                for (JsonNode node : field.getValue()) {
                    try {
                        relationships.add(decode(node, ExternalRelationshipData.class, "relationship"));
                    } catch (FrameworkImportException e) {
                        badRelationships.add(e.getMessage());
                    }
                }
                continue;
            }
            PatternType type;
            try {
                type = PatternType.fromKey(field.getKey());
            } catch (IllegalArgumentException e) {
                log.warn("Unknown dimension '{}' in external framework, ignoring {} item(s)",
                        field.getKey(), field.getValue().size());
                continue;
            }
            List<ExternalPatternData> items = patterns.computeIfAbsent(type, k -> new ArrayList<>());
            for (JsonNode node : field.getValue()) {
                try {
                    items.add(decode(node, ExternalPatternData.class, type.key()));
                } catch (FrameworkImportException e) {
                    badPatterns.add(e.getMessage());
                }
            }
        }
        if (!badPatterns.isEmpty() || !badRelationships.isEmpty()) {
            log.warn("External framework has {} undecodable pattern(s) and {} undecodable relationship(s)",
                    badPatterns.size(), badRelationships.size());
        }
        return new ExternalFramework(patterns, relationships, badPatterns, badRelationships);
    }

    private JsonNode parse(String json) {
        if (json == null || json.isBlank()) throw new FrameworkImportException("Empty framework document");
        try {
            JsonNode root = mapper.readTree(json);
            if (root == null || !root.isObject()) {
                throw new FrameworkImportException("Framework document must be a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new FrameworkImportException("Malformed framework document", e);
        }
    }

    private <T> T decode(JsonNode node, Class<T> type, String what) {
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new FrameworkImportException("Cannot decode " + what + ": " + rootMessage(e), e);
        } catch (IllegalArgumentException e) {
            throw new FrameworkImportException("Cannot decode " + what + ": " + e.getMessage(), e);
        }
    }

    private static String rootMessage(Throwable t) {
        Throwable cur = t;
        while (cur.getCause() != null && cur.getCause() != cur) cur = cur.getCause();
        return cur.getMessage();
    }

    private JsonNode arrayOrEmpty(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) return mapper.createArrayNode();
        if (!node.isArray()) throw new FrameworkImportException("'" + field + "' must be an array");
        return node;
    }

    private String checksum(JsonNode patterns, JsonNode relationships) {
        try {
            return HashingUtil.xxHash64Hex(mapper.writeValueAsBytes(patterns), mapper.writeValueAsBytes(relationships));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode checksum input", e);
        }
    }

    private static Instant parseInstant(String text) {
        if (text == null) return null;
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable exported_at '{}'", text);
            return null;
        }
    }
}
