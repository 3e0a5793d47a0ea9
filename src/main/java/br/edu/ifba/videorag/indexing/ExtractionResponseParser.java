package br.edu.ifba.videorag.indexing;

import br.edu.ifba.videorag.core.Entity;
import br.edu.ifba.videorag.indexing.ExtractionResult.ExtractedEntity;
import br.edu.ifba.videorag.indexing.ExtractionResult.ExtractedRelationship;
import br.edu.ifba.videorag.utils.JsonUtil;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses the JSON extraction document returned by the LLM.
 *
 * <p>A response that is not a JSON object fails the whole chunk. Individual entities or
 * relationships missing a required field are logged and skipped. Ids are normalized with
 * {@link Entity#normalizeId(String)}; an entity repeated within one response keeps its last
 * description.</p>
 */
public class ExtractionResponseParser {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionResponseParser.class);

    @NotNull
    public ExtractionResult parse(@NotNull String chunkId, @NotNull String response) {
        final JsonNode root;
        try {
            root = JsonUtil.readModelJson(response);
        } catch (JsonProcessingException e) {
            throw new ExtractionParseException("Extraction response for " + chunkId + " is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ExtractionParseException("Extraction response for " + chunkId + " is not a JSON object");
        }

        final Map<String, ExtractedEntity> entities = new LinkedHashMap<>();
        for (JsonNode node : root.path("entities")) {
            final String entityId = Entity.normalizeId(text(node, "entity_id"));
            final String description = text(node, "description");
            if (entityId.isEmpty() || description.isEmpty()) {
                logger.warn("Skipping malformed entity in {}: {}", chunkId, node);
                continue;
            }
            final String label = text(node, "label");
            entities.put(entityId, new ExtractedEntity(entityId, label.isEmpty() ? entityId : label, description));
        }

        final List<ExtractedRelationship> relationships = new ArrayList<>();
        for (JsonNode node : root.path("relationships")) {
            final String sourceId = Entity.normalizeId(text(node, "source_id"));
            final String targetId = Entity.normalizeId(text(node, "target_id"));
            final String type = normalizeType(text(node, "type"));
            if (sourceId.isEmpty() || targetId.isEmpty() || type.isEmpty()) {
                logger.warn("Skipping malformed relationship in {}: {}", chunkId, node);
                continue;
            }
            relationships.add(new ExtractedRelationship(sourceId, targetId, type, text(node, "description")));
        }

        return new ExtractionResult(List.copyOf(entities.values()), List.copyOf(relationships));
    }

    private static String text(JsonNode node, String field) {
        final JsonNode value = node.get(field);
        return value != null && value.isValueNode() ? value.asText("").strip() : "";
    }

    private static String normalizeType(String type) {
        return type.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]+", "_").replaceAll("^_+|_+$", "");
    }
}
