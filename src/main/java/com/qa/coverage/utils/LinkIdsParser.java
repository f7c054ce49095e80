package com.qa.coverage.utils;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Reads id lists stored in the JSON metadata of test cases. Bad JSON never fails a
 * dashboard query: it yields an empty set and a warning.
 */
public final class LinkIdsParser {

    private static final Logger logger = LoggerFactory.getLogger(LinkIdsParser.class);

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private LinkIdsParser() {
    }

    /**
     * Reads one array field (e.g. {@code requirementIds}) out of a metadata object. Snake case
     * keys written by older clients are accepted too. Returns null when the field is absent.
     */
    public static Set<Long> parseMetadataField(String metadataJson, String field, String context) {
        if (StringUtils.isBlank(metadataJson)) {
            return null;
        }
        try {
            Map<String, JsonNode> metadata = objectMapper.readValue(metadataJson,
                    new TypeReference<Map<String, JsonNode>>() {
                    });
            JsonNode node = metadata.get(field);
            if (node == null) {
                node = metadata.get(toSnakeCase(field));
            }
            if (node == null || node.isNull()) {
                return null;
            }
            if (!node.isArray()) {
                logger.warn("Metadata field '{}' of {} is not an array", field, context);
                return Collections.emptySet();
            }
            List<Object> raw = objectMapper.convertValue(node, new TypeReference<List<Object>>() {
            });
            return toIds(raw, context);
        } catch (Exception e) {
            logger.warn("Ignoring unreadable metadata for {}: {}", context, e.getMessage());
            return Collections.emptySet();
        }
    }

    private static Set<Long> toIds(List<Object> raw, String context) {
        Set<Long> ids = new LinkedHashSet<>();
        for (Object value : raw) {
            if (value instanceof Number) {
                ids.add(((Number) value).longValue());
            } else if (value != null && StringUtils.isNumeric(Objects.toString(value).trim())) {
                ids.add(Long.parseLong(Objects.toString(value).trim()));
            } else {
                logger.warn("Skipping non-numeric id '{}' in {}", value, context);
            }
        }
        return ids;
    }

    private static String toSnakeCase(String camel) {
        return camel.replaceAll("([a-z])([A-Z])", "$1_$2").toLowerCase(Locale.ROOT);
    }
}
