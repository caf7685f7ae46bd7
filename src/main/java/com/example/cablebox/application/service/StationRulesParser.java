package com.example.cablebox.application.service;

import com.example.cablebox.common.exception.BusinessException;
import com.example.cablebox.common.exception.StationErrorCodes;
import com.example.cablebox.common.util.TextNormalizer;
import com.example.cablebox.domain.model.StationRules;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import javax.validation.ConstraintViolation;
import javax.validation.Validator;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Reads a station's stored rules JSON into {@link StationRules}.
 * <p>
 * Older stations were saved with different key names ({@code genresInclude},
 * flat {@code yearMin}/{@code yearMax}, {@code avoidSameArtistWithinTracks}, ...);
 * those are mapped onto the current names before binding. Name lists come
 * back trimmed, whitespace-collapsed and de-duplicated.
 */
@Component
public class StationRulesParser {

    private static final Map<String, String> LEGACY_LIST_KEYS = new LinkedHashMap<>();

    static {
        LEGACY_LIST_KEYS.put("genresInclude", "includeGenres");
        LEGACY_LIST_KEYS.put("genresExclude", "excludeGenres");
        LEGACY_LIST_KEYS.put("artistsInclude", "includeArtists");
        LEGACY_LIST_KEYS.put("artistsExclude", "excludeArtists");
        LEGACY_LIST_KEYS.put("albumsInclude", "includeAlbums");
        LEGACY_LIST_KEYS.put("albumsExclude", "excludeAlbums");
        LEGACY_LIST_KEYS.put("avoidSameArtistWithinTracks", "artistSeparation");
    }

    // Primitive-backed fields: an explicit null falls back to the field default.
    private static final List<String> DEFAULTED_KEYS = Arrays.asList(
            "avoidRepeatHours", "artistSeparation", "tuneInEnabled", "tuneInMaxFraction",
            "tuneInMinHeadSec", "tuneInMinTailSec", "tuneInProbability");

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public StationRulesParser(ObjectMapper objectMapper, Validator validator) {
        this.objectMapper = objectMapper.copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.validator = validator;
    }

    public StationRules parse(String rulesJson) {
        if (!StringUtils.hasText(rulesJson)) {
            return normalize(new StationRules());
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(rulesJson);
        } catch (JsonProcessingException e) {
            throw new BusinessException(StationErrorCodes.STATION_RULES_INVALID,
                    "Station rules are not valid JSON", "Edit and save the station again", e);
        }
        if (root == null || root.isNull()) {
            return normalize(new StationRules());
        }
        if (!root.isObject()) {
            throw new BusinessException(StationErrorCodes.STATION_RULES_INVALID,
                    "Station rules must be a JSON object", "Edit and save the station again");
        }

        ObjectNode node = migrateLegacyKeys((ObjectNode) root);
        StationRules rules;
        try {
            rules = objectMapper.treeToValue(node, StationRules.class);
        } catch (JsonProcessingException e) {
            throw new BusinessException(StationErrorCodes.STATION_RULES_INVALID,
                    "Station rules have an unexpected shape: " + e.getOriginalMessage(),
                    "Edit and save the station again", e);
        }
        return validate(normalize(rules));
    }

    /**
     * Check a rule set built in code (for example a preview request).
     */
    public StationRules validate(StationRules rules) {
        Set<ConstraintViolation<StationRules>> violations = validator.validate(rules);
        if (!violations.isEmpty()) {
            String message = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining("; "));
            throw new BusinessException(StationErrorCodes.STATION_RULES_INVALID,
                    "Invalid station rules: " + message, "Edit and save the station again");
        }
        return rules;
    }

    static StationRules normalize(StationRules rules) {
        rules.setIncludeGenres(TextNormalizer.distinctDisplayValues(rules.getIncludeGenres()));
        rules.setExcludeGenres(TextNormalizer.distinctDisplayValues(rules.getExcludeGenres()));
        rules.setIncludeArtists(TextNormalizer.distinctDisplayValues(rules.getIncludeArtists()));
        rules.setExcludeArtists(TextNormalizer.distinctDisplayValues(rules.getExcludeArtists()));
        rules.setIncludeAlbums(TextNormalizer.distinctDisplayValues(rules.getIncludeAlbums()));
        rules.setExcludeAlbums(TextNormalizer.distinctDisplayValues(rules.getExcludeAlbums()));
        return rules;
    }

    private ObjectNode migrateLegacyKeys(ObjectNode source) {
        ObjectNode node = source.deepCopy();
        for (Map.Entry<String, String> alias : LEGACY_LIST_KEYS.entrySet()) {
            JsonNode legacy = node.remove(alias.getKey());
            if (isPresent(legacy) && !node.hasNonNull(alias.getValue())) {
                node.set(alias.getValue(), legacy);
            }
        }
        for (String key : DEFAULTED_KEYS) {
            if (node.has(key) && node.get(key).isNull()) {
                node.remove(key);
            }
        }

        JsonNode yearMin = node.remove("yearMin");
        JsonNode yearMax = node.remove("yearMax");
        if (!node.hasNonNull("yearRange") && (isPresent(yearMin) || isPresent(yearMax))) {
            ObjectNode range = node.putObject("yearRange");
            copyIfPresent(range, "min", yearMin);
            copyIfPresent(range, "max", yearMax);
        }

        JsonNode durationMin = node.remove("durationMinSec");
        JsonNode durationMax = node.remove("durationMaxSec");
        if (!node.hasNonNull("durationRange") && (isPresent(durationMin) || isPresent(durationMax))) {
            ObjectNode range = node.putObject("durationRange");
            copyIfPresent(range, "minSec", durationMin);
            copyIfPresent(range, "maxSec", durationMax);
        }
        return node;
    }

    private static boolean isPresent(JsonNode value) {
        return value != null && !value.isNull();
    }

    private static void copyIfPresent(ObjectNode target, String field, JsonNode value) {
        if (isPresent(value)) {
            target.set(field, value);
        }
    }
}
