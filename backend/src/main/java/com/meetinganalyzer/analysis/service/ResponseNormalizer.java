package com.meetinganalyzer.analysis.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.meetinganalyzer.analysis.model.CanonicalRecord;
import com.meetinganalyzer.analysis.model.CanonicalSchema;
import com.meetinganalyzer.analysis.model.ExtractionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Component
public class ResponseNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ResponseNormalizer.class);
    private static final Pattern TRAILING_COMMA = Pattern.compile(",\\s*([}\\]])");
    private static final Pattern LANGUAGE_TAG = Pattern.compile("^[A-Za-z0-9_-]*");
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ResponseNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public CanonicalRecord normalize(String rawText, String displayName) {
        ExtractionResult extraction = extract(rawText);
        if (!extraction.hasData()) {
            return CanonicalRecord.empty();
        }
        return applyDerivedFields(coerce(extraction.fields()), displayName);
    }

    public ExtractionResult extract(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return ExtractionResult.noData();
        }
        String text = stripFence(rawText.trim());

        String candidate = balancedObject(text);
        if (candidate == null) {
            log.warn("No balanced JSON object in provider response");
            return ExtractionResult.noData();
        }
        candidate = TRAILING_COMMA.matcher(candidate).replaceAll("$1");

        JsonNode node;
        try {
            node = objectMapper.readTree(candidate);
        } catch (JsonProcessingException first) {
            try {
                node = objectMapper.readTree(candidate.replace('\'', '"'));
            } catch (JsonProcessingException second) {
                log.warn("Provider response is not valid JSON: {}", second.getOriginalMessage());
                return ExtractionResult.noData();
            }
        }

        if (node == null || !node.isObject()) {
            return ExtractionResult.noData();
        }
        return new ExtractionResult(objectMapper.convertValue(node, MAP_TYPE));
    }

    public CanonicalRecord coerce(Map<String, ?> raw) {
        Map<String, String> values = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            Optional<String> field = CanonicalFieldResolver.resolve(entry.getKey());
            if (field.isEmpty()) {
                log.debug("Dropping unknown field '{}'", entry.getKey());
                continue;
            }
            String value = stringify(entry.getValue());
            String existing = values.get(field.get());
            if (existing == null || CanonicalSchema.NOT_AVAILABLE.equals(existing)) {
                values.put(field.get(), value);
            }
        }
        return CanonicalRecord.of(values);
    }

    public CanonicalRecord applyDerivedFields(CanonicalRecord record, String displayName) {
        if (record.isEmpty()) {
            return record;
        }
        CanonicalRecord dated = record;
        if (record.isNotAvailable(CanonicalSchema.DATE)) {
            dated = FilenameDateExtractor.extract(displayName)
                    .map(date -> record.with(CanonicalSchema.DATE, date.format(DateTimeFormatter.ISO_LOCAL_DATE)))
                    .orElse(record);
        }
        return ScoreCalculator.apply(dated);
    }

    String stringify(Object value) {
        if (value == null) {
            return CanonicalSchema.NOT_AVAILABLE;
        }
        String text;
        if (value instanceof String string) {
            text = string;
        } else if (value instanceof Double || value instanceof Float) {
            text = BigDecimal.valueOf(((Number) value).doubleValue()).toPlainString();
        } else if (value instanceof BigDecimal decimal) {
            text = decimal.toPlainString();
        } else if (value instanceof Number || value instanceof Boolean) {
            text = value.toString();
        } else if (value instanceof Collection<?> items && items.stream().allMatch(ResponseNormalizer::isScalar)) {
            text = items.stream()
                    .filter(item -> item != null)
                    .map(this::stringify)
                    .collect(Collectors.joining(", "));
        } else {
            text = toJson(value);
        }
        return text == null || text.isBlank() ? CanonicalSchema.NOT_AVAILABLE : text;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException exception) {
            return String.valueOf(value);
        }
    }

    private static boolean isScalar(Object value) {
        return value == null || value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    private static String stripFence(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        String rest = text.substring(3);
        int newline = rest.indexOf('\n');
        if (newline >= 0 && rest.substring(0, newline).trim().matches("[A-Za-z0-9_-]*")) {
            rest = rest.substring(newline + 1);
        } else {
            rest = LANGUAGE_TAG.matcher(rest).replaceFirst("");
        }
        rest = rest.strip();
        if (rest.endsWith("```")) {
            rest = rest.substring(0, rest.length() - 3);
        }
        return rest.strip();
    }

    static String balancedObject(String text) {
        int start = text.indexOf('{');
        if (start < 0) {
            return null;
        }
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return text.substring(start, i + 1);
                }
            }
        }
        return null;
    }
}
