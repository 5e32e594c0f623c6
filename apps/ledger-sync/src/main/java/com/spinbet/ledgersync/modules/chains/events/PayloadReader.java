package com.spinbet.ledgersync.modules.chains.events;

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Reads logical fields from a decoded event payload.
 *
 * <p>Each field is looked up through an ordered list of accepted key aliases; the first key holding a
 * non-null value wins. Coercions never throw: a value of the wrong shape reads as empty.
 */
public final class PayloadReader {

    private static final Set<String> TRUE_WORDS = Set.of("true", "1", "yes", "win", "won");
    private static final Set<String> FALSE_WORDS = Set.of("false", "0", "no", "loss", "lost");

    private PayloadReader() {
    }

    public static Optional<JsonNode> readValue(JsonNode payload, List<String> keys) {
        if (payload == null || !payload.isObject()) {
            return Optional.empty();
        }
        for (String key : keys) {
            JsonNode value = payload.get(key);
            if (value != null && !value.isNull() && !value.isMissingNode()) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public static Optional<String> readString(JsonNode payload, List<String> keys) {
        return readValue(payload, keys).flatMap(PayloadReader::asString);
    }

    public static Optional<BigDecimal> readNumber(JsonNode payload, List<String> keys) {
        return readValue(payload, keys).flatMap(PayloadReader::asNumber);
    }

    public static Optional<Boolean> readBoolean(JsonNode payload, List<String> keys) {
        return readValue(payload, keys).flatMap(PayloadReader::asBool);
    }

    public static Optional<String> asString(JsonNode value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value.isTextual()) {
            return Optional.of(value.asText());
        }
        if (value.isNumber() || value.isBoolean()) {
            return Optional.of(value.asText());
        }
        return Optional.empty();
    }

    public static Optional<BigDecimal> asNumber(JsonNode value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value.isNumber()) {
            return Optional.of(value.decimalValue());
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            if (text.isEmpty()) {
                return Optional.empty();
            }
            try {
                return Optional.of(new BigDecimal(text));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public static Optional<Boolean> asBool(JsonNode value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value.isBoolean()) {
            return Optional.of(value.booleanValue());
        }
        if (value.isTextual()) {
            String normalized = value.asText().trim().toLowerCase(Locale.ROOT);
            if (TRUE_WORDS.contains(normalized)) {
                return Optional.of(Boolean.TRUE);
            }
            if (FALSE_WORDS.contains(normalized)) {
                return Optional.of(Boolean.FALSE);
            }
        }
        return Optional.empty();
    }
}
