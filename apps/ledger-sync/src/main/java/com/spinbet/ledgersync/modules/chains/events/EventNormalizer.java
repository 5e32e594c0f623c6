package com.spinbet.ledgersync.modules.chains.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.spinbet.ledgersync.modules.chains.model.NormalizedContractEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Decodes Soroban RPC events into {@link NormalizedContractEvent} objects.
 *
 * <p>Topics and value arrive as ScVal JSON ({@code xdrFormat=json}). A value that cannot be decoded is
 * kept as its raw string form instead of failing the page.
 */
@Component
public class EventNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(EventNormalizer.class);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;
    private static final BigInteger TWO_POW_64 = BigInteger.ONE.shiftLeft(64);

    private final ObjectMapper objectMapper;

    public EventNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Normalize one raw RPC event.
     *
     * @param rawEvent   event object from the getEvents result
     * @param pageCursor cursor returned with the page
     * @throws EventDecodeException when the event carries no id
     */
    public NormalizedContractEvent normalize(JsonNode rawEvent, String pageCursor) {
        String id = textOrNull(rawEvent, "id");
        if (id == null || id.isBlank()) {
            throw new EventDecodeException("Event without id (ledger=" + rawEvent.path("ledger").asText()
                    + ", txHash=" + textOrNull(rawEvent, "txHash") + ")");
        }

        List<String> topics = new ArrayList<>();
        if (rawEvent.path("topicJson").isArray()) {
            for (JsonNode topic : rawEvent.get("topicJson")) {
                topics.add(stringifyTopic(decodeOrRaw(topic)));
            }
        } else if (rawEvent.path("topic").isArray()) {
            for (JsonNode topic : rawEvent.get("topic")) {
                topics.add(stringifyTopic(topic));
            }
        }

        JsonNode value;
        if (rawEvent.has("valueJson")) {
            value = decodeOrRaw(rawEvent.get("valueJson"));
        } else {
            value = rawEvent.path("value");
        }

        return NormalizedContractEvent.builder()
                .id(id)
                .cursor(pageCursor)
                .ledger(rawEvent.path("ledger").asLong())
                .txHash(textOrNull(rawEvent, "txHash"))
                .contractId(textOrNull(rawEvent, "contractId"))
                .topics(topics)
                .payload(toPayloadObject(value))
                .ledgerClosedAt(parseClosedAt(textOrNull(rawEvent, "ledgerClosedAt")))
                .build();
    }

    /**
     * Decode an ScVal, falling back to its raw string representation.
     */
    JsonNode decodeOrRaw(JsonNode scVal) {
        try {
            return decodeScVal(scVal);
        } catch (EventDecodeException e) {
            logger.debug("Keeping undecodable ScVal as raw text: {}", e.getMessage());
            if (scVal == null || scVal.isNull() || scVal.isMissingNode()) {
                return NODES.nullNode();
            }
            return NODES.textNode(scVal.isTextual() ? scVal.asText() : scVal.toString());
        }
    }

    /**
     * Decode an ScVal JSON value into a plain JSON value.
     */
    JsonNode decodeScVal(JsonNode scVal) {
        if (scVal == null || scVal.isNull() || scVal.isMissingNode()) {
            return NODES.nullNode();
        }
        if (scVal.isTextual()) {
            if ("void".equals(scVal.asText())) {
                return NODES.nullNode();
            }
            throw new EventDecodeException("Unsupported ScVal variant: " + scVal.asText());
        }
        if (!scVal.isObject() || scVal.size() != 1) {
            throw new EventDecodeException("Malformed ScVal: " + scVal);
        }

        Map.Entry<String, JsonNode> entry = scVal.fields().next();
        String tag = entry.getKey();
        JsonNode body = entry.getValue();

        return switch (tag) {
            case "bool" -> {
                if (!body.isBoolean()) {
                    throw new EventDecodeException("bool ScVal without boolean body");
                }
                yield NODES.booleanNode(body.booleanValue());
            }
            case "void" -> NODES.nullNode();
            case "u32" -> NODES.numberNode(toExact(tag, body, 0L, 0xFFFF_FFFFL));
            case "i32" -> NODES.numberNode((int) toExact(tag, body, Integer.MIN_VALUE, Integer.MAX_VALUE));
            case "u64", "i64", "u128", "i128", "u256", "i256", "timepoint", "duration" ->
                    NODES.textNode(parseInteger(tag, body).toString());
            case "symbol", "string", "address", "bytes" -> {
                if (!body.isTextual()) {
                    throw new EventDecodeException(tag + " ScVal without text body");
                }
                yield NODES.textNode(body.asText());
            }
            case "vec" -> decodeVec(body);
            case "map" -> decodeMap(body);
            default -> throw new EventDecodeException("Unsupported ScVal type: " + tag);
        };
    }

    private ArrayNode decodeVec(JsonNode body) {
        ArrayNode items = NODES.arrayNode();
        if (body == null || body.isNull()) {
            return items;
        }
        if (!body.isArray()) {
            throw new EventDecodeException("vec ScVal without array body");
        }
        for (JsonNode item : body) {
            items.add(decodeScVal(item));
        }
        return items;
    }

    private ObjectNode decodeMap(JsonNode body) {
        ObjectNode result = NODES.objectNode();
        if (body == null || body.isNull()) {
            return result;
        }
        if (!body.isArray()) {
            throw new EventDecodeException("map ScVal without entry array");
        }
        for (JsonNode mapEntry : body) {
            JsonNode key = decodeScVal(mapEntry.get("key"));
            JsonNode val = decodeScVal(mapEntry.get("val"));
            result.set(stringifyTopic(key), val);
        }
        return result;
    }

    private long toExact(String tag, JsonNode body, long min, long max) {
        long value;
        try {
            value = parseInteger(tag, body).longValueExact();
        } catch (ArithmeticException e) {
            throw new EventDecodeException("Out of range " + tag + " ScVal: " + body, e);
        }
        if (value < min || value > max) {
            throw new EventDecodeException("Out of range " + tag + " ScVal: " + body);
        }
        return value;
    }

    private BigInteger parseInteger(String tag, JsonNode body) {
        try {
            if (body.isNumber() || body.isTextual()) {
                return new BigInteger(body.asText().trim());
            }
            if (body.isObject() && body.has("hi") && body.has("lo")) {
                BigInteger hi = new BigInteger(body.get("hi").asText());
                BigInteger lo = new BigInteger(body.get("lo").asText());
                return hi.multiply(TWO_POW_64).add(lo);
            }
            if (body.isObject() && body.has("hi_hi")) {
                BigInteger result = BigInteger.ZERO;
                for (String part : List.of("hi_hi", "hi_lo", "lo_hi", "lo_lo")) {
                    result = result.multiply(TWO_POW_64).add(new BigInteger(body.path(part).asText("0")));
                }
                return result;
            }
        } catch (NumberFormatException | ArithmeticException e) {
            throw new EventDecodeException("Invalid " + tag + " ScVal: " + body, e);
        }
        throw new EventDecodeException("Invalid " + tag + " ScVal: " + body);
    }

    /**
     * Flatten a decoded value into a topic string.
     */
    String stringifyTopic(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return "unknown";
        }
        if (value.isTextual() || value.isNumber() || value.isBoolean()) {
            return value.asText();
        }
        if (value.isArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonNode item : value) {
                parts.add(stringifyTopic(item));
            }
            return String.join(":", parts);
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            return "[object]";
        }
    }

    private ObjectNode toPayloadObject(JsonNode value) {
        if (value != null && value.isObject()) {
            return (ObjectNode) value;
        }
        ObjectNode payload = NODES.objectNode();
        if (value != null && value.isArray()) {
            payload.set("items", value);
        } else {
            payload.set("value", value == null || value.isMissingNode() ? NODES.nullNode() : value);
        }
        return payload;
    }

    private LocalDateTime parseClosedAt(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.ofInstant(Instant.parse(value), ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            logger.debug("Unparseable ledgerClosedAt: {}", value);
            return null;
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
