package de.mirkosertic.archivesync.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Shared Jackson setup for record meta.
 * <p>
 * Meta is written with keys sorted at every nesting level so that equal meta always
 * serializes to equal bytes.
 */
public final class JsonSupport {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private JsonSupport() {
        // Utility class, no instances
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectNode newObject() {
        return MAPPER.createObjectNode();
    }

    /**
     * Writes meta on a single line with sorted keys.
     */
    public static String toSortedLine(final JsonNode node) throws JsonProcessingException {
        return MAPPER.writeValueAsString(MAPPER.treeToValue(node, Object.class));
    }

    /**
     * Writes meta indented with sorted keys.
     */
    public static byte[] toSortedPrettyBytes(final JsonNode node) throws JsonProcessingException {
        return MAPPER.writerWithDefaultPrettyPrinter()
                .writeValueAsBytes(MAPPER.treeToValue(node, Object.class));
    }

    /**
     * Reads the numeric {@code id} field of meta, or null if there is none.
     */
    public static @Nullable Long idOf(final JsonNode meta) {
        final JsonNode id = meta.get("id");
        if (id == null || !id.canConvertToLong()) {
            return null;
        }
        return id.asLong();
    }

    /**
     * Interprets a timestamp value: a number is taken as epoch seconds, text as ISO-8601.
     *
     * @return the instant, or null if the node is absent, null, out of range or not a timestamp
     */
    public static @Nullable Instant toInstant(final @Nullable JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            final double seconds = value.asDouble();
            if (!Double.isFinite(seconds)
                    || seconds < Instant.MIN.getEpochSecond() || seconds > Instant.MAX.getEpochSecond()) {
                return null;
            }
            final long whole = (long) Math.floor(seconds);
            final long nanos = Math.round((seconds - whole) * 1_000_000_000L);
            try {
                return Instant.ofEpochSecond(whole, nanos);
            } catch (final DateTimeException e) {
                // out of range
                return null;
            }
        }
        if (value.isTextual()) {
            final String text = value.asText();
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (final DateTimeParseException e) {
                // no offset given, read as UTC
                try {
                    return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
                } catch (final DateTimeParseException ignored) {
                    return null;
                }
            }
        }
        return null;
    }
}
