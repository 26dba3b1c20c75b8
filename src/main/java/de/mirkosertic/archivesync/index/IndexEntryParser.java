package de.mirkosertic.archivesync.index;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.archivesync.model.SourceException;
import de.mirkosertic.archivesync.util.JsonSupport;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses the entries of an archive {@code index.json}.
 * <p>
 * Snapshots written by this project hold one entry per line:
 * <pre>
 * {
 * "1": {"id": 1, ...},
 * "2": {"id": 2, ...}
 * }
 * </pre>
 * Each line is split on its first unescaped colon, so the object as a whole never has to be
 * parsed. Indexes in any other layout are read field by field with a streaming parser, see
 * {@link #isLineLayout(String)} and {@link #parseTrees(List)}. Instances are stateless apart from
 * the codec and may be shared between threads.
 */
public class IndexEntryParser {

    private final ObjectMapper mapper = JsonSupport.mapper();
    private final MetaCodec codec;

    public IndexEntryParser(final MetaCodec codec) {
        this.codec = codec;
    }

    /**
     * Parses a chunk of lines. Structural lines are skipped.
     *
     * @throws SourceException if any line is malformed
     */
    public List<IndexEntry> parseAll(final List<String> lines) {
        final List<IndexEntry> entries = new ArrayList<>(lines.size());
        for (final String line : lines) {
            final IndexEntry entry = parse(line);
            if (entry != null) {
                entries.add(entry);
            }
        }
        return entries;
    }

    /**
     * Parses one line.
     *
     * @return the entry, or null for blank lines and the enclosing braces
     * @throws SourceException if the line is not a well-formed entry
     */
    public @Nullable IndexEntry parse(final String line) {
        final String trimmed = line.strip();
        if (trimmed.isEmpty() || "{".equals(trimmed) || "}".equals(trimmed)) {
            return null;
        }

        final int split = firstUnescapedColon(trimmed);
        if (split < 0) {
            throw new SourceException("Index line has no key separator: " + abbreviate(trimmed));
        }

        final String rawKey = trim(trimmed.substring(0, split), " \t\"");
        final String fragment = trim(trimmed.substring(split + 1), " \t,");

        final long key = parseKey(rawKey);
        if (!fragment.startsWith("{") || !fragment.endsWith("}")) {
            throw new SourceException("Malformed index entry for key " + key + ": not a JSON object");
        }

        final JsonNode node;
        try {
            node = mapper.readTree(fragment);
        } catch (final JsonProcessingException e) {
            throw new SourceException("Malformed index entry for key " + key + ": " + e.getOriginalMessage(), e);
        }
        return entry(key, node);
    }

    /**
     * Validates and encodes entries that a streaming parser has already read.
     *
     * @param fields pairs of raw key and meta tree
     * @throws SourceException if a key is not numeric or a value is not an object
     */
    public List<IndexEntry> parseTrees(final List<Map.Entry<String, JsonNode>> fields) {
        final List<IndexEntry> entries = new ArrayList<>(fields.size());
        for (final Map.Entry<String, JsonNode> field : fields) {
            entries.add(entry(parseKey(field.getKey()), field.getValue()));
        }
        return entries;
    }

    private IndexEntry entry(final long key, final JsonNode node) {
        if (!(node instanceof ObjectNode)) {
            throw new SourceException("Malformed index entry for key " + key + ": not a JSON object");
        }
        try {
            return new IndexEntry(key, codec.encode((ObjectNode) node));
        } catch (final IOException e) {
            throw new SourceException("Could not encode index entry for key " + key, e);
        }
    }

    private static long parseKey(final String rawKey) {
        final long key;
        try {
            key = Long.parseLong(rawKey);
        } catch (final NumberFormatException e) {
            throw new SourceException("Index contains a non-numeric key: " + abbreviate(rawKey), e);
        }
        if (key < 0) {
            throw new SourceException("Index contains a negative key: " + key);
        }
        return key;
    }

    /**
     * Tells from the beginning of an index whether it holds one entry per line.
     * <p>
     * That is the case when the first line is the opening brace alone and the next line is either
     * the closing brace or a complete entry. A line cut off by the end of {@code head} only needs
     * to start like an entry.
     */
    public static boolean isLineLayout(final String head) {
        final String[] lines = head.split("\n", -1);
        int index = nextContentLine(lines, 0);
        if (index >= lines.length || !"{".equals(lines[index].strip())) {
            return false;
        }
        index = nextContentLine(lines, index + 1);
        if (index >= lines.length) {
            return true;
        }

        final String line = lines[index].strip();
        if ("}".equals(line)) {
            return true;
        }
        final int split = firstUnescapedColon(line);
        if (split < 0) {
            return index == lines.length - 1;
        }
        final String rawKey = trim(line.substring(0, split), " \t\"");
        if (rawKey.isEmpty() || !rawKey.chars().allMatch(c -> c >= '0' && c <= '9')) {
            return false;
        }
        final String fragment = trim(line.substring(split + 1), " \t,");
        final boolean complete = index < lines.length - 1;
        return fragment.startsWith("{") && (!complete || fragment.endsWith("}"));
    }

    private static int nextContentLine(final String[] lines, final int from) {
        int index = from;
        while (index < lines.length && lines[index].isBlank()) {
            index++;
        }
        return index;
    }

    static int firstUnescapedColon(final String text) {
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == ':') {
                return i;
            }
        }
        return -1;
    }

    private static String trim(final String value, final String characters) {
        int start = 0;
        int end = value.length();
        while (start < end && characters.indexOf(value.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && characters.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(start, end);
    }

    private static String abbreviate(final String value) {
        return value.length() <= 40 ? value : value.substring(0, 40) + "...";
    }
}
