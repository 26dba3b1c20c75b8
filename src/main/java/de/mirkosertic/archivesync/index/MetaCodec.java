package de.mirkosertic.archivesync.index;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.archivesync.model.SourceException;
import de.mirkosertic.archivesync.util.JsonSupport;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.InflaterInputStream;

/**
 * Re-encodes meta into compact JSON bytes, optionally deflated. Thread-safe.
 */
public class MetaCodec {

    private final ObjectMapper mapper = JsonSupport.mapper();
    private final boolean compress;

    public MetaCodec(final boolean compress) {
        this.compress = compress;
    }

    public boolean isCompressing() {
        return compress;
    }

    public byte[] encode(final ObjectNode meta) throws IOException {
        final byte[] plain = mapper.writeValueAsBytes(meta);
        if (!compress) {
            return plain;
        }

        final ByteArrayOutputStream buffer = new ByteArrayOutputStream(plain.length / 2 + 16);
        final Deflater deflater = new Deflater(Deflater.BEST_SPEED);
        try (final DeflaterOutputStream out = new DeflaterOutputStream(buffer, deflater)) {
            out.write(plain);
        } finally {
            deflater.end();
        }
        return buffer.toByteArray();
    }

    /**
     * Decodes meta. Every call returns a fresh tree.
     *
     * @throws SourceException if the bytes do not hold a JSON object
     */
    public ObjectNode decode(final long key, final byte[] encoded) {
        try {
            final JsonNode node;
            if (compress) {
                try (final InputStream in = new InflaterInputStream(new ByteArrayInputStream(encoded))) {
                    node = mapper.readTree(in);
                }
            } else {
                node = mapper.readTree(encoded);
            }
            if (!(node instanceof ObjectNode)) {
                throw new SourceException("Stored meta for key " + key + " is not an object");
            }
            return (ObjectNode) node;
        } catch (final IOException e) {
            throw new SourceException("Stored meta for key " + key + " is corrupt", e);
        }
    }
}
