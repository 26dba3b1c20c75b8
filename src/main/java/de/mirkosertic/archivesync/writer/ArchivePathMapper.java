package de.mirkosertic.archivesync.writer;

import com.fasterxml.jackson.databind.JsonNode;
import de.mirkosertic.archivesync.model.DataFormat;
import de.mirkosertic.archivesync.util.Slugs;
import org.jspecify.annotations.Nullable;

/**
 * Derives the container path of a record payload from its meta.
 * <p>
 * Paths look like {@code epub/t/twilight_sparkle-42/a_title-1234.epub}: payloads are grouped by
 * format, then by the first character of the author slug, then by author. Key and author id make
 * the path unique even when titles or author names collide.
 */
public class ArchivePathMapper {

    public String map(final long key, final JsonNode meta, final DataFormat format) {
        final JsonNode author = meta.path("author");
        final String authorSlug = Slugs.slugify(textOf(author.get("name")));
        final String authorId = textOf(author.get("id"));
        final String titleSlug = Slugs.slugify(textOf(meta.get("title")));

        final StringBuilder path = new StringBuilder();
        path.append(format.extension()).append('/');
        path.append(Slugs.groupOf(authorSlug)).append('/');
        path.append(authorSlug);
        if (authorId != null && !authorId.isEmpty()) {
            path.append('-').append(Slugs.slugify(authorId));
        }
        path.append('/');
        path.append(titleSlug).append('-').append(key);
        path.append('.').append(format.extension());
        return path.toString();
    }

    private static @Nullable String textOf(final @Nullable JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }
}
