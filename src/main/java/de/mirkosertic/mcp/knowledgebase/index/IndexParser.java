package de.mirkosertic.mcp.knowledgebase.index;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads index text back into entries. Blocks are separated by a blank line; the first
 * line of a block is the source identifier and the remaining lines its description.
 */
public final class IndexParser {

    private IndexParser() {
    }

    public static List<IndexEntry> parse(final String indexText) {
        final List<IndexEntry> entries = new ArrayList<>();
        if (indexText == null || indexText.isBlank()) {
            return entries;
        }

        final String unified = indexText.replace("\r\n", "\n").strip();
        for (final String block : unified.split("\n\\s*\n")) {
            final String trimmed = block.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            final int newline = trimmed.indexOf('\n');
            if (newline < 0) {
                entries.add(new IndexEntry(trimmed, ""));
            } else {
                entries.add(new IndexEntry(trimmed.substring(0, newline).strip(),
                        trimmed.substring(newline + 1).strip()));
            }
        }
        return entries;
    }
}
