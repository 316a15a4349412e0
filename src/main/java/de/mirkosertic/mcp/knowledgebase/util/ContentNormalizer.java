package de.mirkosertic.mcp.knowledgebase.util;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Brings source text into the canonical form that content hashes are computed over.
 *
 * <p>Steps applied in order:</p>
 * <ol>
 *   <li>Byte order mark removal (U+FEFF at the very start).</li>
 *   <li>Line ending unification: {@code \r\n} and lone {@code \r} become {@code \n}.</li>
 *   <li>NFC Unicode normalization, so composed and decomposed forms hash identically.</li>
 *   <li>Trailing whitespace is stripped from every line.</li>
 *   <li>Leading and trailing blank lines are dropped.</li>
 * </ol>
 *
 * <p>Two texts that differ only in these aspects normalize to the same string and
 * therefore to the same {@link ContentHasher#hash(String) digest}.</p>
 */
public final class ContentNormalizer {

    private static final Pattern LINE_ENDINGS = Pattern.compile("\r\n?");

    private ContentNormalizer() {
        // Utility class, no instances
    }

    /**
     * Normalize text for hashing.
     *
     * @param text the raw decoded text (may be null)
     * @return the normalized text, empty for null or blank input
     */
    public static String normalize(final String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String result = text;
        if (result.charAt(0) == '\uFEFF') {
            result = result.substring(1);
        }

        result = LINE_ENDINGS.matcher(result).replaceAll("\n");
        result = Normalizer.normalize(result, Normalizer.Form.NFC);

        final String[] lines = result.split("\n", -1);
        final List<String> stripped = new ArrayList<>(lines.length);
        for (final String line : lines) {
            stripped.add(line.stripTrailing());
        }

        int start = 0;
        while (start < stripped.size() && stripped.get(start).isEmpty()) {
            start++;
        }
        int end = stripped.size();
        while (end > start && stripped.get(end - 1).isEmpty()) {
            end--;
        }

        return String.join("\n", stripped.subList(start, end));
    }
}
