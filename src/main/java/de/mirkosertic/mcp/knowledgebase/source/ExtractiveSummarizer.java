package de.mirkosertic.mcp.knowledgebase.source;

import de.mirkosertic.mcp.knowledgebase.util.ContentNormalizer;

import java.util.regex.Pattern;

/**
 * Deterministic {@link Summarizer} that keeps the leading sentences of a source up to a
 * character limit. Used when no language model backed summarizer is configured.
 */
public class ExtractiveSummarizer implements Summarizer {

    private static final Pattern MARKUP_PREFIX = Pattern.compile("(?m)^\\s*(#{1,6}|[-*+>]|\\d+\\.)\\s+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");
    private static final String ELLIPSIS = "...";

    private final int maxChars;

    public ExtractiveSummarizer(final int maxChars) {
        if (maxChars < 20) {
            throw new IllegalArgumentException("maxChars must be at least 20, was " + maxChars);
        }
        this.maxChars = maxChars;
    }

    @Override
    public String summarize(final String sourceId, final String text) throws SummarizationException {
        final String plain = WHITESPACE.matcher(
                MARKUP_PREFIX.matcher(ContentNormalizer.normalize(text)).replaceAll("")).replaceAll(" ").strip();
        if (plain.isEmpty()) {
            throw new SummarizationException("Source " + sourceId + " contains no text");
        }
        if (plain.length() <= maxChars) {
            return plain;
        }

        final StringBuilder summary = new StringBuilder();
        for (final String sentence : SENTENCE_END.split(plain)) {
            final int needed = summary.isEmpty() ? sentence.length() : sentence.length() + 1;
            if (summary.length() + needed > maxChars) {
                break;
            }
            if (!summary.isEmpty()) {
                summary.append(' ');
            }
            summary.append(sentence);
        }
        if (!summary.isEmpty()) {
            return summary.toString();
        }

        // The first sentence alone is too long, cut it at a word boundary
        final int limit = maxChars - ELLIPSIS.length();
        int cut = plain.lastIndexOf(' ', limit);
        if (cut <= 0) {
            cut = limit;
        }
        return plain.substring(0, cut).stripTrailing() + ELLIPSIS;
    }
}
