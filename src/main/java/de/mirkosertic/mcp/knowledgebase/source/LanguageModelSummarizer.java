package de.mirkosertic.mcp.knowledgebase.source;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link Summarizer} backed by a chat model. The configured prompt goes in as system
 * message, the source text as the single user message.
 */
public class LanguageModelSummarizer implements Summarizer {

    private static final Logger logger = LoggerFactory.getLogger(LanguageModelSummarizer.class);

    private final ChatLanguageModel chatModel;
    private final String systemPrompt;

    public LanguageModelSummarizer(final ChatLanguageModel chatModel, final String systemPrompt) {
        this.chatModel = chatModel;
        this.systemPrompt = systemPrompt;
    }

    /**
     * Chat model for an OpenAI compatible chat completions endpoint, at temperature 0 so
     * that unchanged input tends to produce the same summary.
     */
    public static ChatLanguageModel openAiChatModel(final String baseUrl, final String apiKey, final String modelName,
                                                    final Duration timeout) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("An API key is required for the openai summarizer");
        }
        // A null base URL selects the public OpenAI endpoint
        return OpenAiChatModel.builder()
                .baseUrl(baseUrl == null || baseUrl.isBlank() ? null : baseUrl)
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(0.0)
                .timeout(timeout)
                .maxRetries(0)
                .build();
    }

    @Override
    public String summarize(final String sourceId, final String text) throws SummarizationException {
        if (text.isBlank()) {
            throw new SummarizationException("Source " + sourceId + " contains no text");
        }

        final List<ChatMessage> messages = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(SystemMessage.from(systemPrompt));
        }
        messages.add(UserMessage.from(text));

        final Response<AiMessage> response;
        try {
            response = chatModel.generate(messages);
        } catch (final RuntimeException e) {
            logger.debug("Chat model call for {} failed", sourceId, e);
            throw new SummarizationException("Chat model call failed for " + sourceId + ": " + e.getMessage(), e);
        }

        final String summary = response == null || response.content() == null ? null : response.content().text();
        if (summary == null || summary.isBlank()) {
            throw new SummarizationException("Chat model returned an empty summary for " + sourceId);
        }
        return summary.strip();
    }
}
