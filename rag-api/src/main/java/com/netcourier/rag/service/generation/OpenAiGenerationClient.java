package com.netcourier.rag.service.generation;

import com.netcourier.rag.config.RagProperties;
import com.netcourier.rag.service.generation.openai.OpenAiChatClient;
import com.netcourier.rag.service.generation.openai.OpenAiChatException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

@Component
@ConditionalOnProperty(prefix = "rag.generation", name = "provider", havingValue = "openai", matchIfMissing = true)
public class OpenAiGenerationClient implements GenerationClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiGenerationClient.class);

    static final String SYSTEM_PROMPT = """
            You are an assistant that answers questions using ONLY the context you are given.

            Rules:
            1. Answer only from the context.
            2. If the context holds nothing relevant, say "I could not find relevant information in the documents."
            3. Mention the source when you can.
            4. Be brief and precise.
            5. Answer in the language of the question.""";

    private final OpenAiChatClient chatClient;
    private final RagProperties.Generation settings;

    public OpenAiGenerationClient(OpenAiChatClient chatClient, RagProperties properties) {
        this.chatClient = chatClient;
        this.settings = properties.generation();
    }

    @Override
    public GenerationResponse generate(GenerationRequest request) {
        List<OpenAiChatClient.Message> messages = List.of(
                new OpenAiChatClient.Message("system", SYSTEM_PROMPT),
                new OpenAiChatClient.Message("user", userPrompt(request)));
        OpenAiChatClient.ChatCompletionResponse response;
        try {
            response = chatClient.complete(new OpenAiChatClient.Request(
                    settings.model(), messages, settings.temperature(), settings.maxOutputTokens()));
        } catch (OpenAiChatException ex) {
            throw new GenerationFailureException(ex.getMessage(), ex, ex.isTransient());
        }
        OpenAiChatClient.Choice choice = response == null ? null : response.firstChoice();
        if (choice == null || choice.message() == null || choice.message().content() == null
                || choice.message().content().isBlank()) {
            log.warn("Chat completion returned no content");
            throw new GenerationFailureException("Model returned an empty answer");
        }
        int tokens = response.usage() == null ? 0 : response.usage().totalTokens();
        return new GenerationResponse(choice.message().content().trim(), tokens);
    }

    String userPrompt(GenerationRequest request) {
        StringBuilder builder = new StringBuilder("Context from the document collection:\n---\n");
        if (request.context().isEmpty()) {
            builder.append("(no relevant passages were found)\n");
        }
        for (int i = 0; i < request.context().size(); i++) {
            ContextPassage passage = request.context().get(i);
            builder.append(String.format(Locale.ROOT, "[%d] (document %s, relevance %.2f)%n",
                            i + 1, passage.documentId(), passage.score()))
                    .append(passage.text())
                    .append("\n\n");
        }
        builder.append("---\n\nQuestion: ")
                .append(request.question())
                .append("\n\nAnswer:");
        return builder.toString();
    }
}
