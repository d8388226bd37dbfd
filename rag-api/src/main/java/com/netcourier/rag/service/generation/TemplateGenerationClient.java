package com.netcourier.rag.service.generation;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Offline generator that stitches the retrieved passages into an answer without calling a model.
 */
@Component
@ConditionalOnProperty(prefix = "rag.generation", name = "provider", havingValue = "template")
public class TemplateGenerationClient implements GenerationClient {

    @Override
    public GenerationResponse generate(GenerationRequest request) {
        StringBuilder builder = new StringBuilder();
        if (request.context().isEmpty()) {
            builder.append("I could not find relevant information in the documents for: ")
                    .append(request.question().trim());
            return new GenerationResponse(builder.toString(), 0);
        }
        builder.append("Based on the documents:\n");
        for (int i = 0; i < request.context().size(); i++) {
            ContextPassage passage = request.context().get(i);
            builder.append(i + 1)
                    .append(". ")
                    .append(shorten(passage.text()))
                    .append(" [")
                    .append(passage.documentId())
                    .append("]\n");
        }
        return new GenerationResponse(builder.toString().trim(), 0);
    }

    private String shorten(String text) {
        String trimmed = text == null ? "" : text.replaceAll("\\s+", " ").trim();
        if (trimmed.length() <= 240) {
            return trimmed;
        }
        return trimmed.substring(0, 237) + "...";
    }
}
