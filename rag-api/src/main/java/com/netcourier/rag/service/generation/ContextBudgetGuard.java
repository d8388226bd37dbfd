package com.netcourier.rag.service.generation;

import java.util.ArrayList;
import java.util.List;

public class ContextBudgetGuard {

    private final int maxTokens;

    public ContextBudgetGuard(int maxTokens) {
        this.maxTokens = maxTokens;
    }

    /**
     * Keeps passages in rank order until the next one would exceed the token budget.
     */
    public GuardedContext enforce(List<ContextPassage> passages) {
        if (passages == null || passages.isEmpty()) {
            return new GuardedContext(List.of(), false);
        }
        int budget = maxTokens;
        List<ContextPassage> accepted = new ArrayList<>();
        boolean truncated = false;
        for (ContextPassage passage : passages) {
            int estimatedTokens = estimateTokens(passage.text());
            if (estimatedTokens > budget) {
                truncated = true;
                break;
            }
            budget -= estimatedTokens;
            accepted.add(passage);
        }
        return new GuardedContext(List.copyOf(accepted), truncated);
    }

    static int estimateTokens(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return Math.max(1, text.length() / 4 + 16);
    }

    public record GuardedContext(List<ContextPassage> passages, boolean truncated) {}
}
