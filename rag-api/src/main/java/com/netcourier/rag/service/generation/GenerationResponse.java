package com.netcourier.rag.service.generation;

public record GenerationResponse(String answer, int tokensUsed) {
}
