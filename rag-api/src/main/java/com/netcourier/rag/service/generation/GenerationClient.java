package com.netcourier.rag.service.generation;

public interface GenerationClient {

    /**
     * Produces an answer grounded in the request's context passages.
     *
     * @throws GenerationFailureException when the model cannot be reached or returns no answer
     */
    GenerationResponse generate(GenerationRequest request);
}
