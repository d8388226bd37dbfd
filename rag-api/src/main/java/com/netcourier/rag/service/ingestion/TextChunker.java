package com.netcourier.rag.service.ingestion;

import java.util.List;

public interface TextChunker {

    /**
     * Splits the document's text into ordered chunks whose sequence indexes run contiguously from zero.
     */
    List<Chunk> chunk(Document document);
}
