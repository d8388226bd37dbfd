package com.netcourier.rag.service.ingestion;

import com.netcourier.rag.config.RagProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.text.BreakIterator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Packs whole sentences into windows of at most {@code maxChunkSize} characters. Consecutive windows
 * share roughly {@code overlap} trailing characters; a sentence longer than the window is split at the
 * character limit.
 */
@Component
public class SentenceWindowChunker implements TextChunker {

    private final int maxChunkSize;
    private final int overlap;
    private final Locale locale;

    @Autowired
    public SentenceWindowChunker(RagProperties properties) {
        this(properties.chunking().maxChunkSize(), properties.chunking().overlap(),
                properties.chunking().resolvedLocale());
    }

    public SentenceWindowChunker(int maxChunkSize, int overlap, Locale locale) {
        if (maxChunkSize <= 0) {
            throw new IllegalArgumentException("maxChunkSize must be positive");
        }
        if (overlap < 0 || overlap >= maxChunkSize) {
            throw new IllegalArgumentException("overlap must be between 0 and maxChunkSize - 1");
        }
        this.maxChunkSize = maxChunkSize;
        this.overlap = overlap;
        this.locale = locale == null ? Locale.ROOT : locale;
    }

    @Override
    public List<Chunk> chunk(Document document) {
        String text = document.rawText();
        if (text == null || text.isBlank()) {
            return List.of();
        }
        int textEnd = trimEnd(text, 0, text.length());
        List<Integer> boundaries = sentenceBoundaries(text, textEnd);

        List<Chunk> chunks = new ArrayList<>();
        int start = skipWhitespace(text, 0, textEnd);
        int previousEnd = start;
        while (start < textEnd) {
            int end = trimEnd(text, start, windowEnd(boundaries, start, previousEnd, textEnd));
            if (end <= previousEnd) {
                // the overlapped window adds nothing past the previous chunk
                start = skipWhitespace(text, previousEnd, textEnd);
                continue;
            }
            String chunkText = text.substring(start, end);
            String contentHash = ContentHashes.sha256(chunkText);
            int sequence = chunks.size();
            chunks.add(new Chunk(
                    ContentHashes.chunkId(document.documentId(), contentHash, sequence),
                    document.documentId(),
                    document.version(),
                    sequence,
                    chunkText,
                    start,
                    end,
                    contentHash));
            if (end >= textEnd) {
                break;
            }
            previousEnd = end;
            start = nextStart(text, start, end, textEnd);
        }
        return chunks;
    }

    private List<Integer> sentenceBoundaries(String text, int textEnd) {
        BreakIterator iterator = BreakIterator.getSentenceInstance(locale);
        iterator.setText(text);
        List<Integer> boundaries = new ArrayList<>();
        int previous = iterator.first();
        for (int next = iterator.next(); next != BreakIterator.DONE; next = iterator.next()) {
            int end = trimEnd(text, previous, Math.min(next, textEnd));
            if (end > previous) {
                boundaries.add(end);
            }
            previous = next;
        }
        return boundaries;
    }

    /**
     * Picks the last sentence end that fits the window and lies past {@code previousEnd}, so every chunk
     * covers text the previous one did not.
     */
    private int windowEnd(List<Integer> boundaries, int start, int previousEnd, int textEnd) {
        int limit = start + maxChunkSize;
        int floor = Math.max(start, previousEnd);
        int best = -1;
        for (int boundary : boundaries) {
            if (boundary <= floor) {
                continue;
            }
            if (boundary > limit) {
                break;
            }
            best = boundary;
        }
        if (best > floor) {
            return best;
        }
        // no sentence end fits in the window
        return Math.min(limit, textEnd);
    }

    private int nextStart(String text, int start, int end, int textEnd) {
        int candidate = end - overlap;
        if (candidate <= start) {
            return skipWhitespace(text, end, textEnd);
        }
        if (candidate > 0 && !Character.isWhitespace(text.charAt(candidate - 1))) {
            int aligned = candidate;
            while (aligned < end && !Character.isWhitespace(text.charAt(aligned))) {
                aligned++;
            }
            aligned = skipWhitespace(text, aligned, end);
            if (aligned < end) {
                candidate = aligned;
            }
        }
        return skipWhitespace(text, candidate, textEnd);
    }

    private static int skipWhitespace(String text, int from, int limit) {
        int position = from;
        while (position < limit && Character.isWhitespace(text.charAt(position))) {
            position++;
        }
        return position;
    }

    private static int trimEnd(String text, int start, int end) {
        int position = end;
        while (position > start && Character.isWhitespace(text.charAt(position - 1))) {
            position--;
        }
        return position;
    }
}
