package com.netcourier.rag.service.ingestion;

import org.apache.commons.io.FilenameUtils;
import org.apache.tika.exception.EncryptedDocumentException;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Set;

@Component
public class TikaDocumentTextExtractor implements DocumentTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(TikaDocumentTextExtractor.class);
    private static final Set<String> BINARY_FAMILIES = Set.of("image", "audio", "video");

    private final AutoDetectParser parser = new AutoDetectParser();

    @Override
    public ExtractedText extract(String filename, String contentType, byte[] content) {
        if (content == null || content.length == 0) {
            throw new UnsupportedFormatException("Document " + filename + " is empty");
        }
        Metadata metadata = new Metadata();
        if (filename != null) {
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, FilenameUtils.getName(filename));
        }
        if (contentType != null && !contentType.isBlank()) {
            metadata.set(Metadata.CONTENT_TYPE, contentType);
        }
        BodyContentHandler handler = new BodyContentHandler(-1);
        try (InputStream stream = new ByteArrayInputStream(content)) {
            parser.parse(stream, handler, metadata, new ParseContext());
        } catch (EncryptedDocumentException e) {
            throw new UnsupportedFormatException("Document " + filename + " is encrypted", e);
        } catch (TikaException | SAXException e) {
            log.warn("Unable to parse document {}", filename, e);
            throw new UnsupportedFormatException("Document " + filename + " could not be parsed", e);
        } catch (IOException e) {
            throw new UnsupportedFormatException("Document " + filename + " could not be read", e);
        }

        String detected = metadata.get(Metadata.CONTENT_TYPE);
        if (detected != null && isBinaryMedia(detected)) {
            throw new UnsupportedFormatException("Unsupported content type " + detected);
        }
        String text = TextNormaliser.clean(handler.toString());
        if (text.isEmpty()) {
            throw new UnsupportedFormatException("No text content could be extracted from " + filename);
        }
        return new ExtractedText(text, detected, metadata.get(TikaCoreProperties.TITLE));
    }

    private boolean isBinaryMedia(String mediaType) {
        String lower = mediaType.toLowerCase(Locale.ROOT);
        if (lower.startsWith("application/octet-stream")) {
            return true;
        }
        int slash = lower.indexOf('/');
        return slash > 0 && BINARY_FAMILIES.contains(lower.substring(0, slash));
    }
}
