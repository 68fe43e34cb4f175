package com.example.fstree;

import org.apache.tika.Tika;
import org.apache.tika.mime.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

/**
 * Detects the MIME type of a file from its name and leading bytes.
 */
public class ContentTypeDetector {
    private static final Logger LOGGER = LoggerFactory.getLogger(ContentTypeDetector.class);
    static final String FALLBACK = "application/octet-stream";

    private final Tika tika;
    private final FileSystemPrimitives primitives;

    public ContentTypeDetector(Tika tika, FileSystemPrimitives primitives) {
        this.tika = tika;
        this.primitives = primitives;
    }

    public String detect(Path path) {
        try (InputStream in = primitives.openRead(path)) {
            MediaType mediaType = MediaType.parse(tika.detect(in, path.getFileName().toString()));
            return mediaType == null ? FALLBACK : mediaType.toString();
        } catch (IOException ex) {
            LOGGER.debug("Content detection failed for {}", path, ex);
            return FALLBACK;
        }
    }
}
