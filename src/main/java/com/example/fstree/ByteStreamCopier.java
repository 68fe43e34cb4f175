package com.example.fstree;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;

/**
 * Moves bytes from an open readable stream to an open writable stream in fixed size chunks.
 * Failures are attributed to the side that raised them.
 */
public class ByteStreamCopier {
    public static final int DEFAULT_BUFFER_SIZE = 32768;

    private final int bufferSize;

    public ByteStreamCopier() {
        this(DEFAULT_BUFFER_SIZE);
    }

    public ByteStreamCopier(int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("bufferSize must be positive: " + bufferSize);
        }
        this.bufferSize = bufferSize;
    }

    /**
     * Copies until the source is exhausted and flushes the target. Neither stream is closed.
     *
     * @return bytes transferred
     */
    public long copy(InputStream source, Path sourcePath,
                     OutputStream target, Path targetPath,
                     TransferListener listener) throws FileTreeException {
        byte[] buffer = new byte[bufferSize];
        long total = 0;
        while (true) {
            int read;
            try {
                read = source.read(buffer);
            } catch (IOException ex) {
                throw FileTreeException.from(sourcePath, ex);
            }
            if (read == -1) {
                break;
            }
            try {
                target.write(buffer, 0, read);
            } catch (IOException ex) {
                throw FileTreeException.from(targetPath, ex);
            }
            total += read;
            listener.onChunk(read, total);
        }
        try {
            target.flush();
        } catch (IOException ex) {
            throw FileTreeException.from(targetPath, ex);
        }
        return total;
    }

    public int bufferSize() {
        return bufferSize;
    }
}
