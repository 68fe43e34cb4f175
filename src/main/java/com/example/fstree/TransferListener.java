package com.example.fstree;

/**
 * Receives progress while bytes move from one stream to another.
 */
@FunctionalInterface
public interface TransferListener {
    void onChunk(int chunkBytes, long totalBytes);

    TransferListener NONE = (chunkBytes, totalBytes) -> {
    };
}
