package com.example.shortie_backend.service;

/**
 * Progress callback for chunked runs.
 */
@FunctionalInterface
public interface ChunkProgressListener {
    ChunkProgressListener NONE = (chunkIndex, chunkCount) -> { };

    /**
     * Called once a chunk has been processed, successfully or not.
     *
     * @param chunkIndex zero-based index of the finished chunk.
     * @param chunkCount total number of chunks in the run.
     */
    void onChunkDone(int chunkIndex, int chunkCount);
}
