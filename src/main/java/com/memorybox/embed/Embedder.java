package com.memorybox.embed;

/**
 * Maps a piece of content to a fixed-dimension feature vector. Implementations must return the
 * same dimension for every call made against one library.
 */
public interface Embedder<T> {
    float[] embed(T content);
}
