package io.github.chirino.speakercache.service;

import io.github.chirino.speakercache.codec.SpeakerEmbedding;

/**
 * Computes a speaker embedding from a voice recording. This is the expensive step the cache
 * exists to avoid repeating; it is provided by the speech synthesis layer.
 */
public interface SpeakerEmbeddingExtractor {

    SpeakerEmbedding extract(String voiceSamplePath);
}
