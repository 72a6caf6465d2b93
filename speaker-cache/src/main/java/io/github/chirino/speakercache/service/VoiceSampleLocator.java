package io.github.chirino.speakercache.service;

import java.util.Optional;

/** Resolves where a user's reference voice recording lives. Provided by the user profile layer. */
public interface VoiceSampleLocator {

    Optional<String> findVoiceSample(String userKey);
}
