package io.github.chirino.speakercache.codec;

public class CorruptPayloadException extends RuntimeException {

    public CorruptPayloadException(String message) {
        super(message);
    }

    public CorruptPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
