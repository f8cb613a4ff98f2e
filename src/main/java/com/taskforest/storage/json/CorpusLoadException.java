package com.taskforest.storage.json;

/**
 * Thrown when a corpus cannot be read from disk, either because of an I/O
 * failure or because a file is not the JSON shape the loader expects.
 */
public class CorpusLoadException extends RuntimeException {

    public CorpusLoadException(String message) {
        super(message);
    }

    public CorpusLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
