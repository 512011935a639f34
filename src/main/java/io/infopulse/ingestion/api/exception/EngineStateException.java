package io.infopulse.ingestion.api.exception;

/**
 * Operation not allowed in the engine's current run state, such as starting it twice.
 */
public class EngineStateException extends RuntimeException {

    public EngineStateException(String message) {
        super(message);
    }
}
