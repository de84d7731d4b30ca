package com.herzen.tutor.error;

public abstract class TutorEngineException extends RuntimeException {
    protected TutorEngineException(String message) {
        super(message);
    }

    protected TutorEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
