package com.herzen.tutor.error;

public class PersistenceFailureException extends TutorEngineException {
    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
