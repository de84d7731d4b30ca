package com.herzen.tutor.error;

public class AggregationFailureException extends TutorEngineException {
    public AggregationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
