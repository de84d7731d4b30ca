package com.herzen.tutor.error;

public class NotFoundException extends TutorEngineException {
    public NotFoundException(String message) {
        super(message);
    }
}
