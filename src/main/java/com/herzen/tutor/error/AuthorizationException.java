package com.herzen.tutor.error;

public class AuthorizationException extends TutorEngineException {
    public AuthorizationException(String message) {
        super(message);
    }
}
