package com.herzen.tutor.error;

public class AuthException extends TutorEngineException {
    public AuthException(String message) {
        super(message);
    }
}
