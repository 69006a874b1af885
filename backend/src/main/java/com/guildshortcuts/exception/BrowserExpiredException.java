package com.guildshortcuts.exception;

public class BrowserExpiredException extends RuntimeException {
    public BrowserExpiredException(String message) {
        super(message);
    }
}
