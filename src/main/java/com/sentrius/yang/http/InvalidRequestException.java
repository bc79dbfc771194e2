package com.sentrius.yang.http;

/**
 * A request rejected before any parsing took place.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
