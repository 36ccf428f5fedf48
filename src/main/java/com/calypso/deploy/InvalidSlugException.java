package com.calypso.deploy;

public class InvalidSlugException extends RuntimeException {

    public InvalidSlugException() {
        super(Slugs.INVALID_FORMAT_MESSAGE);
    }
}
