package com.calypso.deploy;

public class SlugConflictException extends RuntimeException {

    public SlugConflictException(String slug) {
        super("This URL is already taken: " + slug);
    }
}
