package com.calypso.core.persistence;

public class DuplicateSlugException extends RuntimeException {

    public DuplicateSlugException(String slug) {
        super("Slug '" + slug + "' belongs to another project");
    }
}
