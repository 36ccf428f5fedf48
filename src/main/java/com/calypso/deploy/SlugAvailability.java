package com.calypso.deploy;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SlugAvailability(boolean available, String reason) {

    static SlugAvailability free() {
        return new SlugAvailability(true, null);
    }

    static SlugAvailability taken() {
        return new SlugAvailability(false, null);
    }

    static SlugAvailability invalid() {
        return new SlugAvailability(false, Slugs.INVALID_FORMAT_MESSAGE);
    }
}
