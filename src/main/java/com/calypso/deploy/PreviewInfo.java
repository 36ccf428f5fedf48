package com.calypso.deploy;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PreviewInfo(String url, String token, boolean ready) {

    public static PreviewInfo notReady() {
        return new PreviewInfo(null, null, false);
    }

    static PreviewInfo ready(String url, String token) {
        return new PreviewInfo(url, token, true);
    }
}
