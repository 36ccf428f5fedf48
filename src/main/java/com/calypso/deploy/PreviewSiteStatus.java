package com.calypso.deploy;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * What the preview banner shows: whether the project is live and whether the live
 * site serves an older build than the previewed one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PreviewSiteStatus(boolean published, Boolean isStale, String url) {

    static PreviewSiteStatus unpublished() {
        return new PreviewSiteStatus(false, null, null);
    }
}
