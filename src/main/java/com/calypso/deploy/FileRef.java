package com.calypso.deploy;

/**
 * Reference to an uploaded file inside a deployment request.
 *
 * @param file project-relative path
 * @param sha  SHA-1 hex of the UTF-8 content
 * @param size content length in bytes
 */
public record FileRef(String file, String sha, long size) {}
