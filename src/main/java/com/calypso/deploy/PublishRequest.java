package com.calypso.deploy;

/**
 * @param slug        requested subdomain, optional
 * @param projectName display name the default slug is derived from, optional
 */
public record PublishRequest(String slug, String projectName) {}
