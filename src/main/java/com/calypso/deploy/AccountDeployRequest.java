package com.calypso.deploy;

/**
 * @param token       access token of the caller's own hosting account
 * @param projectName display name the hosting project is named after, optional
 */
public record AccountDeployRequest(String token, String projectName) {}
