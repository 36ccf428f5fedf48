package com.calypso.deploy;

public record PublishResult(String url, String slug, String deploymentId) {}
