package com.calypso.deploy;

public record AccountDeployResult(String url, String deploymentId) {}
