package com.calypso.core.model;

public enum SiteStatus {
    READY,
    DELETED
}
