package com.agripulse.backend.service;

/**
 * Names of the cache domains, one refresher each.
 */
public final class CacheDomains {

    public static final String DASHBOARD = "dashboard";
    public static final String TERMINAL = "terminal";
    public static final String INTERNATIONAL = "international";

    public static final String INTERNATIONAL_OPTIONS = "options";

    private CacheDomains() {
    }
}
