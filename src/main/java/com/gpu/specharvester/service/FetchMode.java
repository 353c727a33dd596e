package com.gpu.specharvester.service;

/**
 * How a URL is resolved and whether the per-run dedup set is consulted
 */
public enum FetchMode {

    /** URL used as given; already-fetched URLs are skipped */
    ABSOLUTE(false, true),

    /** URL resolved against the site base URL; already-fetched URLs are skipped */
    SITE_RELATIVE(true, true),

    /** URL resolved against the site base URL; always hits the network */
    REFRESH(true, false);

    private final boolean siteRelative;
    private final boolean deduplicated;

    FetchMode(boolean siteRelative, boolean deduplicated) {
        this.siteRelative = siteRelative;
        this.deduplicated = deduplicated;
    }

    public boolean isSiteRelative() {
        return siteRelative;
    }

    public boolean isDeduplicated() {
        return deduplicated;
    }
}
