package com.connectfood.backend.modules.listing.domain;

import java.util.Locale;

public enum ListingStatus {
    AVAILABLE,
    CLAIMED,
    COMPLETED,
    EXPIRED;

    /**
     * Only open or claimed listings show up in proximity search.
     */
    public boolean isSearchable() {
        return this == AVAILABLE || this == CLAIMED;
    }

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
