package com.connectfood.backend.modules.matching.domain;

import java.util.Locale;

public enum MatchStatus {
    PROPOSED,
    ACCEPTED,
    REJECTED,
    IN_TRANSIT,
    DELIVERED;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
