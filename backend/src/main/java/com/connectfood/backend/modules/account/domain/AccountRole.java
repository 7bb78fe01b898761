package com.connectfood.backend.modules.account.domain;

import java.util.Locale;
import java.util.Optional;

public enum AccountRole {
    DONOR,
    RECIPIENT;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<AccountRole> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        for (AccountRole role : values()) {
            if (role.name().equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
