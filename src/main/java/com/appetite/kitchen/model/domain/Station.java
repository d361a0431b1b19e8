package com.appetite.kitchen.model.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Preparation stations a ticket can be routed to.
 */
public enum Station {
    KITCHEN("kitchen"),
    BAR("bar"),
    COFFEE("coffee"),
    DESSERT("dessert");

    private final String code;

    Station(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public String label() {
        return Character.toUpperCase(code.charAt(0)) + code.substring(1);
    }

    public static Optional<Station> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(station -> station.code.equals(code))
                .findFirst();
    }
}
