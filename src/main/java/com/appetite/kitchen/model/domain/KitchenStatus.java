package com.appetite.kitchen.model.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Status codes a kitchen ticket moves through.
 *
 * The ticket cache treats status codes as opaque strings; the only semantics it relies
 * on are the two terminal codes used to prune the working set after an event replay.
 */
public enum KitchenStatus {
    CREATED("created"),
    ACCEPTED("accepted"),
    STARTED("started"),
    READY("ready"),
    DELIVERED("delivered"),
    REJECT("reject"),
    STANDBY("standby"),
    BLOCK("block"),
    CANCELLED("cancelled");

    private final String code;

    KitchenStatus(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isTerminal() {
        return this == DELIVERED || this == CANCELLED;
    }

    public static Optional<KitchenStatus> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(status -> status.code.equals(code))
                .findFirst();
    }

    public static boolean isTerminalCode(String code) {
        return fromCode(code).map(KitchenStatus::isTerminal).orElse(false);
    }
}
