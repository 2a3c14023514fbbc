package com.flairbit.calls.security;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.UUID;

/**
 * Authenticated caller of a service operation.
 */
@Data
@AllArgsConstructor
public class Actor {

    /** Identity used for audit entries written by background jobs. */
    public static final UUID SYSTEM_ID = new UUID(0L, 0L);

    private UUID id;
    private boolean admin;

    public static Actor user(UUID id) {
        return new Actor(id, false);
    }

    public static Actor admin(UUID id) {
        return new Actor(id, true);
    }

    public static Actor system() {
        return new Actor(SYSTEM_ID, true);
    }
}
