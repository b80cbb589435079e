package io.clinic.model;

import java.util.Objects;

/**
 * Authenticated identity supplied by the caller's session layer.
 *
 * @param accountId login account id
 * @param name      display name, may be {@code null}
 * @param role      account role
 */
public record Actor(long accountId, String name, ActorRole role) {

    public Actor {
        Objects.requireNonNull(role, "role");
    }

    public static Actor admin(long accountId) {
        return new Actor(accountId, "Admin", ActorRole.ADMIN);
    }

    public boolean hasRole(ActorRole expected) {
        return role == expected;
    }
}
