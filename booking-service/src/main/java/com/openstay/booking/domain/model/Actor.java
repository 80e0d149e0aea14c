package com.openstay.booking.domain.model;

import com.openstay.common.exception.ActionNotPermittedException;
import com.openstay.common.exception.ValidationException;

/**
 * Who is driving a transition. Recorded in the status history of every booking it touches.
 */
public record Actor(Long actorId, ActorRole role) {

    private static final Actor SYSTEM = new Actor(0L, ActorRole.SYSTEM);

    public Actor {
        if (actorId == null || role == null) {
            throw new ValidationException("actor", "Actor id and role are required");
        }
    }

    public static Actor of(Long actorId, ActorRole role) {
        return new Actor(actorId, role);
    }

    /**
     * Actor named by request headers. SYSTEM is reserved for in-process jobs and refused here.
     */
    public static Actor fromHeaders(Long actorId, ActorRole role) {
        if (role == ActorRole.SYSTEM) {
            throw new ActionNotPermittedException("act over HTTP", role);
        }
        return new Actor(actorId, role);
    }

    public static Actor system() {
        return SYSTEM;
    }

    public boolean isStaff() {
        return role.isStaff();
    }

    public boolean isSystem() {
        return role == ActorRole.SYSTEM;
    }
}
