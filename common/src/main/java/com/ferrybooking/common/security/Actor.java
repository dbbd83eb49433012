package com.ferrybooking.common.security;

import com.ferrybooking.common.exception.ForbiddenActionException;

/**
 * Authenticated caller as handed to us by the upstream authentication layer.
 */
public record Actor(Long accountId, ActorRole role) {

    public static Actor of(Long accountId, ActorRole role) {
        return new Actor(accountId, role == null ? ActorRole.USER : role);
    }

    public boolean isAdmin() {
        return role == ActorRole.ADMIN;
    }

    public boolean isOperator() {
        return role == ActorRole.OPERATOR || role == ActorRole.ADMIN;
    }

    public boolean owns(Long ownerAccountId) {
        return accountId != null && accountId.equals(ownerAccountId);
    }

    public void requireAdmin() {
        if (!isAdmin()) {
            throw new ForbiddenActionException("Administrator role required");
        }
    }

    public void requireOperator() {
        if (!isOperator()) {
            throw new ForbiddenActionException("Operator role required");
        }
    }
}
