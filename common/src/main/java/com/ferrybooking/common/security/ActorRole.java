package com.ferrybooking.common.security;

public enum ActorRole {
    USER,
    OPERATOR,
    ADMIN
}
