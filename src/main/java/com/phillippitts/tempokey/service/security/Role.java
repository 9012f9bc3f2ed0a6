package com.phillippitts.tempokey.service.security;

/** Capabilities a caller may hold. {@link #SUPER_ADMIN} implies {@link #ADMIN}. */
public enum Role {
    ADMIN,
    SUPER_ADMIN
}
