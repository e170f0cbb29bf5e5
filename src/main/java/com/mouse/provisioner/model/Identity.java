package com.mouse.provisioner.model;

import java.util.Objects;

/**
 * Email/password pair to be registered. The password is kept out of {@link #toString()}.
 */
public record Identity(String email, String password) {

    public Identity {
        Objects.requireNonNull(email, "email is required");
        Objects.requireNonNull(password, "password is required");
        email = email.trim();
    }

    @Override
    public String toString() {
        return "Identity[" + email + "]";
    }
}
