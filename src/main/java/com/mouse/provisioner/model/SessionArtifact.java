package com.mouse.provisioner.model;

/**
 * Serialized browser storage state (cookies + local storage) of an authenticated session.
 */
public record SessionArtifact(String storageState) {

    public boolean isEmpty() {
        return storageState == null || storageState.isBlank();
    }
}
