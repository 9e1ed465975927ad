package io.sealrelay.material;

/**
 * Outcome of recording a peer's identity key on first use.
 */
public enum IdentityChange {
    NEW,
    UNCHANGED,
    CHANGED
}
