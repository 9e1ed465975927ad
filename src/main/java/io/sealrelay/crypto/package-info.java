/**
 * Post-quantum prekey material: the ML-KEM key pair, its signed record and the storage contract for it.
 * Session establishment and message encryption come from {@code org.whispersystems.libsignal}; this
 * package only covers the prekey category that library does not model.
 */
package io.sealrelay.crypto;
