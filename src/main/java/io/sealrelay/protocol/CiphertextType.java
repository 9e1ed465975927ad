package io.sealrelay.protocol;

import org.whispersystems.libsignal.protocol.CiphertextMessage;

import java.util.Optional;

/**
 * Envelope type discriminator. Wire values are the session library's message types; do not renumber.
 */
public enum CiphertextType {
    ESTABLISHED(CiphertextMessage.WHISPER_TYPE),
    PREKEY(CiphertextMessage.PREKEY_TYPE);

    private final int wireValue;

    CiphertextType(int wireValue) {
        this.wireValue = wireValue;
    }

    public int wireValue() {
        return wireValue;
    }

    public static Optional<CiphertextType> fromWire(int value) {
        for (CiphertextType type : values()) {
            if (type.wireValue == value) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
