package io.sealrelay.material;

import java.util.OptionalInt;

/**
 * Kinds of locally held key material and the record-key prefix each one lives under.
 */
public enum MaterialCategory {
    PRE_KEY("prekey", "PreKey"),
    SIGNED_PRE_KEY("signedprekey", "SignedPreKey"),
    KYBER_PRE_KEY("kyberprekey", "KyberPreKey");

    private final String prefix;
    private final String displayName;

    MaterialCategory(String prefix, String displayName) {
        this.prefix = prefix;
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    String recordPrefix() {
        return prefix + ":";
    }

    String recordKey(int id) {
        return recordPrefix() + id;
    }

    /**
     * Id of a record key in this category; empty for markers and other keys sharing the prefix.
     */
    OptionalInt parseRecordKey(String key) {
        if (!key.startsWith(recordPrefix())) {
            return OptionalInt.empty();
        }
        String raw = key.substring(recordPrefix().length());
        if (raw.isEmpty() || !raw.chars().allMatch(Character::isDigit)) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Integer.parseInt(raw));
    }

    String usedKey(int id) {
        return prefix + ":used:" + id;
    }

    String counterKey() {
        return "counter:" + prefix;
    }
}
