package io.sealrelay.material;

import java.util.Locale;

/**
 * What happens to a one-time prekey once a peer has used it to open a session.
 */
public enum PreKeyRetention {
    /** Record a used marker and keep the prekey, so concurrent initiators holding the same bundle still succeed. */
    RETAIN,
    /** Delete the prekey; a second initiator using the same bundle fails with {@link MaterialNotFoundException}. */
    DELETE;

    public static PreKeyRetention parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return RETAIN;
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
