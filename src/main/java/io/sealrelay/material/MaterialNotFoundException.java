package io.sealrelay.material;

/**
 * The local store was asked for key material it does not hold. Usually a peer is using a stale bundle
 * that references prekeys this store has since rotated or consumed.
 *
 * <p>Unchecked, so it passes through the session library to the caller with the missing id intact.
 */
public final class MaterialNotFoundException extends RuntimeException {
    private final MaterialCategory category;
    private final int keyId;

    public MaterialNotFoundException(MaterialCategory category, int id) {
        super(category.displayName() + " " + id + " not found");
        this.category = category;
        this.keyId = id;
    }

    public MaterialCategory category() {
        return category;
    }

    public int keyId() {
        return keyId;
    }
}
