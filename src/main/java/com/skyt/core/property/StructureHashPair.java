package com.skyt.core.property;

import java.util.Objects;

/**
 * Pair of SHA-256 hashes over the same tree: one literal, one after
 * alpha-normalization (locals and parameters renamed positionally).
 */
public final class StructureHashPair implements PropertyValue {

    private final String literalHash;
    private final String nameInvariantHash;

    public StructureHashPair(String literalHash, String nameInvariantHash) {
        this.literalHash       = Objects.requireNonNull(literalHash, "literalHash");
        this.nameInvariantHash = Objects.requireNonNull(nameInvariantHash, "nameInvariantHash");
    }

    @Override
    public ValueShape getShape() {
        return ValueShape.HASH_PAIR;
    }

    public String getLiteralHash()       { return literalHash; }
    public String getNameInvariantHash() { return nameInvariantHash; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructureHashPair)) return false;
        StructureHashPair other = (StructureHashPair) o;
        return literalHash.equals(other.literalHash)
                && nameInvariantHash.equals(other.nameInvariantHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(literalHash, nameInvariantHash);
    }

    @Override
    public String toString() {
        return "StructureHashPair{literal=" + abbreviate(literalHash)
                + ", nameInvariant=" + abbreviate(nameInvariantHash) + "}";
    }

    private static String abbreviate(String hash) {
        return hash.length() > 12 ? hash.substring(0, 12) : hash;
    }
}
