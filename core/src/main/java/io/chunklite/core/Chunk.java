// file: src/main/java/io/chunklite/core/Chunk.java
package io.chunklite.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable (address, payload) pair.
 * <p>
 * Two chunks with the same address are assumed to carry identical bytes; this
 * class does not check that the address actually matches the payload.
 * Use {@link #of(byte[])} to derive the address from the content.
 */
public final class Chunk {
    private final Address address;
    private final byte[] data;

    public Chunk(Address address, byte[] data) {
        this.address = Objects.requireNonNull(address, "address");
        // Defensive copy so callers cannot mutate a stored chunk.
        this.data = Arrays.copyOf(Objects.requireNonNull(data, "data"), data.length);
    }

    /** Build a chunk whose address is the SHA-256 of {@code data}. */
    public static Chunk of(byte[] data) {
        return new Chunk(Address.hashOf(data), data);
    }

    public Address address() { return address; }

    public byte[] data() { return Arrays.copyOf(data, data.length); }

    public int size() { return data.length; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Chunk other)) return false;
        return address.equals(other.address) && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return address.hashCode();
    }

    @Override
    public String toString() {
        return "Chunk{" + address.hex() + ", " + data.length + " bytes}";
    }
}
