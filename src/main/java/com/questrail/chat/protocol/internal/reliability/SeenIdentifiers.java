package com.questrail.chat.protocol.internal.reliability;

import java.util.BitSet;

/**
 * Inbound message identifiers already acted upon.
 *
 * <p>Grows for the lifetime of the session and never ages out. The identifier
 * space is 16 bits, so the set is bounded at 8 KiB. Not thread-safe; guarded by
 * {@link ReliabilityEngine}.</p>
 */
final class SeenIdentifiers
{
    private final BitSet seen = new BitSet(1 << 16);

    /**
     * @return {@code true} if {@code id} was not seen before
     */
    boolean add(int id) {
        if (seen.get(id)) {
            return false;
        }
        seen.set(id);
        return true;
    }

    boolean contains(int id) {
        return seen.get(id);
    }

    int size() {
        return seen.cardinality();
    }
}
