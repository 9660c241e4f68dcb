package dev.rescache.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * FIFO of cache keys in creation order, consumed from the front by the scanner.
 *
 * <p>Slots are addressed by absolute indices that keep growing as the front is consumed, so the index a
 * record was given on append names the same slot for as long as that slot exists. A record removed outside
 * the scanner tombstones its slot instead of deleting it; the scanner skips tombstones.
 *
 * <p>Not thread-safe. {@link CoalescingResultCache} only touches it while holding its monitor.
 *
 * @param <K> the type of the cache key
 */
final class EvictionQueue<K> {
    private static final int INITIAL_CAPACITY = 16;

    /**
     * A polled slot. A null key marks a tombstone.
     *
     * @param index absolute slot index
     * @param key   the key stored in the slot, or null if tombstoned
     */
    record Slot<K>(long index, K key) {
        boolean isTombstone() {
            return key == null;
        }
    }

    private Object[] slots = new Object[INITIAL_CAPACITY];
    private int head;          // physical position of the first slot
    private int count;
    private long firstIndex;   // absolute index of the first slot

    /**
     * @return the absolute index of the new slot
     */
    long append(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        ensureCapacity(count + 1);
        slots[(head + count) & (slots.length - 1)] = key;
        count++;
        return firstIndex + count - 1;
    }

    /**
     * Marks the slot at {@code index} as removed. Indices already consumed from the front are ignored.
     *
     * @return true if a live slot was tombstoned
     */
    boolean tombstone(long index) {
        if (index < firstIndex || index >= firstIndex + count) {
            return false;
        }
        int pos = physical(index);
        boolean live = slots[pos] != null;
        slots[pos] = null;
        return live;
    }

    /**
     * @return the oldest slot, or null if the queue is empty
     */
    @SuppressWarnings("unchecked")
    Slot<K> pollFirst() {
        if (count == 0) {
            return null;
        }
        K key = (K) slots[head];
        slots[head] = null;
        head = (head + 1) & (slots.length - 1);
        count--;
        return new Slot<>(firstIndex++, key);
    }

    /**
     * Puts back the slot most recently returned by {@link #pollFirst()}, at its original index.
     *
     * @throws IllegalStateException if {@code slot} is not the slot just polled
     */
    void pushFirst(Slot<K> slot) {
        Objects.requireNonNull(slot, "slot cannot be null");
        if (slot.index() != firstIndex - 1) {
            throw new IllegalStateException("Only the slot just polled can be pushed back, expected index "
                    + (firstIndex - 1) + ", got " + slot.index());
        }
        ensureCapacity(count + 1);
        head = (head - 1) & (slots.length - 1);
        slots[head] = slot.key();
        count++;
        firstIndex--;
    }

    /**
     * @return number of slots, tombstones included
     */
    int size() {
        return count;
    }

    boolean isEmpty() {
        return count == 0;
    }

    /**
     * Drops every slot. Indices keep increasing across a clear.
     */
    void clear() {
        Arrays.fill(slots, null);
        firstIndex += count;
        head = 0;
        count = 0;
    }

    private int physical(long index) {
        return (int) ((head + (index - firstIndex)) & (slots.length - 1));
    }

    private void ensureCapacity(int required) {
        if (required <= slots.length) {
            return;
        }
        int newCapacity = slots.length << 1;
        if (newCapacity < 0) {
            throw new IllegalStateException("Eviction queue is too large: " + count);
        }
        Object[] grown = new Object[newCapacity];
        for (int i = 0; i < count; i++) {
            grown[i] = slots[(head + i) & (slots.length - 1)];
        }
        slots = grown;
        head = 0;
    }
}
