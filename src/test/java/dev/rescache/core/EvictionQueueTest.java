package dev.rescache.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EvictionQueueTest {

    @Test
    void pollsInAppendOrder_withAbsoluteIndices() {
        EvictionQueue<String> q = new EvictionQueue<>();
        assertEquals(0, q.append("a"));
        assertEquals(1, q.append("b"));
        assertEquals(2, q.append("c"));

        EvictionQueue.Slot<String> first = q.pollFirst();
        assertEquals(0, first.index());
        assertEquals("a", first.key());

        // indices do not shift after consuming the front
        assertEquals(3, q.append("d"));
        assertEquals("b", q.pollFirst().key());
        assertEquals("c", q.pollFirst().key());
        assertEquals("d", q.pollFirst().key());
        assertNull(q.pollFirst());
        assertTrue(q.isEmpty());
    }

    @Test
    void tombstone_keepsSlotButHidesKey() {
        EvictionQueue<String> q = new EvictionQueue<>();
        q.append("a");
        long b = q.append("b");
        q.append("c");

        assertTrue(q.tombstone(b));
        assertFalse(q.tombstone(b), "second tombstone of the same slot is not live");
        assertEquals(3, q.size());

        assertEquals("a", q.pollFirst().key());
        EvictionQueue.Slot<String> dead = q.pollFirst();
        assertTrue(dead.isTombstone());
        assertEquals(b, dead.index());
        assertEquals("c", q.pollFirst().key());
    }

    @Test
    void tombstone_ignoresConsumedAndUnknownIndices() {
        EvictionQueue<String> q = new EvictionQueue<>();
        long a = q.append("a");
        q.append("b");
        q.pollFirst();

        assertFalse(q.tombstone(a));
        assertFalse(q.tombstone(42));
        assertEquals("b", q.pollFirst().key());
    }

    @Test
    void pushFirst_restoresPolledSlotAtSameIndex() {
        EvictionQueue<String> q = new EvictionQueue<>();
        q.append("a");
        q.append("b");

        EvictionQueue.Slot<String> slot = q.pollFirst();
        q.pushFirst(slot);
        assertEquals(2, q.size());

        // tombstoning by the original index still hits the restored slot
        assertTrue(q.tombstone(slot.index()));
        assertTrue(q.pollFirst().isTombstone());
        assertEquals(2, q.append("c"));
    }

    @Test
    void pushFirst_rejectsAnythingButTheSlotJustPolled() {
        EvictionQueue<String> q = new EvictionQueue<>();
        q.append("a");
        q.append("b");
        EvictionQueue.Slot<String> a = q.pollFirst();
        q.pollFirst();

        assertThrows(IllegalStateException.class, () -> q.pushFirst(a));
    }

    @Test
    void growsPastInitialCapacity_whileWrapped() {
        EvictionQueue<Integer> q = new EvictionQueue<>();
        for (int i = 0; i < 10; i++) q.append(i);
        for (int i = 0; i < 8; i++) q.pollFirst();
        // head now sits mid-array; force a wrap and a resize
        for (int i = 10; i < 60; i++) q.append(i);

        assertTrue(q.tombstone(30));
        for (int expected = 8; expected < 60; expected++) {
            EvictionQueue.Slot<Integer> slot = q.pollFirst();
            assertEquals(expected, slot.index());
            if (expected == 30) {
                assertTrue(slot.isTombstone());
            } else {
                assertEquals(expected, slot.key());
            }
        }
        assertTrue(q.isEmpty());
    }

    @Test
    void clear_dropsSlotsAndKeepsIndicesIncreasing() {
        EvictionQueue<String> q = new EvictionQueue<>();
        q.append("a");
        long b = q.append("b");
        q.clear();

        assertEquals(0, q.size());
        assertFalse(q.tombstone(b));
        assertEquals(2, q.append("c"));
    }

    @Test
    void append_rejectsNullKey() {
        EvictionQueue<String> q = new EvictionQueue<>();
        assertThrows(NullPointerException.class, () -> q.append(null));
    }
}
