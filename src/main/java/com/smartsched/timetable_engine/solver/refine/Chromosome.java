package com.smartsched.timetable_engine.solver.refine;

import java.util.Arrays;

/**
 * A complete schedule as two aligned gene arrays: slot index and room index per session.
 */
public final class Chromosome {

    private final int[] slots;
    private final int[] rooms;
    private long signature;
    private boolean signed;

    public Chromosome(int[] slots, int[] rooms) {
        if (slots.length != rooms.length) {
            throw new IllegalArgumentException("Slot and room genes must have the same length.");
        }
        this.slots = slots;
        this.rooms = rooms;
    }

    public Chromosome copy() {
        return new Chromosome(slots.clone(), rooms.clone());
    }

    public int length() {
        return slots.length;
    }

    public int slot(int s) { return slots[s]; }
    public int room(int s) { return rooms[s]; }

    int[] slots() { return slots; }
    int[] rooms() { return rooms; }

    void set(int s, int slot, int room) {
        slots[s] = slot;
        rooms[s] = room;
        signed = false;
    }

    public int[] slotGenes() {
        return slots.clone();
    }

    public int[] roomGenes() {
        return rooms.clone();
    }

    /** 64-bit FNV-1a over both gene arrays; used as the fitness cache key. */
    public long signature() {
        if (!signed) {
            long hash = 0xcbf29ce484222325L;
            for (int s = 0; s < slots.length; s++) {
                hash = (hash ^ slots[s]) * 0x100000001b3L;
                hash = (hash ^ rooms[s]) * 0x100000001b3L;
            }
            signature = hash;
            signed = true;
        }
        return signature;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Chromosome other = (Chromosome) o;
        return Arrays.equals(slots, other.slots) && Arrays.equals(rooms, other.rooms);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(signature());
    }
}
