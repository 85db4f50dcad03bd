package com.dcruver.themerank.cache;

import com.dcruver.themerank.domain.EmbeddingVector;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded nearest-neighbour index for the semantic tier.
 *
 * Entries live in a fixed arena of {@code capacity} slots. Free slots are
 * handed out from a free list; every insert stamps the slot with a generation
 * number. When no slot is free, the oldest tenth of the entries is released in
 * one batch (FIFO), so eviction cost is paid once per batch rather than per
 * insert.
 *
 * Searches hold the read lock and writes the write lock, so a search never sees
 * a half-applied eviction. Slot vectors are immutable once written.
 */
public class SemanticIndex {

    private final int capacity;
    private final int evictionBatch;

    private final EmbeddingVector[] vectors;
    private final double[] norms;
    private final String[] hashes;
    private final String[] excerpts;
    private final long[] generations;

    private final Deque<Integer> freeSlots = new ArrayDeque<>();
    private final Deque<Integer> insertionOrder = new ArrayDeque<>();
    private final Map<String, Integer> slotByHash = new HashMap<>();

    private final ReentrantReadWriteLock rw = new ReentrantReadWriteLock();

    private long nextGeneration = 0;
    private long evictedTotal = 0;

    public SemanticIndex(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Semantic index capacity must be positive");
        }
        this.capacity = capacity;
        this.evictionBatch = Math.max(1, capacity / 10);
        this.vectors = new EmbeddingVector[capacity];
        this.norms = new double[capacity];
        this.hashes = new String[capacity];
        this.excerpts = new String[capacity];
        this.generations = new long[capacity];
        for (int slot = 0; slot < capacity; slot++) {
            freeSlots.addLast(slot);
        }
    }

    /**
     * Add an entry. Returns false for duplicates (same hash) and zero vectors.
     */
    public boolean add(String hash, EmbeddingVector vector, String excerpt) {
        double norm = vector.norm();
        if (vector.isEmpty() || norm == 0.0) {
            return false;
        }

        rw.writeLock().lock();
        try {
            if (slotByHash.containsKey(hash)) {
                return false;
            }
            if (freeSlots.isEmpty()) {
                evictOldest(evictionBatch);
            }

            int slot = freeSlots.pollFirst();
            vectors[slot] = vector;
            norms[slot] = norm;
            hashes[slot] = hash;
            excerpts[slot] = excerpt;
            generations[slot] = nextGeneration++;
            insertionOrder.addLast(slot);
            slotByHash.put(hash, slot);
            return true;
        } finally {
            rw.writeLock().unlock();
        }
    }

    /**
     * Best match by cosine similarity. Ties go to the older entry.
     */
    public Optional<Match> findBest(EmbeddingVector probe) {
        double probeNorm = probe.norm();
        if (probeNorm == 0.0) {
            return Optional.empty();
        }

        rw.readLock().lock();
        try {
            int bestSlot = -1;
            double bestSimilarity = Double.NEGATIVE_INFINITY;

            for (int slot : insertionOrder) {
                EmbeddingVector candidate = vectors[slot];
                if (candidate.dimension() != probe.dimension()) {
                    continue;
                }
                double dot = 0.0;
                for (int i = 0; i < probe.dimension(); i++) {
                    dot += (double) candidate.get(i) * probe.get(i);
                }
                double similarity = dot / (norms[slot] * probeNorm);
                if (similarity > bestSimilarity) {
                    bestSimilarity = similarity;
                    bestSlot = slot;
                }
            }

            if (bestSlot < 0) {
                return Optional.empty();
            }
            return Optional.of(new Match(hashes[bestSlot], vectors[bestSlot], excerpts[bestSlot], bestSimilarity));
        } finally {
            rw.readLock().unlock();
        }
    }

    public boolean contains(String hash) {
        rw.readLock().lock();
        try {
            return slotByHash.containsKey(hash);
        } finally {
            rw.readLock().unlock();
        }
    }

    public int size() {
        rw.readLock().lock();
        try {
            return insertionOrder.size();
        } finally {
            rw.readLock().unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    public long evictedTotal() {
        rw.readLock().lock();
        try {
            return evictedTotal;
        } finally {
            rw.readLock().unlock();
        }
    }

    public void clear() {
        rw.writeLock().lock();
        try {
            while (!insertionOrder.isEmpty()) {
                release(insertionOrder.pollFirst());
            }
        } finally {
            rw.writeLock().unlock();
        }
    }

    /**
     * Entries oldest first, for snapshotting
     */
    public List<Entry> entries() {
        rw.readLock().lock();
        try {
            List<Entry> entries = new ArrayList<>(insertionOrder.size());
            for (int slot : insertionOrder) {
                entries.add(new Entry(hashes[slot], excerpts[slot], vectors[slot].toArray(), generations[slot]));
            }
            return entries;
        } finally {
            rw.readLock().unlock();
        }
    }

    private void evictOldest(int count) {
        for (int i = 0; i < count && !insertionOrder.isEmpty(); i++) {
            release(insertionOrder.pollFirst());
            evictedTotal++;
        }
    }

    private void release(int slot) {
        slotByHash.remove(hashes[slot]);
        vectors[slot] = null;
        norms[slot] = 0.0;
        hashes[slot] = null;
        excerpts[slot] = null;
        freeSlots.addLast(slot);
    }

    public record Match(String hash, EmbeddingVector vector, String excerpt, double similarity) {
    }

    public record Entry(String hash, String excerpt, float[] vector, long generation) {
    }
}
