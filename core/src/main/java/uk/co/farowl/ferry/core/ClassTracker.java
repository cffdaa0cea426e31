// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.core;

import java.lang.ref.Reference;
import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;
import java.util.WeakHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.ferry.rt.PyType;

/**
 * A two-way weak registry between dynamic classes and the tracking ids
 * that identify them across pickles. The id of a class is created the
 * first time the class is pickled by value, and a class rebuilt from a
 * pickle is registered under the id it carried, so that the same id
 * arriving again yields the same class. Neither map keeps a class
 * alive: when a class is collected its entry disappears from both.
 */
public class ClassTracker {

    static final Logger logger = LoggerFactory.getLogger(ClassTracker.class);

    /** Guards both maps and the queue. */
    private final Object lock = new Object();

    /** Tracking id of each class. */
    private final Map<PyType, String> idOf = new WeakHashMap<>();

    /** Class of each tracking id, held weakly. */
    private final Map<String, Entry> byId = new HashMap<>();

    /** Where the collector reports entries of {@link #byId} to purge. */
    private final ReferenceQueue<PyType> collected = new ReferenceQueue<>();

    /** A weak reference to a class that remembers its id. */
    private static class Entry extends WeakReference<PyType> {

        final String id;

        Entry(PyType type, String id, ReferenceQueue<PyType> q) {
            super(type, q);
            this.id = id;
        }
    }

    ClassTracker() {}

    /**
     * Return the tracking id of a class, allocating a new one (32 hex
     * digits, random) if the class has none yet.
     *
     * @param type to identify
     * @return the tracking id
     */
    public String getOrCreateId(PyType type) {
        synchronized (lock) {
            purge();
            String id = idOf.get(type);
            if (id == null) {
                id = UUID.randomUUID().toString().replace("-", "");
                idOf.put(type, id);
                byId.put(id, new Entry(type, id, collected));
                logger.atDebug().setMessage("Tracking {} as {}")
                        .addArgument(type).addArgument(id).log();
            }
            return id;
        }
    }

    /**
     * Find the class registered under a tracking id.
     *
     * @param id to look up
     * @return the class or {@code null} if there is none (any more)
     */
    public PyType lookup(String id) {
        synchronized (lock) {
            purge();
            Entry e = byId.get(id);
            return e == null ? null : e.get();
        }
    }

    /**
     * Register a class under a tracking id, unless a class is already
     * registered under it, in which case return that one.
     *
     * @param id carried by the pickle
     * @param type newly built class to register
     * @return the class now registered under {@code id}
     */
    public PyType registerIfAbsent(String id, PyType type) {
        synchronized (lock) {
            purge();
            Entry e = byId.get(id);
            PyType existing = e == null ? null : e.get();
            if (existing != null) { return existing; }
            idOf.put(type, id);
            byId.put(id, new Entry(type, id, collected));
            return type;
        }
    }

    /** @return the number of classes tracked (for tests) */
    int size() {
        synchronized (lock) {
            purge();
            return byId.size();
        }
    }

    /** Remove entries whose class has been collected. Hold the lock. */
    private void purge() {
        Reference<? extends PyType> r;
        while ((r = collected.poll()) != null) {
            Entry e = (Entry)r;
            // A new entry may have replaced the collected one
            byId.remove(e.id, e);
        }
    }
}
