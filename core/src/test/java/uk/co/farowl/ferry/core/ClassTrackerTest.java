// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.ref.WeakReference;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import uk.co.farowl.ferry.rt.PyDict;
import uk.co.farowl.ferry.rt.PyType;

/** Test the registry of tracking ids of dynamic classes. */
@DisplayName("The class tracker")
class ClassTrackerTest {

    final ClassTracker tracker = new ClassTracker();

    static PyType newClass(String name) {
        return new PyType(name, new PyType[0], new PyDict());
    }

    @Test
    @DisplayName("gives a class the same id every time")
    void stableId() {
        PyType a = newClass("A"), b = newClass("B");
        String id = tracker.getOrCreateId(a);
        assertEquals(32, id.length());
        assertTrue(id.matches("[0-9a-f]+"));
        assertEquals(id, tracker.getOrCreateId(a));
        assertNotEquals(id, tracker.getOrCreateId(b));
        assertSame(a, tracker.lookup(id));
        assertNull(tracker.lookup("0123"));
        assertEquals(2, tracker.size());
    }

    @Test
    @DisplayName("keeps the first class registered under an id")
    void firstWins() {
        PyType a = newClass("A"), a2 = newClass("A");
        assertSame(a, tracker.registerIfAbsent("id1", a));
        assertSame(a, tracker.registerIfAbsent("id1", a2));
        assertEquals("id1", tracker.getOrCreateId(a));
        assertSame(a, tracker.lookup("id1"));
    }

    @ParameterizedTest(name = "{0} threads")
    @ValueSource(ints = {2, 8, 32})
    @DisplayName("agrees on one id among threads")
    void concurrentIds(int n) throws Exception {
        PyType a = newClass("A");
        Set<String> ids = new HashSet<>();
        for (Object r : runTogether(n, () -> tracker.getOrCreateId(a))) {
            ids.add((String)r);
        }
        assertEquals(1, ids.size());
    }

    @Test
    @DisplayName("forgets a class once it has been collected")
    void collected() throws InterruptedException {
        String[] id = new String[1];
        WeakReference<PyType> ref = trackNewClass(id);
        assertTrue(awaitCollection(ref), "class was not collected");
        assertNull(tracker.lookup(id[0]));
        assertEquals(0, tracker.size());
    }

    /** Track a class no strong reference is kept to. */
    private WeakReference<PyType> trackNewClass(String[] id) {
        PyType c = newClass("Gone");
        id[0] = tracker.getOrCreateId(c);
        return new WeakReference<>(c);
    }

    /**
     * Ask for garbage collection until the referent is gone, or give
     * up after a few seconds.
     *
     * @param ref to watch
     * @return whether the referent was collected
     * @throws InterruptedException if interrupted while waiting
     */
    static boolean awaitCollection(WeakReference<?> ref)
            throws InterruptedException {
        for (int i = 0; i < 100 && ref.get() != null; i++) {
            System.gc();
            Thread.sleep(20);
        }
        return ref.get() == null;
    }

    @ParameterizedTest(name = "{0} threads")
    @ValueSource(ints = {2, 8, 32})
    @DisplayName("agrees on one class among threads")
    void concurrentRegistration(int n) throws Exception {
        Set<PyType> winners = new HashSet<>();
        for (Object r : runTogether(n,
                () -> tracker.registerIfAbsent("shared", newClass("S")))) {
            winners.add((PyType)r);
        }
        assertEquals(1, winners.size());
        assertSame(winners.iterator().next(), tracker.lookup("shared"));
    }

    /** Start n copies of a task at (nearly) the same time. */
    private static List<Object> runTogether(int n, Callable<Object> task)
            throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(n);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Object>> futures = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return task.call();
                }));
            }
            start.countDown();
            List<Object> results = new ArrayList<>();
            for (Future<Object> f : futures) { results.add(f.get()); }
            return results;
        } finally {
            pool.shutdown();
        }
    }
}
