// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import java.util.concurrent.Semaphore;

/**
 * The {@code _thread.lock} object: a non-reentrant lock that any
 * thread may release.
 */
public class PyLock implements PyObject {

    /** The type of Python object this class implements. */
    public static final PyType TYPE = PyType.fromSpec("LockType",
            "_thread").withFactory(args -> new PyLock());

    private final Semaphore semaphore = new Semaphore(1);

    @Override
    public PyType getType() { return TYPE; }

    /** Acquire the lock, waiting as long as necessary. */
    public void acquire() { semaphore.acquireUninterruptibly(); }

    /**
     * Acquire the lock if it is free.
     *
     * @return whether it was acquired
     */
    public boolean tryAcquire() { return semaphore.tryAcquire(); }

    /** Release the lock. */
    public void release() {
        if (!locked()) {
            throw new RuntimeError("release unlocked lock");
        }
        semaphore.release();
    }

    /** @return whether the lock is held */
    public boolean locked() { return semaphore.availablePermits() == 0; }
}
