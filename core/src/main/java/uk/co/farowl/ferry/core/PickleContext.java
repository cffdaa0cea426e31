// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.core;

import uk.co.farowl.ferry.rt.Interpreter;

/**
 * The state of value pickling that belongs to one {@link Interpreter}
 * (one process, as far as pickles are concerned): the modules
 * registered to be pickled by value, the tracking ids of dynamic
 * classes, the cache of global names per code object, and the shells of
 * classes being rebuilt. Nothing here is shared between interpreters.
 */
public final class PickleContext {

    private final Interpreter interpreter;
    private final ByValueModules byValueModules;
    private final ReferenceResolver resolver;
    private final GlobalNames globalNames;
    private final ClassTracker tracker;
    private final SkeletonBuilder skeletons;

    private PickleContext(Interpreter interpreter) {
        this.interpreter = interpreter;
        this.byValueModules = new ByValueModules(interpreter);
        this.resolver = new ReferenceResolver(interpreter, byValueModules);
        this.globalNames = new GlobalNames(interpreter);
        this.tracker = new ClassTracker();
        this.skeletons = new SkeletonBuilder(tracker);
    }

    /**
     * The context of the given interpreter, created on first use.
     *
     * @param interpreter owning the context
     * @return its context
     */
    public static PickleContext of(Interpreter interpreter) {
        return interpreter.getAttachment(PickleContext.class,
                () -> new PickleContext(interpreter));
    }

    /** @return the interpreter that owns this context */
    public Interpreter getInterpreter() { return interpreter; }

    /** @return the modules registered to be pickled by value */
    public ByValueModules getByValueModules() { return byValueModules; }

    /** @return the reference-or-value decision procedure */
    public ReferenceResolver getResolver() { return resolver; }

    /** @return the global names extractor */
    public GlobalNames getGlobalNames() { return globalNames; }

    /** @return the dynamic class tracker */
    public ClassTracker getTracker() { return tracker; }

    /** @return the builder of class shells */
    public SkeletonBuilder getSkeletons() { return skeletons; }
}
