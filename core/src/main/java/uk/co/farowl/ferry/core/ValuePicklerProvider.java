// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.core;

import java.io.OutputStream;
import java.util.function.BiConsumer;

import uk.co.farowl.ferry.rt.Interpreter;
import uk.co.farowl.ferry.rt.pickle.Pickler;
import uk.co.farowl.ferry.rt.pickle.PicklerProvider;
import uk.co.farowl.ferry.rt.pickle.Reconstructor;
import uk.co.farowl.ferry.rt.pickle.Reconstructors;

/**
 * Makes value pickling available as {@value #NAME} to
 * {@link uk.co.farowl.ferry.rt.pickle.PicklerSelection}, through
 * {@link java.util.ServiceLoader}.
 */
public class ValuePicklerProvider implements PicklerProvider {

    /** The name by which value pickling is selected. */
    public static final String NAME = "value";

    @Override
    public String name() { return NAME; }

    @Override
    public Pickler newPickler(Interpreter interpreter, OutputStream out) {
        return new ValuePickler(interpreter, out);
    }

    @Override
    public void reconstructors(BiConsumer<String, Reconstructor> register) {
        register.accept("make_skeleton_class",
                ClassReducer.MAKE_SKELETON_CLASS);
        register.accept("make_skeleton_enum",
                ClassReducer.MAKE_SKELETON_ENUM);
        register.accept("class_setstate", ClassReducer.CLASS_SETSTATE);
        register.accept("type_of", ClassReducer.TYPE_OF);
        register.accept("make_function", FunctionCapsule.MAKE_FUNCTION);
        register.accept("function_setstate",
                FunctionCapsule.FUNCTION_SETSTATE);
        register.accept("java_function", FunctionCapsule.JAVA_FUNCTION);
        register.accept("empty_cell_value", EmptyCell.EMPTY_CELL_VALUE);
        register.accept("make_code", CatalogReducers.MAKE_CODE);
        register.accept("make_cell_shell", CatalogReducers.MAKE_CELL_SHELL);
        register.accept("cell_set", CatalogReducers.CELL_SET);
        register.accept("dict_view", CatalogReducers.DICT_VIEW);
        register.accept("string_io", CatalogReducers.STRING_IO);
        register.accept("partial_keywords",
                CatalogReducers.PARTIAL_KEYWORDS);
        register.accept("make_module", CatalogReducers.MAKE_MODULE);
        register.accept("module_setstate", CatalogReducers.MODULE_SETSTATE);
    }

    /**
     * Make sure the reconstructors are registered, even where the
     * provider was not found by the service loader.
     */
    static void registerReconstructors() {
        new ValuePicklerProvider().reconstructors(Reconstructors::register);
    }
}
