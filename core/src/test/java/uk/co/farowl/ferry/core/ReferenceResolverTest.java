// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static uk.co.farowl.ferry.core.ReferenceResolver.Decision.REFERENCE;
import static uk.co.farowl.ferry.core.ReferenceResolver.Decision.VALUE;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import uk.co.farowl.ferry.rt.Py;
import uk.co.farowl.ferry.rt.PyDict;
import uk.co.farowl.ferry.rt.PyFunction;
import uk.co.farowl.ferry.rt.PyJavaFunction;
import uk.co.farowl.ferry.rt.PyModule;
import uk.co.farowl.ferry.rt.PyType;
import uk.co.farowl.ferry.rt.ValueError;

/** Test the choice between pickling by reference and by value. */
@DisplayName("The reference resolver")
class ReferenceResolverTest extends UnitTestSupport {

    final ReferenceResolver resolver =
            PickleContext.of(source).getResolver();
    final PyModule lib = libraryModule(source, "lib");

    @Test
    @DisplayName("pickles what __main__ defines by value")
    void mainByValue() {
        PyFunction f = define(source, main, constantCode("f", 1));
        assertEquals(VALUE, resolver.decide(f));
        assertEquals(VALUE, resolver.decide(defineClass(main, "C")));
    }

    @Test
    @DisplayName("pickles built-ins by reference")
    void builtins() {
        Object len = source.getBuiltins().getAttribute("len");
        assertEquals(REFERENCE, resolver.decide(len));
        assertEquals(REFERENCE, resolver.decide(PyDict.TYPE));
    }

    @Test
    @DisplayName("pickles what a library defines by reference")
    void library() {
        PyFunction f = define(source, lib, constantCode("f", 1));
        assertEquals(REFERENCE, resolver.decide(f));
        assertEquals(REFERENCE, resolver.decide(defineClass(lib, "C")));
    }

    @Test
    @DisplayName("pickles what cannot be found by name by value")
    void notFound() {
        // Nested in a function
        PyFunction nested = closure(source, lib, constantCode("g", 1));
        nested.setQualname("f.<locals>.g");
        assertEquals(VALUE, resolver.decide(nested));

        // Replaced in its module
        PyFunction f = define(source, lib, constantCode("f", 1));
        lib.add("f", Py.None);
        assertEquals(VALUE, resolver.decide(f));

        // In a module that is not in the table
        PyModule gone = libraryModule(source, "gone");
        PyFunction h = define(source, gone, constantCode("h", 1));
        source.removeModule("gone");
        assertEquals(VALUE, resolver.decide(h));
    }

    @Test
    @DisplayName("pickles what an ad hoc module defines by value")
    void adHoc() {
        PyModule m = new PyModule("made");
        m.add("__file__", Py.None);
        source.addModule(m);
        PyFunction f = define(source, m, constantCode("f", 1));
        assertEquals(VALUE, resolver.decide(f));
    }

    @Test
    @DisplayName("pickles what has no name by value")
    void noName() {
        assertEquals(VALUE, resolver.decide(new Object(), null));
        assertNull(ReferenceResolver.nameOf(Py.None));
    }

    @Test
    @DisplayName("pickles a registered module's classes by value")
    void registered() {
        PyType c = defineClass(lib, "C");
        PickleContext.of(source).getByValueModules().registerByValue(lib);
        assertEquals(VALUE, resolver.decide(c));
        assertEquals(VALUE, resolver.decideModule(lib));
        assertEquals(REFERENCE,
                resolver.decideModule(source.getModule("io")));
    }

    @Test
    @DisplayName("searches the modules when no module is declared")
    void search() {
        // A module in which every look-up fails
        source.addModule(new PyModule("broken") {
            @Override
            public Object getAttribute(String attr) {
                throw new ValueError("broken module");
            }
        });
        PyModule tools = libraryModule(source, "tools");
        PyJavaFunction helper =
                new PyJavaFunction(null, "helper", args -> 1);
        tools.add("helper", helper);

        assertNull(ReferenceResolver.declaredModule(helper));
        assertEquals("tools", resolver.whichModule(helper, "helper"));
        assertEquals(REFERENCE, resolver.decide(helper));

        PyJavaFunction stray = new PyJavaFunction(null, "stray", args -> 2);
        assertNull(resolver.whichModule(stray, "stray"));
        assertEquals(VALUE, resolver.decide(stray));
    }
}
