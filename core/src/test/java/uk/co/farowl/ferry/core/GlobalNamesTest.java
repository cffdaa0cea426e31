// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import uk.co.farowl.ferry.rt.Assembler;
import uk.co.farowl.ferry.rt.Opcode;
import uk.co.farowl.ferry.rt.Py;
import uk.co.farowl.ferry.rt.PyCode;
import uk.co.farowl.ferry.rt.PyFunction;
import uk.co.farowl.ferry.rt.PyModule;

/**
 * Test the analysis of code for the global names it uses, and the
 * submodules it reaches through them.
 */
@DisplayName("Global name analysis")
class GlobalNamesTest extends UnitTestSupport {

    final GlobalNames globalNames = PickleContext.of(source).getGlobalNames();

    @Nested
    @DisplayName("extracts")
    class Extract {

        @Test
        @DisplayName("globals loaded, stored and deleted")
        void simple() {
            PyCode code = new Assembler("f").args("x").loadGlobal("a")
                    .op(Opcode.POP_TOP).storeGlobal("b").deleteGlobal("c")
                    .loadFast("x").loadAttr("attr").op(Opcode.POP_TOP)
                    .loadConst(Py.None).op(Opcode.RETURN_VALUE).assemble();
            assertEquals(Set.of("a", "b", "c"), globalNames.extract(code));
        }

        @Test
        @DisplayName("globals of nested code")
        void nested() {
            PyCode inner = new Assembler("g").qualname("f.<locals>.g")
                    .loadGlobal("deep").op(Opcode.RETURN_VALUE).assemble();
            PyCode outer = new Assembler("f").loadGlobal("top")
                    .op(Opcode.POP_TOP).makeFunction(inner)
                    .op(Opcode.RETURN_VALUE).assemble();
            assertEquals(Set.of("top", "deep"), globalNames.extract(outer));
        }

        @Test
        @DisplayName("globals with a large index")
        void extendedArg() {
            Assembler a = new Assembler("many");
            List<String> expected = new ArrayList<>();
            for (int i = 0; i < 300; i++) {
                String name = "g" + i;
                a.loadGlobal(name).op(Opcode.POP_TOP);
                expected.add(name);
            }
            PyCode code = a.loadConst(Py.None).op(Opcode.RETURN_VALUE)
                    .assemble();
            Set<String> names = globalNames.extract(code);
            assertEquals(300, names.size());
            assertTrue(names.containsAll(expected));
        }

        @Test
        @DisplayName("the same answer each time")
        void cached() {
            PyCode code = new Assembler("f").loadGlobal("a")
                    .op(Opcode.RETURN_VALUE).assemble();
            assertSame(globalNames.extract(code), globalNames.extract(code));
        }
    }

    @Nested
    @DisplayName("finds submodules")
    class Submodules {

        final PyModule pkg = libraryModule(source, "pkg");
        final PyModule sub = libraryModule(source, "pkg.sub");
        final PyModule other = libraryModule(source, "pkg.other");

        /** {@code use()} calls {@code pkg.sub.helper()}. */
        final PyCode useCode = new Assembler("use").loadGlobal("pkg")
                .loadAttr("sub").loadAttr("helper").call(0)
                .op(Opcode.RETURN_VALUE).assemble();

        @Test
        @DisplayName("reached through a package")
        void direct() {
            List<PyModule> found =
                    globalNames.findSubmodules(useCode, List.of(pkg));
            assertEquals(List.of(sub), found);
            assertTrue(globalNames.findSubmodules(useCode, List.of())
                    .isEmpty());
        }

        @Test
        @DisplayName("and imports them at the destination")
        void imported() {
            source.importModule("pkg.sub");
            define(source, sub, constantCode("helper", "source"));
            main.add("pkg", pkg);
            PyFunction use = define(source, main, useCode);

            PyModule pkg2 = libraryModule(destination, "pkg");
            PyModule sub2 = libraryModule(destination, "pkg.sub");
            define(destination, sub2, constantCode("helper", "destination"));
            assertFalse(pkg2.getDict().containsKey("sub"));

            PyFunction copy = (PyFunction)roundTrip(use);
            assertSame(sub2, pkg2.getDict().get("sub"));
            assertSame(pkg2, copy.getGlobals().get("pkg"));
            assertEquals("destination", copy.call());
        }
    }
}
