// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import uk.co.farowl.ferry.rt.Abstract;
import uk.co.farowl.ferry.rt.Assembler;
import uk.co.farowl.ferry.rt.Callables;
import uk.co.farowl.ferry.rt.NameError;
import uk.co.farowl.ferry.rt.Opcode;
import uk.co.farowl.ferry.rt.Py;
import uk.co.farowl.ferry.rt.PyBaseObject;
import uk.co.farowl.ferry.rt.PyCell;
import uk.co.farowl.ferry.rt.PyCode;
import uk.co.farowl.ferry.rt.PyDict;
import uk.co.farowl.ferry.rt.PyEnumMember;
import uk.co.farowl.ferry.rt.PyEnumType;
import uk.co.farowl.ferry.rt.PyFunction;
import uk.co.farowl.ferry.rt.PyModule;
import uk.co.farowl.ferry.rt.PyTextIO;
import uk.co.farowl.ferry.rt.PyTuple;
import uk.co.farowl.ferry.rt.PyType;
import uk.co.farowl.ferry.rt.TypeError;
import uk.co.farowl.ferry.rt.ValueError;
import uk.co.farowl.ferry.rt.pickle.PicklingRefusedError;

/**
 * Value pickling from one interpreter to another, in the situations
 * that motivate it: closures, classes defined interactively, and modules
 * the destination does not have.
 */
@DisplayName("Value pickling")
class ValuePicklingTest extends UnitTestSupport {

    @Nested
    @DisplayName("of functions")
    class Functions {

        @Test
        @DisplayName("carries the closure of a counter")
        void counter() {
            PyFunction makeCounter = define(source, main, makeCounterCode());
            PyFunction inc = (PyFunction)makeCounter.call(5);

            PyFunction copy = (PyFunction)roundTrip(inc);
            assertEquals(5, toInt(copy.call()));
            assertEquals(6, toInt(copy.call()));
            assertEquals(7, toInt(copy.call()));

            // The original has its own counter
            assertEquals(5, toInt(inc.call()));
            assertEquals("make_counter.<locals>.inc", copy.getQualname());
            assertSame(destination, copy.getInterpreter());
        }

        @Test
        @DisplayName("keeps a cell shared by two functions")
        void sharedCell() {
            PyCell count = new PyCell(0);
            PyFunction inc = closure(source, main,
                    counterCode("pair.<locals>.inc"), count);
            PyFunction get = closure(source, main,
                    getterCode("pair.<locals>.get"), count);

            PyTuple pair = (PyTuple)roundTrip(Py.tuple(inc, get));
            PyFunction inc2 = (PyFunction)pair.get(0);
            PyFunction get2 = (PyFunction)pair.get(1);
            assertSame(inc2.getClosure()[0], get2.getClosure()[0]);
            inc2.call();
            inc2.call();
            assertEquals(2, toInt(get2.call()));
            assertEquals(0, toInt(get.call()));
        }

        @Test
        @DisplayName("leaves an empty cell empty")
        void emptyCell() {
            PyFunction get = closure(source, main,
                    getterCode("f.<locals>.get"), new PyCell());
            PyFunction copy = (PyFunction)roundTrip(get);
            assertTrue(copy.getClosure()[0].isEmpty());
            assertThrows(NameError.class, () -> copy.call());
        }

        @Test
        @DisplayName("takes only the globals the code uses")
        void globalsSubset() {
            main.add("factor", 3);
            main.add("unrelated", "not wanted");
            PyCode code = new Assembler("triple").args("x").loadFast("x")
                    .loadGlobal("factor").op(Opcode.BINARY_MULTIPLY)
                    .op(Opcode.RETURN_VALUE).assemble();
            PyFunction triple = define(source, main, code);

            PyFunction copy = (PyFunction)roundTrip(triple);
            assertEquals(12, toInt(copy.call(4)));
            assertEquals(3, copy.getGlobals().get("factor"));
            assertFalse(copy.getGlobals().containsKey("unrelated"));
            assertEquals("__main__", copy.getGlobals().get("__name__"));
            assertSame(destination.getBuiltins(),
                    copy.getGlobals().get("__builtins__"));
        }

        @Test
        @DisplayName("shares the globals of functions from one module")
        void sharedGlobals() {
            main.add("n", 1);
            PyCode getN = new Assembler("get_n").loadGlobal("n")
                    .op(Opcode.RETURN_VALUE).assemble();
            PyCode setN = new Assembler("set_n").args("v").loadFast("v")
                    .storeGlobal("n").loadConst(Py.None)
                    .op(Opcode.RETURN_VALUE).assemble();
            PyFunction g = define(source, main, getN);
            PyFunction s = define(source, main, setN);

            PyTuple pair = (PyTuple)roundTrip(Py.tuple(g, s));
            PyFunction g2 = (PyFunction)pair.get(0);
            PyFunction s2 = (PyFunction)pair.get(1);
            assertSame(g2.getGlobals(), s2.getGlobals());
            s2.call(42);
            assertEquals(42, toInt(g2.call()));
        }

        @Test
        @DisplayName("restores attributes, defaults and docstring")
        void attributes() {
            PyCode code = new Assembler("f").args("a").doc("Say a.")
                    .loadFast("a").op(Opcode.RETURN_VALUE).assemble();
            PyFunction f = define(source, main, code);
            f.setDefaults(java.util.List.of("dflt"));
            f.getDict().put("tag", "marked");

            PyFunction copy = (PyFunction)roundTrip(f);
            assertEquals("Say a.", copy.getDoc());
            assertEquals("dflt", copy.getDefaults()[0]);
            assertEquals("marked", copy.getDict().get("tag"));
            assertEquals("__main__", copy.getModule());
        }

        @Test
        @DisplayName("can reach itself through its globals")
        void recursive() {
            PyCode code = new Assembler("me").loadGlobal("me")
                    .op(Opcode.RETURN_VALUE).assemble();
            PyFunction me = define(source, main, code);
            PyFunction copy = (PyFunction)roundTrip(me);
            assertSame(copy, copy.call());
        }

        @Test
        @DisplayName("refuses a coroutine function")
        void coroutine() {
            PyCode code = new Assembler("co")
                    .trait(PyCode.Trait.COROUTINE).loadConst(Py.None)
                    .op(Opcode.RETURN_VALUE).assemble();
            PyFunction co = define(source, main, code);
            assertThrows(PicklingRefusedError.class,
                    () -> ValuePickling.dumps(source, co));
        }
    }

    @Nested
    @DisplayName("of classes")
    class Classes {

        /**
         * A class {@code C} with a method {@code m} that returns a new
         * {@code C}, where {@code m} finds {@code C} in a closure cell,
         * as if {@code C} were defined in a function.
         */
        PyType classWithFactory() {
            PyType c = defineClass(main, "C");
            PyCode m = new Assembler("m").qualname("f.<locals>.C.m")
                    .args("self").freevars("C").loadDeref("C").call(0)
                    .op(Opcode.RETURN_VALUE).assemble();
            c.setAttribute("m", closure(source, main, m, new PyCell(c)));
            return c;
        }

        @Test
        @DisplayName("rebuilds a class that makes its own instances")
        void selfReference() {
            PyType c = classWithFactory();
            PyType c2 = (PyType)roundTrip(c);
            assertNotSame(c, c2);
            assertEquals("C", c2.getName());

            Object obj = Callables.call(c2);
            Object made = Callables.call(Abstract.getAttr(obj, "m"));
            assertSame(c2, PyType.of(made));
        }

        @Test
        @DisplayName("copies an instance with its class and state")
        void instance() {
            PyType c = classWithFactory();
            PyBaseObject obj = (PyBaseObject)Callables.call(c);
            obj.getDict().put("x", 10);

            PyBaseObject copy = (PyBaseObject)roundTrip(obj);
            assertEquals(10, copy.getDict().get("x"));
            assertEquals("C", copy.getType().getName());
            assertNotSame(c, copy.getType());

            Object made = Callables.call(Abstract.getAttr(copy, "m"));
            assertSame(copy.getType(), PyType.of(made));
        }

        @Test
        @DisplayName("makes one class from many pickles")
        void deduplicate() {
            PyType c = classWithFactory();
            PyTuple both = (PyTuple)roundTrip(Py.tuple(c, c));
            assertSame(both.get(0), both.get(1));

            // A second pickle into the same destination
            assertSame(both.get(0), roundTrip(c));

            // And back again finds the original
            Object back = ValuePickling.loads(source,
                    ValuePickling.dumps(destination, both.get(0)));
            assertSame(c, back);
        }

        @Test
        @DisplayName("does not change a class already rebuilt")
        void reusedUnchanged() {
            PyType c = classWithFactory();
            c.setAttribute("version", 1);
            PyType c2 = (PyType)roundTrip(c);
            c.setAttribute("version", 2);
            assertSame(c2, roundTrip(c));
            assertEquals(1, c2.getAttribute("version"));
        }

        @Test
        @DisplayName("keeps the members of an enumeration unique")
        void enumeration() {
            PyDict dict = new PyDict();
            dict.put("__module__", "__main__");
            PyEnumType colour = new PyEnumType("Colour",
                    new PyType[] {PyEnumType.ENUM}, dict);
            colour.addMember("RED", 1);
            colour.addMember("GREEN", 2);
            main.add(colour);

            PyEnumMember green = colour.getMembers().get("GREEN");
            PyEnumMember g2 = (PyEnumMember)roundTrip(green);
            PyEnumType colour2 = (PyEnumType)PyType.of(g2);
            assertNotSame(colour, colour2);
            assertSame(colour2.getMembers().get("GREEN"), g2);
            assertEquals(2, g2.getValue());
            assertSame(colour2, roundTrip(colour));
            assertSame(colour2.getMembers().get("RED"),
                    roundTrip(colour.getMembers().get("RED")));
            assertSame(PyEnumType.ENUM, colour2.getBases()[0]);
        }

        @Test
        @DisplayName("finds the types of the singletons")
        void singletonTypes() {
            assertSame(PyType.of(Py.None), roundTrip(PyType.of(Py.None)));
            assertSame(PyType.of(Py.Ellipsis),
                    roundTrip(PyType.of(Py.Ellipsis)));
        }
    }

    @Nested
    @DisplayName("of text streams")
    class Streams {

        @Test
        @DisplayName("copies a readable stream and its position")
        void readable() {
            PyTextIO f = PyTextIO.open("data.txt", "r", "abc");
            PyTextIO copy = (PyTextIO)roundTrip(f);
            assertEquals("abc", copy.read());

            f.seek(1);
            assertEquals("bc", ((PyTextIO)roundTrip(f)).read());
        }

        @ParameterizedTest(name = "mode \"{0}\"")
        @ValueSource(strings = {"w", "w+", "r+", "a", "a+"})
        @DisplayName("refuses a file open for writing")
        void writeOnly(String mode) {
            PyTextIO f = PyTextIO.open("out.txt", mode, "abc");
            f.write("xyz");
            assertThrows(PicklingRefusedError.class,
                    () -> ValuePickling.dumps(source, f));
        }

        @Test
        @DisplayName("copies an in-memory stream")
        void stringIO() {
            PyTextIO f = PyTextIO.stringIO("abc", 2);
            PyTextIO copy = (PyTextIO)roundTrip(f);
            assertEquals("c", copy.read());
            copy.seek(0);
            assertEquals("abc", copy.read());
        }

        @Test
        @DisplayName("refuses a closed stream")
        void closed() {
            PyTextIO f = PyTextIO.open("data.txt", "r", "abc");
            f.close();
            assertThrows(PicklingRefusedError.class,
                    () -> ValuePickling.dumps(source, f));
        }
    }

    @Nested
    @DisplayName("of registered modules")
    class Registration {

        PyModule lib = libraryModule(source, "lib");
        PyModule libAtDestination = libraryModule(destination, "lib");

        @Test
        @DisplayName("pickles the functions of the module by value")
        void byValue() {
            PyFunction f = define(source, lib, constantCode("f", 1));
            define(destination, libAtDestination, constantCode("f", 2));

            PyFunction byRef = (PyFunction)roundTrip(f);
            assertEquals(2, toInt(byRef.call()));

            ValuePickling.registerByValue(source, lib);
            PyFunction byVal = (PyFunction)roundTrip(f);
            assertEquals(1, toInt(byVal.call()));
            assertEquals("lib", byVal.getGlobals().get("__name__"));

            ValuePickling.unregisterByValue(source, lib);
            assertSame(libAtDestination.getAttribute("f"), roundTrip(f));
        }

        @Test
        @DisplayName("is idempotent but checks its argument")
        void checks() {
            ValuePickling.registerByValue(source, lib);
            ValuePickling.registerByValue(source, lib);
            ValuePickling.unregisterByValue(source, lib);
            assertThrows(ValueError.class,
                    () -> ValuePickling.unregisterByValue(source, lib));
            assertThrows(TypeError.class,
                    () -> ValuePickling.registerByValue(source, "lib"));
            PyModule stray = new PyModule("stray");
            assertThrows(ValueError.class,
                    () -> ValuePickling.registerByValue(source, stray));
        }

        @Test
        @DisplayName("covers the submodules of a package")
        void subPackage() {
            PyModule sub = libraryModule(source, "lib.sub");
            ValuePickling.registerByValue(source, lib);
            ByValueModules modules =
                    PickleContext.of(source).getByValueModules();
            assertTrue(modules.isRegisteredByValue(sub));
            assertFalse(modules.isRegisteredByValue("library"));
            // Registration is per interpreter
            assertFalse(PickleContext.of(destination).getByValueModules()
                    .isRegisteredByValue("lib"));
        }

        @Test
        @DisplayName("pickles the module itself by value")
        void moduleByValue() {
            define(source, lib, constantCode("f", 1));
            ValuePickling.registerByValue(source, lib);
            PyModule copy = (PyModule)roundTrip(lib);
            assertNotSame(libAtDestination, copy);
            assertEquals("lib", copy.getName());
            assertEquals(1, toInt(Callables.call(copy.getAttribute("f"))));
            assertSame(destination.getBuiltins(),
                    copy.getDict().get("__builtins__"));
        }

        @Test
        @DisplayName("otherwise imports the module")
        void moduleByReference() {
            assertSame(libAtDestination, roundTrip(lib));
            assertSame(destination.getModule("io"),
                    roundTrip(source.getModule("io")));
        }
    }

    @Test
    @DisplayName("loads plain data")
    void plainData() {
        Object data = Py.tuple(1, "two", Py.None);
        assertEquals(data, roundTrip(data));
        assertNull(PickleContext.of(destination).getTracker()
                .lookup("no such id"));
        assertInstanceOf(PyTuple.class, roundTrip(PyTuple.EMPTY));
    }
}
