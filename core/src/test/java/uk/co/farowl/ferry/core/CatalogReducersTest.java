// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.core;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.MethodSource;

import uk.co.farowl.ferry.rt.Abstract;
import uk.co.farowl.ferry.rt.Assembler;
import uk.co.farowl.ferry.rt.Callables;
import uk.co.farowl.ferry.rt.Opcode;
import uk.co.farowl.ferry.rt.Py;
import uk.co.farowl.ferry.rt.PyBaseObject;
import uk.co.farowl.ferry.rt.PyCell;
import uk.co.farowl.ferry.rt.PyClassMethod;
import uk.co.farowl.ferry.rt.PyCode;
import uk.co.farowl.ferry.rt.PyDict;
import uk.co.farowl.ferry.rt.PyDictView;
import uk.co.farowl.ferry.rt.PyFunction;
import uk.co.farowl.ferry.rt.PyLock;
import uk.co.farowl.ferry.rt.PyLogger;
import uk.co.farowl.ferry.rt.PyMappingProxy;
import uk.co.farowl.ferry.rt.PyMethod;
import uk.co.farowl.ferry.rt.PyPartial;
import uk.co.farowl.ferry.rt.PyProperty;
import uk.co.farowl.ferry.rt.PyStaticMethod;
import uk.co.farowl.ferry.rt.PyTuple;
import uk.co.farowl.ferry.rt.PyType;
import uk.co.farowl.ferry.rt.PyWeakSet;
import uk.co.farowl.ferry.rt.pickle.PicklingRefusedError;

/**
 * Test the objects of the run-time system that value pickling adds to
 * what the generic pickler can handle.
 */
@DisplayName("Value pickling of run-time objects")
class CatalogReducersTest extends UnitTestSupport {

    @Nested
    @DisplayName("in a class body")
    class Descriptors {

        PyType c = defineClass(main, "C");

        Descriptors() {
            PyFunction getter =
                    define(source, main, constantCode("getter", 42, "self"));
            c.setAttribute("p",
                    new PyProperty(getter, Py.None, Py.None, "answer"));
            c.setAttribute("s", new PyStaticMethod(
                    define(source, main, constantCode("seven", 7))));
            PyCode who = new Assembler("who").args("cls").loadFast("cls")
                    .op(Opcode.RETURN_VALUE).assemble();
            c.setAttribute("k",
                    new PyClassMethod(define(source, main, who)));
        }

        @Test
        @DisplayName("a property")
        void property() {
            PyType c2 = (PyType)roundTrip(c);
            PyProperty p = assertInstanceOf(PyProperty.class,
                    c2.getDict().get("p"));
            assertEquals("answer", p.getDoc());
            assertEquals(42, Abstract.getAttr(Callables.call(c2), "p"));
        }

        @Test
        @DisplayName("a static method")
        void staticMethod() {
            PyType c2 = (PyType)roundTrip(c);
            assertInstanceOf(PyStaticMethod.class, c2.getDict().get("s"));
            assertEquals(7, Callables.call(c2.getAttribute("s")));
        }

        @Test
        @DisplayName("a class method")
        void classMethod() {
            PyType c2 = (PyType)roundTrip(c);
            assertInstanceOf(PyClassMethod.class, c2.getDict().get("k"));
            assertSame(c2, Callables.call(c2.getAttribute("k")));
        }
    }

    @Nested
    @DisplayName("bound to an object")
    class Methods {

        PyType c = defineClass(main, "C");
        PyFunction m = define(source, main, constantCode("m", 1, "self"));
        PyFunction other =
                define(source, main, constantCode("other", 2, "self"));
        PyBaseObject obj = new PyBaseObject(c);

        Methods() { c.setAttribute("m", m); }

        @Test
        @DisplayName("a method found on its object")
        void byAttribute() {
            PyMethod bound = (PyMethod)Abstract.getAttr(obj, "m");
            PyMethod copy = (PyMethod)roundTrip(bound);
            assertEquals("C", PyType.of(copy.getSelf()).getName());
            assertEquals(1, Callables.call(copy));
        }

        @Test
        @DisplayName("a function bound by hand")
        void byHand() {
            PyMethod copy = (PyMethod)roundTrip(new PyMethod(obj, other));
            assertEquals("other",
                    ((PyFunction)copy.getFunction()).getName());
            assertEquals(2, Callables.call(copy));
        }

        @Test
        @DisplayName("a partial application")
        void partial() {
            PyDict kw = new PyDict();
            kw.put("extra", "yes");
            PyPartial p = new PyPartial(m, Py.tuple(obj), kw);
            PyPartial copy = (PyPartial)roundTrip(p);
            assertEquals(kw, copy.getKeywords());
            assertEquals("C",
                    PyType.of(copy.getArgs().get(0)).getName());
            assertEquals("m", ((PyFunction)copy.getFunction()).getName());

            PyPartial plain = new PyPartial(m, Py.tuple(obj), null);
            assertTrue(((PyPartial)roundTrip(plain)).getKeywords()
                    .isEmpty());
        }
    }

    @Nested
    @DisplayName("in the library")
    class Library {

        @Test
        @DisplayName("an unlocked lock")
        void lock() {
            PyLock lock = new PyLock();
            PyLock copy = (PyLock)roundTrip(lock);
            assertNotSame(lock, copy);
            assertFalse(copy.locked());
        }

        @Test
        @DisplayName("but not a lock that is held")
        void heldLock() {
            PyLock lock = new PyLock();
            lock.acquire();
            try {
                assertThrows(PicklingRefusedError.class,
                        () -> ValuePickling.dumps(source, lock));
            } finally {
                lock.release();
            }
        }

        @Test
        @DisplayName("a logger, which is found again by name")
        void logger() {
            PyLogger log = PyLogger.getLogger("app.worker");
            assertSame(log, roundTrip(log));
            PyLogger root = PyLogger.getLogger(null);
            assertSame(root, roundTrip(root));
        }

        @Test
        @DisplayName("a weak set and its live members")
        void weakSet() {
            PyBaseObject member = new PyBaseObject(defineClass(main, "M"));
            PyWeakSet set = new PyWeakSet();
            set.add(member);
            // The tuple keeps the copied member alive
            PyTuple copy = (PyTuple)roundTrip(Py.tuple(set, member));
            PyWeakSet set2 = (PyWeakSet)copy.get(0);
            assertEquals(1, set2.size());
            assertTrue(set2.contains(copy.get(1)));
        }

        @Test
        @DisplayName("a mapping proxy, as a copy")
        void mappingProxy() {
            PyDict d = new PyDict();
            d.put("a", 1);
            PyMappingProxy copy =
                    (PyMappingProxy)roundTrip(new PyMappingProxy(d));
            assertEquals(d, copy.getMapping());
        }

        @ParameterizedTest(name = "{0}")
        @EnumSource(PyDictView.Kind.class)
        @DisplayName("a view of a dictionary")
        void dictView(PyDictView.Kind kind) {
            PyDict d = new PyDict();
            d.put("a", 1);
            d.put("b", 2);
            PyDictView view = new PyDictView(kind, d);
            PyDictView copy = (PyDictView)roundTrip(view);
            assertEquals(kind, copy.getKind());
            assertEquals(view.toList(), copy.toList());
        }
    }

    static Stream<PyCode> codes() {
        return Stream.of(constantCode("k", "constant", "a", "b"),
                makeCounterCode(), counterCode("make_counter.<locals>.inc"),
                new Assembler("d").doc("Documented.").loadGlobal("x")
                        .op(Opcode.RETURN_VALUE).assemble());
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("codes")
    @DisplayName("copies every field of code")
    void code(PyCode code) {
        PyCode copy = (PyCode)roundTrip(code);
        assertNotSame(code, copy);
        assertEquals(code.argcount, copy.argcount);
        assertEquals(code.flags, copy.flags);
        assertEquals(code.traits, copy.traits);
        assertEquals(code.stacksize, copy.stacksize);
        assertEquals(code.qualname, copy.qualname);
        assertArrayEquals(code.getCode(), copy.getCode());
        assertArrayEquals(code.getNames(), copy.getNames());
        assertArrayEquals(code.getVarnames(), copy.getVarnames());
        assertArrayEquals(code.getFreevars(), copy.getFreevars());
        assertArrayEquals(code.getCellvars(), copy.getCellvars());
        assertEquals(code.getConsts().length, copy.getConsts().length);
    }

    @Test
    @DisplayName("copies a cell that is not in a closure")
    void looseCell() {
        PyCell cell = new PyCell("inside");
        PyCell copy = (PyCell)roundTrip(cell);
        assertEquals("inside", copy.get());
        assertTrue(((PyCell)roundTrip(new PyCell())).isEmpty());
        assertSame(EmptyCell.INSTANCE, roundTrip(EmptyCell.INSTANCE));
    }

    @Test
    @DisplayName("copies a function implemented in Java by name")
    void javaFunction() {
        Object open = source.getModule("io").getAttribute("open");
        assertSame(destination.getModule("io").getAttribute("open"),
                roundTrip(open));
    }
}
