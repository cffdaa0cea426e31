// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Test selected methods of {@link Abstract}. */
@DisplayName("The abstract object API")
class AbstractTest extends UnitTestSupport {

    final Interpreter interp = new Interpreter();
    final PyModule main = mainModule(interp);

    @Nested
    @DisplayName("gets attributes of a function")
    class FunctionAttributes {

        final PyFunction f = define(interp, main,
                new Assembler("f").doc("Say hello.")
                        .loadConst("hello").op(Opcode.RETURN_VALUE)
                        .assemble());

        @Test
        void names() {
            assertEquals("f", Abstract.getAttr(f, "__name__"));
            assertEquals("f", Abstract.getAttr(f, "__qualname__"));
            assertEquals("__main__", Abstract.getAttr(f, "__module__"));
            assertEquals("Say hello.", Abstract.getAttr(f, "__doc__"));
        }

        @Test
        void readOnly() {
            assertSame(f.getGlobals(), Abstract.getAttr(f, "__globals__"));
            assertSame(Py.None, Abstract.getAttr(f, "__closure__"));
            assertThrows(AttributeError.class,
                    () -> Abstract.setAttr(f, "__globals__", new PyDict()));
        }

        @Test
        void instanceDict() {
            Abstract.setAttr(f, "tag", 1);
            assertEquals(1, Abstract.getAttr(f, "tag"));
            Abstract.delAttr(f, "tag");
            assertThrows(AttributeError.class,
                    () -> Abstract.getAttr(f, "tag"));
        }
    }

    @Nested
    @DisplayName("finds attributes through a class")
    class ClassAttributes {

        final PyFunction self = define(interp, main, new Assembler("me")
                .args("self").loadFast("self").op(Opcode.RETURN_VALUE)
                .assemble());
        final PyType c;
        final Object obj;

        ClassAttributes() {
            PyDict dict = new PyDict();
            dict.put("__module__", "__main__");
            dict.put("me", self);
            dict.put("cm", new PyClassMethod(self));
            dict.put("sm", new PyStaticMethod(self));
            dict.put("answer", new PyProperty(new PyJavaFunction(null,
                    "answer", args -> 42), null, null, null));
            c = new PyType("C", new PyType[0], dict);
            obj = c.call(new Object[0], null);
        }

        @Test
        void boundMethod() {
            Object m = Abstract.getAttr(obj, "me");
            assertTrue(m instanceof PyMethod);
            assertSame(obj, Callables.call(m));
        }

        @Test
        void classMethod() {
            assertSame(c, Callables.call(Abstract.getAttr(obj, "cm")));
            assertSame(c, Callables.call(Abstract.getAttr(c, "cm")));
        }

        @Test
        void staticMethod() {
            assertSame(self, Abstract.getAttr(c, "sm"));
        }

        @Test
        void property() {
            assertEquals(42, Abstract.getAttr(obj, "answer"));
        }

        @Test
        void dottedLookup() {
            main.add("C", c);
            assertSame(self, Abstract.lookupDotted(main, "C.sm"));
            assertThrows(AttributeError.class,
                    () -> Abstract.lookupDotted(main, "f.<locals>.C"));
        }
    }

    @Test
    @DisplayName("compares numbers by value")
    void numericEquality() {
        assertTrue(Abstract.equals(1, BigInteger.ONE));
        assertTrue(Abstract.equals(2, 2.0));
        assertFalse(Abstract.equals("2", 2));
    }
}
