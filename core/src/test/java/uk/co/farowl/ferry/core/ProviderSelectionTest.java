// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import uk.co.farowl.ferry.rt.PyFunction;
import uk.co.farowl.ferry.rt.pickle.PicklerSelection;
import uk.co.farowl.ferry.rt.pickle.Pickling;
import uk.co.farowl.ferry.rt.pickle.PicklingError;

/**
 * Test that value pickling is found on the class path and chosen by
 * default, and that the generic pickler may still be selected.
 */
@DisplayName("Selecting the value pickler")
class ProviderSelectionTest extends UnitTestSupport {

    @AfterEach
    void reset() { PicklerSelection.set(null); }

    @Test
    @DisplayName("is the default when it is on the class path")
    void defaultIsValue() {
        assertEquals(ValuePicklerProvider.NAME, PicklerSelection.get());
        assertTrue(PicklerSelection.available()
                .contains(ValuePicklerProvider.NAME));
        assertInstanceOf(ValuePickler.class, PicklerSelection
                .newPickler(source, new ByteArrayOutputStream()));
    }

    @Test
    @DisplayName("lets Pickling copy a closure")
    void pickling() {
        PyFunction inc = (PyFunction)define(source, main, makeCounterCode())
                .call(3);
        PyFunction copy = (PyFunction)Pickling.loads(destination,
                Pickling.dumps(source, inc));
        assertEquals(3, toInt(copy.call()));
    }

    @Test
    @DisplayName("may be replaced by the generic pickler")
    void generic() {
        PicklerSelection.set(PicklerSelection.GENERIC);
        PyFunction inc = (PyFunction)define(source, main, makeCounterCode())
                .call(3);
        assertThrows(PicklingError.class,
                () -> Pickling.dumps(source, inc));
    }
}
