// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt.pickle;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import uk.co.farowl.ferry.rt.Interpreter;
import uk.co.farowl.ferry.rt.PyList;
import uk.co.farowl.ferry.rt.ValueError;

/**
 * Test the choice of pickler when the run-time is alone on the class
 * path, so that no provider is found.
 */
@DisplayName("Pickler selection without providers")
class PicklerSelectionTest {

    @AfterEach
    void reset() { PicklerSelection.set(null); }

    @Test
    @DisplayName("defaults to the generic pickler")
    void defaultIsGeneric() {
        assertTrue(PicklerSelection.providers().isEmpty());
        assertEquals(PicklerSelection.GENERIC, PicklerSelection.get());
        assertEquals(List.of(PicklerSelection.GENERIC),
                PicklerSelection.available());
        Pickler p = PicklerSelection.newPickler(new Interpreter(),
                new ByteArrayOutputStream());
        assertSame(Pickler.class, p.getClass());
    }

    @Test
    @DisplayName("refuses an unknown name")
    void unknownName() {
        ValueError e = assertThrows(ValueError.class,
                () -> PicklerSelection.set("nope"));
        assertTrue(e.getMessage().contains("'nope'"));
        // The selection is unchanged
        assertEquals(PicklerSelection.GENERIC, PicklerSelection.get());
    }

    @Test
    @DisplayName("round-trips through the selected pickler")
    void roundTrip() {
        PicklerSelection.set(PicklerSelection.GENERIC);
        Interpreter interp = new Interpreter();
        PyList list = new PyList(List.of("a", 1));
        assertEquals(list,
                Pickling.loads(interp, Pickling.dumps(interp, list)));
    }
}
