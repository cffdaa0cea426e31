// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt.pickle;

import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.ServiceLoader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import uk.co.farowl.ferry.rt.Interpreter;
import uk.co.farowl.ferry.rt.ValueError;

/**
 * Which pickler {@link Pickling#dumps(Interpreter, Object)} uses: the
 * generic {@link Pickler}, or one made by a {@link PicklerProvider}.
 * The choice is made by the system property {@value #PROPERTY}, read at
 * first use, or by {@link #set(String)}. When neither names one, the
 * first provider found on the class path is chosen, or the generic
 * pickler if there is none.
 */
public final class PicklerSelection {

    private PicklerSelection() {} // only static methods here

    private static final Logger logger =
            LoggerFactory.getLogger(PicklerSelection.class);

    /** System property naming the pickler. */
    public static final String PROPERTY = "ferry.pickler";

    /** Name that selects the generic pickler. */
    public static final String GENERIC = "generic";

    /** Name of the selected pickler or {@code null} if not yet chosen. */
    private static volatile String selected;

    /** Providers found on the class path (loaded once). */
    private static class Providers {
        static final List<PicklerProvider> LIST = load();

        private static List<PicklerProvider> load() {
            List<PicklerProvider> list = new ArrayList<>();
            for (PicklerProvider p : ServiceLoader
                    .load(PicklerProvider.class)) {
                logger.atDebug().setMessage("Found pickler provider {}")
                        .addArgument(p::name).log();
                list.add(p);
            }
            return Collections.unmodifiableList(list);
        }
    }

    /** @return the providers found on the class path, in order found */
    public static List<PicklerProvider> providers() {
        return Providers.LIST;
    }

    /** @return the name used when nothing else is selected */
    public static String defaultName() {
        List<PicklerProvider> list = providers();
        return list.isEmpty() ? GENERIC : list.get(0).name();
    }

    /**
     * The name of the current selection, consulting the system property
     * {@value #PROPERTY} if no choice has been made yet.
     *
     * @return the selected name
     * @throws ValueError if the property names no available pickler
     */
    public static String get() throws ValueError {
        String s = selected;
        if (s == null) {
            String p = System.getProperty(PROPERTY);
            s = p == null || p.isEmpty() ? defaultName() : check(p);
            selected = s;
            logger.atDebug().setMessage("Pickler selected: {}")
                    .addArgument(s).log();
        }
        return s;
    }

    /**
     * Select a pickler by name, or return to the default.
     *
     * @param name of the pickler or {@code null} for the default
     * @throws ValueError if no available pickler has that name
     */
    public static void set(String name) throws ValueError {
        selected = name == null ? defaultName() : check(name);
    }

    private static String check(String name) throws ValueError {
        if (GENERIC.equals(name) || find(name) != null) { return name; }
        throw new ValueError("unknown pickler '%s' (available: %s)", name,
                available());
    }

    private static PicklerProvider find(String name) {
        for (PicklerProvider p : providers()) {
            if (p.name().equals(name)) { return p; }
        }
        return null;
    }

    /** @return names of every pickler that may be selected */
    public static List<String> available() {
        List<String> names = new ArrayList<>();
        names.add(GENERIC);
        for (PicklerProvider p : providers()) { names.add(p.name()); }
        return names;
    }

    /**
     * Create a pickler of the selected kind.
     *
     * @param interpreter in which objects are resolved
     * @param out destination of the pickle
     * @return a new pickler
     */
    public static Pickler newPickler(Interpreter interpreter,
            OutputStream out) {
        PicklerProvider p = find(get());
        return p == null ? new Pickler(interpreter, out)
                : p.newPickler(interpreter, out);
    }
}
