// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.WeakHashMap;

import uk.co.farowl.ferry.rt.Interpreter;
import uk.co.farowl.ferry.rt.Opcode;
import uk.co.farowl.ferry.rt.PyCode;
import uk.co.farowl.ferry.rt.PyModule;

/**
 * Static analysis of code objects to find the global names a function
 * depends on. A function pickled by value carries only those of its
 * globals, and the submodules it reaches through them, not its whole
 * module.
 */
public class GlobalNames {

    private final Interpreter interpreter;

    /**
     * Names found per code object. Code objects are immutable, so the
     * answer never changes. Guarded by itself.
     */
    private final Map<PyCode, Set<String>> cache = new WeakHashMap<>();

    GlobalNames(Interpreter interpreter) { this.interpreter = interpreter; }

    /**
     * The names read, assigned or deleted as globals by the code, or by
     * code nested in it (held in its constants).
     *
     * @param code to analyse
     * @return the global names (unmodifiable)
     */
    public Set<String> extract(PyCode code) {
        Set<String> names;
        synchronized (cache) {
            names = cache.get(code);
        }
        if (names == null) {
            names = Collections.unmodifiableSet(scan(code));
            synchronized (cache) {
                Set<String> other = cache.putIfAbsent(code, names);
                if (other != null) { names = other; }
            }
        }
        return names;
    }

    /** Walk the instructions once, then the nested code. */
    private Set<String> scan(PyCode code) {
        Set<String> names = new LinkedHashSet<>();
        String[] coNames = code.getNames();
        byte[] inst = code.getCode();
        int oparg = 0;
        for (int ip = 0; ip + 1 < inst.length; ip += 2) {
            int opcode = inst[ip] & 0xff;
            oparg = (oparg << 8) | (inst[ip + 1] & 0xff);
            switch (opcode) {
                case Opcode.EXTENDED_ARG:
                    // Keep the shifted oparg for the next opcode
                    continue;
                case Opcode.LOAD_GLOBAL:
                case Opcode.STORE_GLOBAL:
                case Opcode.DELETE_GLOBAL:
                    names.add(coNames[oparg]);
                    break;
                default:
            }
            oparg = 0;
        }
        for (Object c : code.getConsts()) {
            if (c instanceof PyCode) { names.addAll(extract((PyCode)c)); }
        }
        return names;
    }

    /**
     * Find the modules, already imported, that the code reaches as
     * attributes of the packages it depends on. After {@code import
     * pkg.sub}, a function that uses {@code pkg.sub.f} has only
     * {@code pkg} as a global, but {@code pkg.sub} must be imported too
     * wherever the function is loaded. A module {@code pkg.a.b} is
     * chosen when {@code pkg} is one of the dependencies and each of
     * {@code a} and {@code b} is a name the code (or nested code) uses.
     *
     * @param code of the function
     * @param dependencies modules that are globals of the function
     * @return submodules in the order of the module table
     */
    public List<PyModule> findSubmodules(PyCode code,
            Collection<PyModule> dependencies) {
        List<PyModule> found = new ArrayList<>();
        if (dependencies.isEmpty()) { return found; }
        Set<String> used = new HashSet<>();
        allNames(code, used);
        for (Map.Entry<String, PyModule> e : interpreter.getModules()
                .entrySet()) {
            String name = e.getKey();
            if (ReferenceResolver.MAIN.equals(name)) { continue; }
            for (PyModule dep : dependencies) {
                String prefix = dep.getName() + ".";
                if (name.startsWith(prefix) && used.containsAll(
                        List.of(name.substring(prefix.length())
                                .split("\\.")))) {
                    found.add(e.getValue());
                    break;
                }
            }
        }
        return found;
    }

    /** Collect {@code co_names} of the code and nested code. */
    private static void allNames(PyCode code, Set<String> used) {
        Collections.addAll(used, code.getNames());
        for (Object c : code.getConsts()) {
            if (c instanceof PyCode) { allNames((PyCode)c, used); }
        }
    }
}
