// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A class derived from {@code enum.Enum}. Its members are created once,
 * in definition order, by {@link #addMember(String, Object)}, and
 * calling the class with a value returns the member with that value.
 */
public class PyEnumType extends PyType {

    /** The meta-type of enumerations ({@code enum.EnumType}). */
    public static final PyType META =
            PyType.fromSpec("EnumType", "enum", PyType.TYPE);

    /** The base {@code enum.Enum}. */
    public static final PyEnumType ENUM = new PyEnumType("Enum",
            new PyType[0], moduleDict("enum"));

    private final Map<String, PyEnumMember> members =
            new LinkedHashMap<>();

    /**
     * Define an enumeration with no members yet.
     *
     * @param name of the type
     * @param bases of the type, normally ending with {@link #ENUM}
     * @param dict initial content of {@code __dict__}
     */
    public PyEnumType(String name, PyType[] bases, PyDict dict) {
        super(name, bases, dict);
    }

    private static PyDict moduleDict(String module) {
        PyDict d = new PyDict();
        d.put("__module__", module);
        return d;
    }

    @Override
    public PyType getType() { return META; }

    /**
     * Create a member, bind it to the name and value given, and attach
     * it as an attribute of the class.
     *
     * @param name of the member
     * @param value of the member
     * @return the new member
     * @throws TypeError if the name is already a member
     */
    public PyEnumMember addMember(String name, Object value)
            throws TypeError {
        if (members.containsKey(name)) {
            throw new TypeError("Attempted to reuse key: '%s'", name);
        }
        PyEnumMember m = new PyEnumMember(this, name, value);
        members.put(name, m);
        dict.put(name, m);
        return m;
    }

    /** @return the members in definition order (unmodifiable) */
    public Map<String, PyEnumMember> getMembers() {
        return Collections.unmodifiableMap(members);
    }

    @Override
    public void setAttribute(String attr, Object v) {
        if (members.containsKey(attr)) {
            throw new AttributeError("cannot reassign member '%s'", attr);
        }
        super.setAttribute(attr, v);
    }

    /** Calling an enumeration looks up a member by value. */
    @Override
    public Object call(Object[] args, PyDict kwargs) {
        if (args.length != 1) {
            throw new TypeError("%s() takes exactly one argument",
                    getName());
        }
        for (PyEnumMember m : members.values()) {
            if (Abstract.equals(m.getValue(), args[0])) { return m; }
        }
        throw new ValueError("%s is not a valid %s",
                Abstract.repr(args[0]), getQualname());
    }
}
