// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import uk.co.farowl.ferry.rt.PyDict;
import uk.co.farowl.ferry.rt.PyType;

/**
 * What a pickle records about a dynamic class before its body: enough
 * to build a shell that other objects can refer to while the body is
 * still to come.
 */
public final class ClassShape {

    private final TypeKind kind;
    private final String id;
    private final String name;
    private final PyType[] bases;
    private final PyDict namespace;
    private final Map<String, Object> members;

    private ClassShape(TypeKind kind, String id, String name,
            PyType[] bases, PyDict namespace, Map<String, Object> members) {
        this.kind = kind;
        this.id = id;
        this.name = name;
        this.bases = bases.clone();
        this.namespace = namespace;
        this.members = members;
    }

    /**
     * The shape of a plain class.
     *
     * @param id tracking id
     * @param name of the class
     * @param bases of the class
     * @param namespace initial dictionary (at most {@code __module__}
     *     and {@code __qualname__})
     * @return the shape
     */
    public static ClassShape plain(String id, String name, PyType[] bases,
            PyDict namespace) {
        return new ClassShape(TypeKind.PLAIN, id, name, bases,
                new PyDict(namespace), Collections.emptyMap());
    }

    /**
     * The shape of an enumeration. The members are part of the shape,
     * since they are made along with the class.
     *
     * @param id tracking id
     * @param name of the class
     * @param qualname of the class
     * @param module name of the module or {@code null}
     * @param bases of the class
     * @param members names and values in definition order
     * @return the shape
     */
    public static ClassShape enumeration(String id, String name,
            String qualname, String module, PyType[] bases,
            Map<?, ?> members) {
        PyDict ns = new PyDict();
        ns.put("__qualname__", qualname);
        if (module != null) { ns.put("__module__", module); }
        Map<String, Object> m = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : members.entrySet()) {
            m.put((String)e.getKey(), e.getValue());
        }
        return new ClassShape(TypeKind.ENUM, id, name, bases, ns,
                Collections.unmodifiableMap(m));
    }

    /** @return the kind of class */
    public TypeKind getKind() { return kind; }

    /** @return the tracking id */
    public String getId() { return id; }

    /** @return {@code __name__} */
    public String getName() { return name; }

    /** @return a copy of {@code __bases__} */
    public PyType[] getBases() { return bases.clone(); }

    /** @return a copy of the initial dictionary */
    public PyDict getNamespace() { return new PyDict(namespace); }

    /** @return the enumeration members (empty for a plain class) */
    public Map<String, Object> getMembers() { return members; }
}
