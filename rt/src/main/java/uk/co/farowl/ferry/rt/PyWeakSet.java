// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.WeakHashMap;

/**
 * The {@code weakref.WeakSet}: a set that does not keep its members
 * alive. A member disappears from the set when it is collected.
 */
public class PyWeakSet implements PyObject {

    /** The type of Python object this class implements. */
    public static final PyType TYPE = PyType.fromSpec("WeakSet",
            "weakref").withFactory(args -> {
                PyWeakSet s = new PyWeakSet();
                if (args.length > 0) {
                    for (Object o : (Collection<?>)args[0]) { s.add(o); }
                }
                return s;
            });

    private final Set<Object> members =
            Collections.synchronizedSet(Collections
                    .newSetFromMap(new WeakHashMap<Object, Boolean>()));

    @Override
    public PyType getType() { return TYPE; }

    /** @param o to add */
    public void add(Object o) { members.add(o); }

    /** @param o to remove if present */
    public void discard(Object o) { members.remove(o); }

    /**
     * @param o to test
     * @return whether {@code o} is a member
     */
    public boolean contains(Object o) { return members.contains(o); }

    /** @return number of live members */
    public int size() { return members.size(); }

    /**
     * A list of the members still alive, which holds them strongly.
     *
     * @return live members
     */
    public List<Object> liveMembers() {
        synchronized (members) {
            return new ArrayList<>(members);
        }
    }
}
