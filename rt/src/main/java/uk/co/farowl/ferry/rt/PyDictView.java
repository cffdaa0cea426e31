// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

import java.util.Map;

/**
 * A view of the keys, values or items of a {@code dict}, reflecting
 * later changes to it.
 */
public class PyDictView implements PyObject {

    /** Which aspect of the dictionary a view presents. */
    public enum Kind {
        KEYS("dict_keys"), VALUES("dict_values"), ITEMS("dict_items");

        /** The Python type of views of this kind. */
        public final PyType type;

        Kind(String typeName) {
            this.type = PyType.fromSpec(typeName, "types");
        }
    }

    private final Kind kind;
    private final PyDict dict;

    /**
     * Create a view of the given kind.
     *
     * @param kind of view
     * @param dict viewed
     */
    public PyDictView(Kind kind, PyDict dict) {
        this.kind = kind;
        this.dict = dict;
    }

    @Override
    public PyType getType() { return kind.type; }

    /** @return the kind of view */
    public Kind getKind() { return kind; }

    /** @return the {@code dict} viewed (not a copy) */
    public PyDict getDict() { return dict; }

    /**
     * The current content as a {@code list}: keys, values or
     * {@code (key, value)} tuples.
     *
     * @return list of the content
     */
    public PyList toList() {
        PyList list = new PyList();
        for (Map.Entry<Object, Object> e : dict.entrySet()) {
            switch (kind) {
                case KEYS:
                    list.add(e.getKey());
                    break;
                case VALUES:
                    list.add(e.getValue());
                    break;
                default:
                    list.add(Py.tuple(e.getKey(), e.getValue()));
            }
        }
        return list;
    }

    @Override
    public String toString() {
        return String.format("%s(%s)", kind.type.getName(), toList());
    }
}
