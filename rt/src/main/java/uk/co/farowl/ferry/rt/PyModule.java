// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

/** The Python {@code module} object. */
public class PyModule implements DictPyObject {

    /** The type of Python object this class implements. */
    public static final PyType TYPE = PyType.fromSpec("ModuleType",
            "types").withFactory(args -> new PyModule((String)args[0]));

    /** Name of this module. **/
    final String name;

    /** Dictionary (globals) of this module. **/
    final PyDict dict;

    /**
     * Construct an instance of the named module. The dictionary is
     * initialised with {@code __name__}.
     *
     * @param name of module
     */
    public PyModule(String name) {
        this.name = name;
        this.dict = new PyDict();
        dict.put("__name__", name);
    }

    @Override
    public PyType getType() { return TYPE; }

    @Override
    public PyDict getDict() { return dict; }

    /** @return {@code __name__} as given at construction */
    public String getName() { return name; }

    /**
     * Add a type by name to the dictionary.
     *
     * @param t the type
     */
    public void add(PyType t) { dict.put(t.getName(), t); }

    /**
     * Add an object by name to the module dictionary.
     *
     * @param name to use as key
     * @param o value for key
     */
    public void add(String name, Object o) { dict.put(name, o); }

    /**
     * Get an attribute (a global of the module).
     *
     * @param attr name of the attribute
     * @return the value
     * @throws AttributeError if the module has no such attribute
     */
    public Object getAttribute(String attr) throws AttributeError {
        Object v = dict.get(attr);
        if (v == null) {
            if ("__dict__".equals(attr)) { return dict; }
            throw new AttributeError("module '%s' has no attribute '%s'",
                    name, attr);
        }
        return v;
    }

    @Override
    public String toString() {
        return String.format("<module '%s'>", name);
    }
}
