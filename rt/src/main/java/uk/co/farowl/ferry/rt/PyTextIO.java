// Copyright (c)2023 Jython Developers.
// Licensed to PSF under a contributor agreement.
package uk.co.farowl.ferry.rt;

/**
 * A text stream held entirely in memory: either an open file, which
 * has a name and a mode, or an {@code io.StringIO}, which can be read
 * and written. No file system access happens here: a "file" is opened
 * on the content it is given.
 */
public class PyTextIO implements PyObject {

    /** The type of opened text files. */
    public static final PyType TYPE =
            PyType.fromSpec("TextIOWrapper", "io");

    /** The type of in-memory text streams. */
    public static final PyType STRING_IO_TYPE = PyType
            .fromSpec("StringIO", "io")
            .withFactory(args -> stringIO(
                    args.length == 0 ? "" : (String)args[0], 0));

    private final PyType type;
    private final String name;
    private final String mode;
    private final StringBuilder content;
    private int position;
    private boolean closed;

    private PyTextIO(PyType type, String name, String mode,
            String content, int position) {
        this.type = type;
        this.name = name;
        this.mode = mode;
        this.content = new StringBuilder(content);
        this.position = position;
    }

    /**
     * Open a "file" of the given name and mode on the content given.
     * Mode {@code "w"} truncates the content.
     *
     * @param name of the file
     * @param mode as for Python {@code open()}
     * @param content initial content of the file
     * @return the stream
     */
    public static PyTextIO open(String name, String mode, String content) {
        if (mode.contains("w")) {
            content = "";
        }
        PyTextIO f = new PyTextIO(TYPE, name, mode, content, 0);
        if (mode.contains("a")) { f.position = content.length(); }
        return f;
    }

    /**
     * Create an in-memory stream, readable and writable.
     *
     * @param content initial value
     * @param position initial position
     * @return the stream
     */
    public static PyTextIO stringIO(String content, int position) {
        return new PyTextIO(STRING_IO_TYPE, null, "r+", content,
                position);
    }

    @Override
    public PyType getType() { return type; }

    /** @return the file name or {@code null} for a {@code StringIO} */
    public String getName() { return name; }

    /** @return the mode string */
    public String getMode() { return mode; }

    /** @return whether the stream can be read */
    public boolean readable() {
        return mode.contains("r") || mode.contains("+");
    }

    /** @return whether the stream can be written */
    public boolean writable() { return !mode.equals("r"); }

    /** @return whether the stream is closed */
    public boolean isClosed() { return closed; }

    /** Close the stream. */
    public void close() { closed = true; }

    /**
     * Read everything from the current position to the end.
     *
     * @return text read
     */
    public String read() {
        checkOpen();
        if (!readable()) { throw new OSError("not readable"); }
        String s = content.substring(position);
        position = content.length();
        return s;
    }

    /**
     * Write text at the current position, overwriting or extending the
     * content.
     *
     * @param s text to write
     * @return number of characters written
     */
    public int write(String s) {
        checkOpen();
        if (!writable()) { throw new OSError("not writable"); }
        int end = Math.min(position + s.length(), content.length());
        content.replace(position, end, s);
        position += s.length();
        return s.length();
    }

    /** @return current position */
    public int tell() {
        checkOpen();
        return position;
    }

    /** @param pos new position (clamped to the content) */
    public void seek(int pos) {
        checkOpen();
        position = Math.max(0, Math.min(pos, content.length()));
    }

    /**
     * The entire content, regardless of position.
     *
     * @return the content
     */
    public String getValue() {
        checkOpen();
        return content.toString();
    }

    private void checkOpen() {
        if (closed) {
            throw new ValueError("I/O operation on closed file.");
        }
    }

    @Override
    public String toString() {
        return name == null ? "<_io.StringIO>"
                : String.format("<_io.TextIOWrapper name='%s' mode='%s'>",
                        name, mode);
    }
}
