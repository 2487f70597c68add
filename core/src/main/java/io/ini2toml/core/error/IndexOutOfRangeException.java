package io.ini2toml.core.error;

/** Thrown when a positional container operation is given an index outside {@code [0, size]}. */
public final class IndexOutOfRangeException extends ReprException {

    private static final long serialVersionUID = 1L;

    private final int index;
    private final int size;

    public IndexOutOfRangeException(int index, int size) {
        super("Index " + index + " out of range [0, " + size + "]");
        this.index = index;
        this.size = size;
    }

    public int index() {
        return index;
    }

    public int size() {
        return size;
    }
}
