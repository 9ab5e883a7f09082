package ir;

/**
 * Position in a source file
 */
public final class SourcePosition {

    /**
     * Used when the frontend recorded no position
     */
    public static final SourcePosition UNKNOWN = new SourcePosition("-", 0, 0);

    private final String file;
    private final int line;
    private final int column;

    public SourcePosition(String file, int line, int column) {
        this.file = file;
        this.line = line;
        this.column = column;
    }

    /**
     * Parse a position of the form "file:line:col" or "line:col"
     *
     * @param pos position string
     * @param defaultFile file used if the string does not give one
     * @return the position
     * @throws IllegalArgumentException if the string is not a position
     */
    public static SourcePosition parse(String pos, String defaultFile) {
        int lastColon = pos.lastIndexOf(':');
        if (lastColon < 0) {
            throw new IllegalArgumentException("Not a source position: " + pos);
        }
        int prevColon = pos.lastIndexOf(':', lastColon - 1);
        try {
            int column = Integer.parseInt(pos.substring(lastColon + 1));
            int line = Integer.parseInt(pos.substring(prevColon + 1, lastColon));
            String file = prevColon < 0 ? defaultFile : pos.substring(0, prevColon);
            return new SourcePosition(file == null ? UNKNOWN.file : file, line, column);
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a source position: " + pos, e);
        }
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String toString() {
        if (this == UNKNOWN) {
            return file;
        }
        return file + ":" + line + ":" + column;
    }

    @Override
    public int hashCode() {
        return (file.hashCode() * 31 + line) * 31 + column;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SourcePosition)) {
            return false;
        }
        SourcePosition other = (SourcePosition) obj;
        return line == other.line && column == other.column && file.equals(other.file);
    }
}
