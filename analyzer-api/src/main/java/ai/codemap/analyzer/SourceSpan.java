package ai.codemap.analyzer;

import java.util.Comparator;

/**
 * A region of a source file. Lines and columns are 1-based; columns count UTF-8 bytes, the way the parser reports
 * them. Byte offsets are 0-based and end-exclusive.
 */
public record SourceSpan(int startLine, int startColumn, int endLine, int endColumn, int startByte, int endByte)
        implements Comparable<SourceSpan> {

    private static final Comparator<SourceSpan> ORDER =
            Comparator.comparingInt(SourceSpan::startByte).thenComparingInt(SourceSpan::endByte);

    public SourceSpan {
        if (startLine < 1 || startColumn < 1 || endLine < 1 || endColumn < 1) {
            throw new IllegalArgumentException("lines and columns are 1-based");
        }
        if (startByte < 0 || endByte < startByte) {
            throw new IllegalArgumentException("invalid byte range [" + startByte + ", " + endByte + ")");
        }
    }

    /** True if {@code other} lies within this span (inclusive on both ends). */
    public boolean contains(SourceSpan other) {
        return startByte <= other.startByte && other.endByte <= endByte;
    }

    public int length() {
        return endByte - startByte;
    }

    @Override
    public int compareTo(SourceSpan o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}
