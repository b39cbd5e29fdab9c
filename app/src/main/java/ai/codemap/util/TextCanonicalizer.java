package ai.codemap.util;

/** Normalization applied to source text before parsing and to declaration text before it is stored. */
public final class TextCanonicalizer {
    private TextCanonicalizer() {}

    /** Drops a leading byte-order mark (U+FEFF). */
    public static String stripUtf8Bom(String s) {
        if (!s.isEmpty() && s.charAt(0) == '\uFEFF') {
            return s.substring(1);
        }
        return s;
    }

    /** Collapses every run of whitespace to one space and trims the result. */
    public static String collapseWhitespace(String s) {
        var sb = new StringBuilder(s.length());
        boolean pendingSpace = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c)) {
                pendingSpace = sb.length() > 0;
            } else {
                if (pendingSpace) {
                    sb.append(' ');
                    pendingSpace = false;
                }
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /** True if the text contains a NUL character, which no supported source language allows. */
    public static boolean looksBinary(String s) {
        return s.indexOf('\0') >= 0;
    }
}
