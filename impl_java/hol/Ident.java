package hol;

import com.google.common.base.Preconditions;

/**
 * A theory-qualified name. Identifiers with an empty theory id are short names.
 */
public record Ident(String thyId, String name) {
    public Ident {
        Preconditions.checkNotNull(thyId, "thyId");
        Preconditions.checkArgument(name != null && !name.isEmpty(), "identifier name must not be empty");
    }

    public static Ident mkLong(String thyId, String name) {
        return new Ident(thyId, name);
    }

    public static Ident mkShort(String name) {
        return new Ident("", name);
    }

    /**
     * Split {@code thy.name} at the last dot. A string without a dot gives a short identifier.
     */
    public static Ident parse(String str) {
        int dot = str.lastIndexOf('.');
        if (dot <= 0 || dot == str.length() - 1) return mkShort(str);
        return new Ident(str.substring(0, dot), str.substring(dot + 1));
    }

    public static boolean isQualified(String str) {
        return !parse(str).isShort();
    }

    public boolean isShort() {
        return thyId.isEmpty();
    }

    @Override
    public String toString() {
        return isShort() ? name : thyId + "." + name;
    }
}
