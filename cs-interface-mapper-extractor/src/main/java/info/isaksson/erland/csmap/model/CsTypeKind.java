package info.isaksson.erland.csmap.model;

import java.util.Locale;

public enum CsTypeKind {
    CLASS,
    STRUCT,
    INTERFACE;

    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CsTypeKind fromKeyword(String keyword) {
        return valueOf(keyword.trim().toUpperCase(Locale.ROOT));
    }
}
