package io.github.c2port.analyzer;

/** The closed set of declaration kinds the analyzer distinguishes. */
public enum DeclKind {
    ENUM,
    RECORD,
    FUNCTION,
    VARIABLE,
    TYPEDEF,
    TRANSLATION_UNIT,
    OTHER;

    /** Only these kinds are ever emitted as source text; everything else is inert. */
    public boolean participatesInCodegen() {
        return switch (this) {
            case ENUM, RECORD, FUNCTION, VARIABLE, TYPEDEF -> true;
            case TRANSLATION_UNIT, OTHER -> false;
        };
    }
}
