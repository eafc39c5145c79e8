package io.github.c2port.analyzer;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Begin and end locations of a declaration. The end location is the start of the last token. */
public record SourceRange(
        @JsonProperty("begin") SourceLocation begin, @JsonProperty("end") SourceLocation end) {

    public static final SourceRange EMPTY = new SourceRange(SourceLocation.EMPTY, SourceLocation.EMPTY);

    /** True when both endpoints carry expansion locations in the same file. */
    @JsonIgnore
    public boolean isExtractable() {
        var b = begin.expansionLoc();
        var e = end.expansionLoc();
        return b != null && e != null && b.file().equals(e.file());
    }

    /**
     * True when {@code other} lies within this range in the same file. Used to recognize tag declarations that are
     * embedded in a following declaration, such as the struct in {@code typedef struct {...} T;}.
     */
    public boolean encloses(SourceRange other) {
        if (!isExtractable() || !other.isExtractable()) {
            return false;
        }
        var b = begin.expansionLoc();
        var e = end.expansionLoc();
        var ob = other.begin.expansionLoc();
        var oe = other.end.expansionLoc();
        assert b != null && e != null && ob != null && oe != null;
        return b.file().equals(ob.file()) && b.offset() <= ob.offset() && e.offset() >= oe.offset();
    }
}
