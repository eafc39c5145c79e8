package io.github.c2port.analyzer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * A location as seen through macro expansion. Outside of macros both halves are the same position; inside a macro
 * the spelling location points into the macro definition and the expansion location at its use site. A location with
 * no expansion half belongs to a pure macro artifact and cannot be mapped back to source text.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SourceLocation(
        @JsonProperty("spellingLoc") @Nullable BareLocation spellingLoc,
        @JsonProperty("expansionLoc") @Nullable BareLocation expansionLoc) {

    public static final SourceLocation EMPTY = new SourceLocation(null, null);

    public static SourceLocation of(BareLocation loc) {
        return new SourceLocation(loc, loc);
    }

    public Optional<BareLocation> expansion() {
        return Optional.ofNullable(expansionLoc);
    }

    public Optional<String> lineDirective() {
        return expansion().map(BareLocation::lineDirective);
    }
}
