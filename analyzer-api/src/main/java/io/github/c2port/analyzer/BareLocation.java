package io.github.c2port.analyzer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.Nullable;

/**
 * A single resolved position in a source buffer, as reported by the C front end.
 *
 * <p>{@code offset} is a byte offset into {@code file}. {@code presumedFile}/{@code presumedLine} are only present
 * when a {@code #line} directive (or a preprocessor line marker) makes the reported position differ from the
 * physical one.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BareLocation(
        @JsonProperty("offset") long offset,
        @JsonProperty("file") String file,
        @JsonProperty("line") int line,
        @JsonProperty("col") int col,
        @JsonProperty("tokLen") int tokLen,
        @JsonProperty("presumedFile") @Nullable String presumedFile,
        @JsonProperty("presumedLine") @Nullable Integer presumedLine) {

    public BareLocation withPresumed(String presumedFile, int presumedLine) {
        return new BareLocation(offset, file, line, col, tokLen, presumedFile, presumedLine);
    }

    /** The {@code #line} directive that makes a compiler attribute following text to this location. */
    public String lineDirective() {
        if (presumedFile != null && presumedLine != null) {
            return "#line %d \"%s\"".formatted(presumedLine, presumedFile);
        }
        return "#line %d \"%s\"".formatted(line, file);
    }
}
