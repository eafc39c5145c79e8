package io.github.c2port.analyzer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.c2port.MigrationException.ParseException;
import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Turns a front end JSON dump into a {@link TranslationUnitDecl}.
 *
 * <p>The dumper elides {@code file} when it equals the last printed file and {@code line} when it equals the last
 * printed line. Locations are therefore restored while walking the whole document in the order the dumper wrote
 * it: per node {@code loc} (spelling, then expansion), then {@code range} begin and end, then the children. A
 * missing {@code presumedFile} is ambiguous (same as the physical file, or same as the last presumed file); inside a
 * {@code #line} region the latter is assumed, and {@link DeclNormalizer} repairs what is left. A missing
 * {@code presumedLine} is resolved the same way against the last presumed line. Only
 * the direct children of the root become declarations; deeper nodes are walked for their locations and to tell
 * function definitions from prototypes.
 */
public final class ClangDumpReader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private @Nullable String lastFile;
    private int lastLine;
    private @Nullable String lastPresumedFile;
    private int lastPresumedLine;

    private ClangDumpReader() {}

    public static TranslationUnitDecl read(String json) throws ParseException {
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ParseException("Front end output is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject() || !"TranslationUnitDecl".equals(root.path("kind").asText())) {
            throw new ParseException("Front end output does not start with a TranslationUnitDecl");
        }
        return new ClangDumpReader().readUnit(root);
    }

    private TranslationUnitDecl readUnit(JsonNode root) throws ParseException {
        readLocation(root.get("loc"));
        readRange(root.get("range"));
        var decls = new ArrayList<Decl>();
        for (JsonNode child : children(root)) {
            decls.add(readDecl(child));
        }
        return new TranslationUnitDecl(null, decls);
    }

    private Decl readDecl(JsonNode node) throws ParseException {
        var kind = node.path("kind").asText("");
        var loc = readLocation(node.get("loc"));
        var range = readRange(node.get("range"));
        boolean implicit = node.path("isImplicit").asBoolean(false);
        var inner = children(node);
        for (JsonNode child : inner) {
            walk(child);
        }

        return switch (kind) {
            case "EnumDecl" -> new EnumDecl(
                    optionalText(node, "name"),
                    loc,
                    range,
                    node.path("completeDefinition").asBoolean(!inner.isEmpty()),
                    implicit);
            case "RecordDecl" -> new RecordDecl(
                    optionalText(node, "name"),
                    loc,
                    range,
                    optionalText(node, "tagUsed"),
                    node.path("completeDefinition").asBoolean(false),
                    implicit);
            case "FunctionDecl" -> new FunctionDecl(
                    requiredText(node, "name", kind),
                    loc,
                    range,
                    optionalText(node, "storageClass"),
                    node.path("inline").asBoolean(false),
                    inner.stream().anyMatch(c -> "CompoundStmt".equals(c.path("kind").asText())),
                    implicit,
                    false,
                    null);
            case "VarDecl" -> new VarDecl(
                    requiredText(node, "name", kind),
                    loc,
                    range,
                    optionalText(node, "storageClass"),
                    optionalText(node, "init"),
                    implicit,
                    false,
                    null);
            case "TypedefDecl" -> new TypedefDecl(
                    requiredText(node, "name", kind),
                    loc,
                    range,
                    optionalText(node.path("type"), "qualType"),
                    implicit);
            default -> new OtherDecl();
        };
    }

    private void walk(JsonNode node) {
        readLocation(node.get("loc"));
        readRange(node.get("range"));
        for (JsonNode child : children(node)) {
            walk(child);
        }
    }

    private SourceRange readRange(@Nullable JsonNode range) {
        if (range == null || !range.isObject()) {
            return SourceRange.EMPTY;
        }
        var begin = readLocation(range.get("begin"));
        var end = readLocation(range.get("end"));
        return new SourceRange(begin, end);
    }

    private SourceLocation readLocation(@Nullable JsonNode loc) {
        if (loc == null || !loc.isObject() || loc.isEmpty()) {
            return SourceLocation.EMPTY;
        }
        if (loc.has("spellingLoc") || loc.has("expansionLoc")) {
            var spelling = readBare(loc.get("spellingLoc"));
            var expansion = readBare(loc.get("expansionLoc"));
            return new SourceLocation(spelling, expansion);
        }
        var bare = readBare(loc);
        return bare == null ? SourceLocation.EMPTY : SourceLocation.of(bare);
    }

    private @Nullable BareLocation readBare(@Nullable JsonNode loc) {
        if (loc == null || !loc.has("offset")) {
            return null;
        }
        var file = loc.hasNonNull("file") ? loc.get("file").asText() : lastFile;
        int line = loc.has("line") ? loc.get("line").asInt() : lastLine;
        if (file == null) {
            return null;
        }
        boolean samePhysicalLine = file.equals(lastFile) && line == lastLine;
        lastFile = file;
        lastLine = line;
        var presumedFile = optionalText(loc, "presumedFile");
        if (presumedFile == null && lastPresumedFile != null && !lastPresumedFile.equals(file)) {
            presumedFile = lastPresumedFile;
        }
        lastPresumedFile = presumedFile == null ? file : presumedFile;
        boolean printed = loc.has("presumedLine");
        int presumedLine = printed ? loc.get("presumedLine").asInt() : omittedPresumedLine(line, samePhysicalLine);
        lastPresumedLine = presumedLine;
        if (presumedFile == null && (printed || presumedLine != line)) {
            presumedFile = file;
        }
        return new BareLocation(
                loc.get("offset").asLong(),
                file,
                line,
                loc.path("col").asInt(0),
                loc.path("tokLen").asInt(0),
                presumedFile,
                presumedFile == null ? null : Integer.valueOf(presumedLine));
    }

    /**
     * An omitted presumed line equals either the physical line or the last printed presumed line. A location on the
     * same physical line as the previous one shares its presumed line; otherwise the physical line is taken.
     */
    private int omittedPresumedLine(int line, boolean samePhysicalLine) {
        return samePhysicalLine && lastPresumedLine > 0 ? lastPresumedLine : line;
    }

    private static List<JsonNode> children(JsonNode node) {
        var inner = node.get("inner");
        if (inner == null || !inner.isArray()) {
            return List.of();
        }
        var result = new ArrayList<JsonNode>(inner.size());
        inner.forEach(result::add);
        return result;
    }

    private static @Nullable String optionalText(JsonNode node, String field) {
        var value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String requiredText(JsonNode node, String field, String kind) throws ParseException {
        var value = optionalText(node, field);
        if (value == null) {
            throw new ParseException("%s without a %s at %s".formatted(kind, field, node.path("id").asText("?")));
        }
        return value;
    }
}
