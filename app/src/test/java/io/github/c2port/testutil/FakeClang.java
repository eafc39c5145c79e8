package io.github.c2port.testutil;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.c2port.util.CommandResult;
import io.github.c2port.util.CommandRunner;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jetbrains.annotations.Nullable;

/**
 * Stands in for {@code clang -Xclang -ast-dump=json}. Understands one top-level declaration per line: functions
 * (prototypes and single-line definitions), variables, typedefs, and struct/enum declarations. {@code #line}
 * directives are honoured, every other preprocessor line is skipped. The dump uses the real dumper's elided
 * encoding: {@code file} and {@code line} are only written when they change, {@code presumedFile} and
 * {@code presumedLine} only when they differ from both the physical value and the last printed one.
 */
public final class FakeClang implements CommandRunner {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Pattern LINE_DIRECTIVE = Pattern.compile("^#line\\s+(\\d+)\\s+\"([^\"]*)\"");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern LAST_TOKEN = Pattern.compile("([A-Za-z0-9_]+|\\S)\\s*$");

    private int invocations;
    private boolean failing;

    public int invocations() {
        return invocations;
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    @Override
    public CommandResult run(Path workingDirectory, List<String> command) throws IOException {
        invocations++;
        if (failing) {
            return new CommandResult(command, 1, "", "fake clang: forced failure");
        }
        var relative = command.get(command.size() - 1);
        var source = new String(Files.readAllBytes(workingDirectory.resolve(relative)), StandardCharsets.UTF_8);
        return new CommandResult(command, 0, dump(relative, source), "");
    }

    /** The JSON dump of {@code source}, as if read from {@code fileName}. */
    public static String dump(String fileName, String source) {
        return new Dumper(fileName).dump(source);
    }

    private static final class Dumper {
        private final String fileName;
        private int nextId = 1;
        private @Nullable String lastFile;
        private int lastLine;
        private @Nullable String lastPresumedFile;
        private int lastPresumedLine;

        Dumper(String fileName) {
            this.fileName = fileName;
        }

        String dump(String source) {
            var root = MAPPER.createObjectNode();
            root.put("id", id());
            root.put("kind", "TranslationUnitDecl");
            root.putObject("loc");
            var rootRange = root.putObject("range");
            rootRange.putObject("begin");
            rootRange.putObject("end");
            var inner = root.putArray("inner");
            var builtin = inner.addObject();
            builtin.put("id", id());
            builtin.put("kind", "TypedefDecl");
            builtin.putObject("loc");
            var builtinRange = builtin.putObject("range");
            builtinRange.putObject("begin");
            builtinRange.putObject("end");
            builtin.put("isImplicit", true);
            builtin.put("name", "__int128_t");
            builtin.putObject("type").put("qualType", "__int128");

            byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
            int offset = 0;
            int physicalLine = 1;
            @Nullable String presumedFile = null;
            int presumedLine = 0;
            while (offset < bytes.length) {
                int end = offset;
                while (end < bytes.length && bytes[end] != '\n') {
                    end++;
                }
                var line = new String(bytes, offset, end - offset, StandardCharsets.UTF_8);
                var trimmed = line.strip();
                Matcher directive = LINE_DIRECTIVE.matcher(trimmed);
                if (directive.find()) {
                    presumedLine = Integer.parseInt(directive.group(1)) - 1;
                    presumedFile = directive.group(2);
                } else if (!trimmed.isEmpty() && !trimmed.startsWith("#") && !trimmed.startsWith("//")) {
                    var position = new Position(physicalLine, presumedFile, presumedLine);
                    declaration(inner, line, offset, position);
                }
                offset = end + 1;
                physicalLine++;
                presumedLine++;
            }
            try {
                return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(root);
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }

        private record Position(int line, @Nullable String presumedFile, int presumedLine) {}

        private void declaration(ArrayNode inner, String line, int lineOffset, Position position) {
            int indent = line.length() - line.stripLeading().length();
            var text = line.strip();
            int begin = lineOffset + utf8Length(line.substring(0, indent));
            boolean definition = text.endsWith("}") && text.contains("(");
            var declText = text.endsWith(";") ? text.substring(0, text.length() - 1).stripTrailing() : text;

            // classify on the part before a function body
            var head = definition ? declText.substring(0, declText.indexOf('{')) : declText;

            var node = MAPPER.createObjectNode();
            node.put("id", id());
            var tokens = tokens(head);
            String kind;
            String name;
            int nameIndex;
            if (tokens.contains("typedef")) {
                kind = "TypedefDecl";
                nameIndex = declText.lastIndexOf(lastIdentifier(declText));
                name = lastIdentifier(declText);
            } else if (!head.contains("(") && (tokens.get(0).equals("struct") || tokens.get(0).equals("enum"))) {
                kind = tokens.get(0).equals("struct") ? "RecordDecl" : "EnumDecl";
                name = tokens.get(1);
                nameIndex = declText.indexOf(name, tokens.get(0).length());
            } else if (head.contains("(") && !head.contains("=")) {
                kind = "FunctionDecl";
                int paren = head.indexOf('(');
                name = lastIdentifier(head.substring(0, paren));
                nameIndex = head.substring(0, paren).lastIndexOf(name);
            } else {
                kind = "VarDecl";
                int eq = head.indexOf('=');
                var declarator = eq >= 0 ? head.substring(0, eq) : head;
                int bracket = declarator.indexOf('[');
                if (bracket >= 0) {
                    declarator = declarator.substring(0, bracket);
                }
                name = lastIdentifier(declarator);
                nameIndex = declarator.lastIndexOf(name);
            }
            node.put("kind", kind);

            int nameOffset = begin + utf8Length(declText.substring(0, nameIndex));
            writeLocation(node.putObject("loc"), nameOffset, position, name.length());
            var range = node.putObject("range");
            writeLocation(range.putObject("begin"), begin, position, tokenLength(declText, 0));
            Matcher last = LAST_TOKEN.matcher(declText);
            int lastStart = last.find() ? last.start(1) : 0;
            writeLocation(range.putObject("end"), begin + utf8Length(declText.substring(0, lastStart)), position,
                    last.group(1).length());
            node.put("name", name);

            switch (kind) {
                case "TypedefDecl" -> node.putObject("type").put("qualType", declText);
                case "RecordDecl" -> {
                    node.put("tagUsed", "struct");
                    if (declText.contains("{")) {
                        node.put("completeDefinition", true);
                    }
                }
                case "EnumDecl" -> {
                    if (declText.contains("{")) {
                        node.put("completeDefinition", true);
                    }
                }
                case "FunctionDecl" -> {
                    storageClass(node, tokens);
                    if (tokens.indexOf("inline") >= 0 && tokens.indexOf("inline") < tokens.indexOf(name)) {
                        node.put("inline", true);
                    }
                    if (definition) {
                        var body = node.putArray("inner").addObject();
                        body.put("id", id());
                        body.put("kind", "CompoundStmt");
                        var bodyRange = body.putObject("range");
                        int brace = declText.indexOf('{');
                        writeLocation(bodyRange.putObject("begin"), begin + utf8Length(declText.substring(0, brace)),
                                position, 1);
                        writeLocation(bodyRange.putObject("end"),
                                begin + utf8Length(declText.substring(0, declText.length() - 1)), position, 1);
                    }
                }
                case "VarDecl" -> {
                    storageClass(node, tokens);
                    if (head.contains("=")) {
                        node.put("init", "c");
                    }
                }
                default -> throw new IllegalStateException(kind);
            }
            inner.add(node);
        }

        private static void storageClass(ObjectNode node, List<String> tokens) {
            if (!tokens.isEmpty() && (tokens.get(0).equals("static") || tokens.get(0).equals("extern"))) {
                node.put("storageClass", tokens.get(0));
            } else if (tokens.size() > 1 && tokens.get(0).equals("inline")
                    && (tokens.get(1).equals("static") || tokens.get(1).equals("extern"))) {
                node.put("storageClass", tokens.get(1));
            }
        }

        private void writeLocation(ObjectNode loc, int offset, Position position, int tokLen) {
            loc.put("offset", offset);
            if (!fileName.equals(lastFile)) {
                loc.put("file", fileName);
                loc.put("line", position.line());
            } else if (lastLine != position.line()) {
                loc.put("line", position.line());
            }
            var presumed = position.presumedFile() == null ? fileName : position.presumedFile();
            if (!presumed.equals(fileName) && !presumed.equals(lastPresumedFile)) {
                loc.put("presumedFile", presumed);
            }
            int presumedLine = position.presumedFile() == null ? position.line() : position.presumedLine();
            if (presumedLine != position.line() && presumedLine != lastPresumedLine) {
                loc.put("presumedLine", presumedLine);
            }
            loc.put("col", 1);
            loc.put("tokLen", tokLen);
            lastFile = fileName;
            lastLine = position.line();
            lastPresumedFile = presumed;
            lastPresumedLine = presumedLine;
        }

        private String id() {
            return "0x" + Integer.toHexString(nextId++);
        }
    }

    private static List<String> tokens(String text) {
        var matcher = IDENTIFIER.matcher(text);
        var result = new ArrayList<String>();
        while (matcher.find()) {
            result.add(matcher.group());
        }
        return result;
    }

    private static String lastIdentifier(String text) {
        var matcher = IDENTIFIER.matcher(text);
        String last = "";
        while (matcher.find()) {
            last = matcher.group();
        }
        return last;
    }

    private static int tokenLength(String text, int from) {
        var matcher = Pattern.compile("[A-Za-z0-9_]+|\\S").matcher(text);
        return matcher.find(from) ? matcher.group().length() : 1;
    }

    private static int utf8Length(String text) {
        return text.getBytes(StandardCharsets.UTF_8).length;
    }
}
