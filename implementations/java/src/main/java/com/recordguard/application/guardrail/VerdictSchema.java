package com.recordguard.application.guardrail;

import lombok.Getter;
import lombok.NonNull;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Ordered field layout of one stage's oracle response, plus the mapping
 * between parsed fields and the typed verdict.
 *
 * @param <V> verdict type
 */
@Getter
public final class VerdictSchema<V> {

    public static final String DEFAULT_REASON = "Invalid response format";

    private final String name;
    private final List<FieldSpec> fields;
    private final Function<ParsedFields, V> assembler;
    private final Function<V, ParsedFields> disassembler;

    public VerdictSchema(
            @NonNull String name,
            @NonNull List<FieldSpec> fields,
            @NonNull Function<ParsedFields, V> assembler,
            @NonNull Function<V, ParsedFields> disassembler) {
        this.name = name;
        this.fields = List.copyOf(fields);
        this.assembler = assembler;
        this.disassembler = disassembler;
    }

    /**
     * First field, in declaration order, whose name equals the normalized key.
     */
    public Optional<FieldSpec> field(String normalizedKey) {
        return fields.stream()
            .filter(field -> field.name().equals(normalizedKey))
            .findFirst();
    }

    public V assemble(ParsedFields parsed) {
        return assembler.apply(parsed);
    }

    /**
     * The most restrictive verdict this schema can express.
     */
    public V safeDefault(String reason) {
        return assembler.apply(ParsedFields.defaults(fields, reason));
    }

    /**
     * Serialize a verdict back into the line format the parser reads.
     *
     * <p>Text values stay on their own line: backslashes and line breaks are
     * written as {@code \\}, {@code \n} and {@code \r}, which the parser
     * reads back.
     */
    public String render(V verdict) {
        ParsedFields parsed = disassembler.apply(verdict);
        StringBuilder out = new StringBuilder();
        for (FieldSpec field : fields) {
            out.append(field.name()).append(": ");
            switch (field.type()) {
                case BOOLEAN -> out.append(parsed.flag(field.name()));
                case TEXT -> out.append(escape(parsed.text(field.name())));
                case STRING_SET -> out.append(renderSet(parsed.set(field.name())));
                case NULLABLE_STRING -> {
                    String value = parsed.nullable(field.name());
                    out.append(value == null ? "null" : escape(value));
                }
            }
            out.append('\n');
        }
        return out.toString();
    }

    private static String renderSet(Set<String> values) {
        return "[" + String.join(", ", new TreeSet<>(values)) + "]";
    }

    static String escape(String value) {
        if (value == null) {
            return "";
        }
        return value.replace("\\", "\\\\")
            .replace("\n", "\\n")
            .replace("\r", "\\r");
    }

    static String unescape(String value) {
        if (value.indexOf('\\') < 0) {
            return value;
        }
        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length()) {
                char next = value.charAt(i + 1);
                if (next == 'n' || next == 'r' || next == '\\') {
                    out.append(next == 'n' ? '\n' : next == 'r' ? '\r' : '\\');
                    i++;
                    continue;
                }
            }
            out.append(c);
        }
        return out.toString();
    }
}
