package com.recordguard.application.guardrail;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic gate every candidate query must pass before execution,
 * whatever any oracle said about it.
 *
 * <p>Accepted shape, and nothing else:
 * <pre>
 *   SELECT col[, col...] | * FROM &lt;table&gt; WHERE id = &lt;principal id&gt; [AND col = literal ...] [LIMIT n]
 * </pre>
 */
@Slf4j
public class QueryScopeGuard {

    /**
     * Outcome of a scope check; {@code violation} is null when the query passed.
     */
    public record ScopeCheck(boolean passed, String violation) {

        static ScopeCheck ok() {
            return new ScopeCheck(true, null);
        }

        static ScopeCheck violation(String reason) {
            return new ScopeCheck(false, reason);
        }
    }

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TRAILING_TERMINATORS = Pattern.compile("[;\\s]+$");
    private static final Pattern MUTATION = Pattern.compile(
        "\\b(insert|update|delete|drop|alter|create|truncate|replace|merge|upsert|grant|revoke|"
            + "attach|detach|pragma|vacuum|reindex|exec|execute|call|copy|into)\\b");
    private static final Pattern COMBINATOR = Pattern.compile("\\b(union|intersect|except|join)\\b");
    private static final Pattern SELECT_KEYWORD = Pattern.compile("\\bselect\\b");
    private static final Pattern OR_KEYWORD = Pattern.compile("\\bor\\b");
    private static final Pattern PATTERN_PREDICATE = Pattern.compile("\\b(like|ilike|glob|regexp|similar|match)\\b");
    private static final Pattern CATALOG = Pattern.compile(
        "\\b(sqlite_master|sqlite_schema|sqlite_temp_master|information_schema|pg_catalog|pg_[a-z_]+|sys)\\b");
    private static final Pattern SHAPE = Pattern.compile(
        "^select\\s+(?<columns>.+?)\\s+from\\s+(?<table>\\S+)(?:\\s+where\\s+(?<where>.+?))?(?:\\s+limit\\s+\\d+)?$");
    private static final Pattern IDENTIFIER = Pattern.compile("^\"?[a-z_][a-z0-9_]*\"?(\\.\"?[a-z_][a-z0-9_]*\"?)?$");
    private static final Pattern COMPARISON = Pattern.compile(
        "^(?<lhs>[^=<>!\\s]+)\\s*(?<op>==|=|!=|<>|<=|>=|<|>)\\s*(?<rhs>.+)$");
    private static final Pattern LITERAL = Pattern.compile("^(-?\\d+(\\.\\d+)?|'[^']*')$");
    private static final Pattern CONJUNCTION = Pattern.compile("\\s+and\\s+");
    private static final Pattern ID_PREDICATE = Pattern.compile(
        "(?<![a-z0-9_])(?:\"?[a-z_][a-z0-9_]*\"?\\.)?\"?id\"?\\s*==?\\s*'?(\\d+)'?");

    private final String table;

    public QueryScopeGuard(String table) {
        this.table = table.toLowerCase(Locale.ROOT);
    }

    /**
     * Whether the query names the principal's id in an equality predicate and
     * names no other id.
     */
    public boolean referencesPrincipal(String query, long principalId) {
        if (query == null) {
            return false;
        }
        Matcher matcher = ID_PREDICATE.matcher(normalize(query));
        boolean found = false;
        while (matcher.find()) {
            if (!matcher.group(1).equals(Long.toString(principalId))) {
                return false;
            }
            found = true;
        }
        return found;
    }

    public ScopeCheck check(String query, long principalId) {
        ScopeCheck result = evaluate(query, principalId);
        if (!result.passed() && log.isDebugEnabled()) {
            log.debug("Scope check failed for principal {}: {}", principalId, result.violation());
        }
        return result;
    }

    /**
     * Column names selected by the query, or {@code *}. Empty when the query
     * does not have a recognisable SELECT list.
     */
    public List<String> selectedColumns(String query) {
        if (query == null) {
            return List.of();
        }
        Matcher shape = SHAPE.matcher(normalize(query));
        if (!shape.matches()) {
            return List.of();
        }
        List<String> columns = new ArrayList<>();
        for (String column : shape.group("columns").split(",")) {
            String trimmed = column.trim().replace("\"", "");
            if (!trimmed.isEmpty()) {
                columns.add(trimmed);
            }
        }
        return columns;
    }

    private ScopeCheck evaluate(String query, long principalId) {
        if (query == null || query.isBlank()) {
            return ScopeCheck.violation("Query is empty");
        }
        String q = normalize(query);

        if (q.contains(";")) {
            return ScopeCheck.violation("Multiple statements are not allowed");
        }
        if (q.contains("--") || q.contains("/*") || q.contains("*/") || q.contains("#")) {
            return ScopeCheck.violation("SQL comments are not allowed");
        }
        if (!q.startsWith("select ")) {
            return ScopeCheck.violation("Only read-only SELECT statements are allowed");
        }
        if (MUTATION.matcher(q).find()) {
            return ScopeCheck.violation("Data or schema modification is not allowed");
        }
        if (COMBINATOR.matcher(q).find()) {
            return ScopeCheck.violation("UNION, INTERSECT, EXCEPT and JOIN could expose other users' rows");
        }
        if (countMatches(SELECT_KEYWORD, q) > 1 || q.contains("(")) {
            return ScopeCheck.violation("Subqueries and function calls are not allowed");
        }
        if (CATALOG.matcher(q).find()) {
            return ScopeCheck.violation("System tables and metadata are not accessible");
        }
        if (OR_KEYWORD.matcher(q).find()) {
            return ScopeCheck.violation("OR conditions could bypass the user restriction");
        }
        if (PATTERN_PREDICATE.matcher(q).find()) {
            return ScopeCheck.violation("Pattern predicates could match multiple users");
        }
        if (q.contains("||")) {
            return ScopeCheck.violation("String concatenation is not allowed");
        }

        Matcher shape = SHAPE.matcher(q);
        if (!shape.matches()) {
            return ScopeCheck.violation("Query does not have a plain SELECT ... FROM ... WHERE shape");
        }
        if (!shape.group("table").replace("\"", "").equals(table)) {
            return ScopeCheck.violation("Only the " + table + " table may be queried");
        }
        Optional<String> badColumn = selectedColumns(query).stream()
            .filter(column -> !column.equals("*") && !IDENTIFIER.matcher(column).matches())
            .findFirst();
        if (badColumn.isPresent()) {
            return ScopeCheck.violation("Unsupported select expression: " + badColumn.get());
        }
        String where = shape.group("where");
        if (where == null) {
            return ScopeCheck.violation("Query must be restricted to the current user's id");
        }
        return checkPredicates(where, principalId);
    }

    private ScopeCheck checkPredicates(String where, long principalId) {
        boolean scoped = false;
        for (String conjunct : CONJUNCTION.split(where.trim())) {
            Matcher comparison = COMPARISON.matcher(conjunct.trim());
            if (!comparison.matches()) {
                return ScopeCheck.violation("Unsupported predicate: " + conjunct.trim());
            }
            String lhs = comparison.group("lhs");
            String op = comparison.group("op");
            String rhs = comparison.group("rhs").trim();

            if (LITERAL.matcher(lhs).matches()) {
                return ScopeCheck.violation("Literal comparisons such as " + conjunct.trim() + " are not allowed");
            }
            if (!IDENTIFIER.matcher(lhs).matches() || !LITERAL.matcher(rhs).matches()) {
                return ScopeCheck.violation("Predicates must compare a column with a literal: " + conjunct.trim());
            }
            if (isIdColumn(lhs)) {
                if (!isEquality(op)) {
                    return ScopeCheck.violation("The user restriction must be an equality on id");
                }
                if (!rhs.replace("'", "").equals(Long.toString(principalId))) {
                    return ScopeCheck.violation("Query targets another user's record");
                }
                scoped = true;
            } else if (!isEquality(op)) {
                return ScopeCheck.violation("Only equality comparisons are allowed: " + conjunct.trim());
            }
        }
        return scoped
            ? ScopeCheck.ok()
            : ScopeCheck.violation("Query must be restricted to the current user's id");
    }

    private static boolean isEquality(String op) {
        return op.equals("=") || op.equals("==");
    }

    private boolean isIdColumn(String lhs) {
        String bare = lhs.replace("\"", "");
        return bare.equals("id") || bare.equals(table + ".id");
    }

    private static String normalize(String query) {
        String collapsed = WHITESPACE.matcher(query.trim()).replaceAll(" ");
        return TRAILING_TERMINATORS.matcher(collapsed).replaceAll("").toLowerCase(Locale.ROOT);
    }

    private static int countMatches(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
