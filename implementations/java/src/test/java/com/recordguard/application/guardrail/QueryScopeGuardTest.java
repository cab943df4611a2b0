package com.recordguard.application.guardrail;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueryScopeGuardTest {

    private static final long PRINCIPAL = 7;

    private final QueryScopeGuard guard = new QueryScopeGuard("users");

    @ParameterizedTest
    @ValueSource(strings = {
        "SELECT address FROM users WHERE id = 7",
        "select first_name, last_name from users where id=7;",
        "SELECT * FROM users WHERE users.id = 7 LIMIT 1",
        "SELECT email FROM users WHERE id = '7' AND first_name = 'John'",
        "SELECT \"ssn\" FROM \"users\" WHERE \"id\" = 7",
        "SELECT date_of_birth\n  FROM users\n WHERE id = 7"
    })
    void acceptsQueriesScopedToThePrincipal(String query) {
        QueryScopeGuard.ScopeCheck check = guard.check(query, PRINCIPAL);

        assertTrue(check.passed(), () -> "expected pass, got: " + check.violation());
        assertNull(check.violation());
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
        "SELECT * FROM users WHERE id = 7 OR 1=1                  | OR conditions",
        "SELECT * FROM users WHERE id = 7 AND 1=1                 | Literal comparisons",
        "SELECT * FROM users WHERE id = 7 AND 'a'='a'             | Literal comparisons",
        "SELECT ssn FROM users WHERE id = 8                       | another user",
        "SELECT * FROM users WHERE id = 7 AND id = 8              | another user",
        "SELECT ssn FROM users                                    | restricted to the current user",
        "SELECT ssn FROM users WHERE first_name = 'John'          | restricted to the current user",
        "SELECT * FROM users WHERE id > 6                         | equality on id",
        "SELECT * FROM users WHERE id = 7 UNION SELECT * FROM users | UNION",
        "SELECT u.ssn FROM users u JOIN users v ON v.id = 7       | JOIN",
        "DELETE FROM users WHERE id = 7                           | Only read-only",
        "SELECT * FROM users WHERE id = 7; DROP TABLE users       | Multiple statements",
        "SELECT * FROM users WHERE id = 7 -- trailing             | comments",
        "SELECT * FROM users WHERE id = 7 /* x */                 | comments",
        "SELECT substr(ssn, 1, 3) FROM users WHERE id = 7         | Subqueries and function calls",
        "SELECT ssn FROM users WHERE id = (SELECT id FROM users LIMIT 1) | Subqueries and function calls",
        "SELECT * FROM users WHERE email LIKE '%a%' AND id = 7    | Pattern predicates",
        "SELECT name FROM sqlite_master WHERE id = 7              | System tables",
        "SELECT * FROM accounts WHERE id = 7                      | Only the users table",
        "SELECT * INTO backup FROM users WHERE id = 7             | modification",
        "SELECT * FROM users WHERE id = 7 AND ssn = first_name    | compare a column with a literal",
        "SELECT * FROM users WHERE id = 7 AND first_name > ''     | Only equality comparisons",
        "SELECT * FROM users WHERE id = 7 AND email != 'x'        | Only equality comparisons",
        "SELECT * FROM users WHERE id = 7 AND email <> 'x'        | Only equality comparisons",
        "SELECT * FROM users WHERE id = 7 AND date_of_birth < '2000-01-01' | Only equality comparisons",
        "SELECT * FROM users WHERE first_name >= 'A' AND id = 7   | Only equality comparisons",
        "SELECT * FROM users WHERE id = 7 AND created_at <= 5     | Only equality comparisons"
    })
    void rejectsQueriesThatCouldEscapeScope(String query, String expectedViolation) {
        QueryScopeGuard.ScopeCheck check = guard.check(query, PRINCIPAL);

        assertFalse(check.passed());
        assertTrue(check.violation().contains(expectedViolation),
            () -> "unexpected violation: " + check.violation());
    }

    @Test
    void rejectsConcatenation() {
        QueryScopeGuard.ScopeCheck check = guard.check("SELECT first_name || ssn FROM users WHERE id = 7", PRINCIPAL);

        assertFalse(check.passed());
        assertTrue(check.violation().contains("concatenation"));
    }

    @Test
    void rejectsEmptyQuery() {
        assertFalse(guard.check("", PRINCIPAL).passed());
        assertFalse(guard.check(null, PRINCIPAL).passed());
    }

    @Test
    void referencesPrincipalRequiresOwnIdOnly() {
        assertTrue(guard.referencesPrincipal("SELECT * FROM users WHERE id = 7", PRINCIPAL));
        assertTrue(guard.referencesPrincipal("SELECT * FROM users WHERE id = 7 OR 1=1", PRINCIPAL));
        assertFalse(guard.referencesPrincipal("SELECT * FROM users WHERE id = 8", PRINCIPAL));
        assertFalse(guard.referencesPrincipal("SELECT * FROM users WHERE id = 7 OR id = 8", PRINCIPAL));
        assertFalse(guard.referencesPrincipal("SELECT * FROM users WHERE user_id = 7", PRINCIPAL));
        assertFalse(guard.referencesPrincipal("SELECT * FROM users WHERE id = 70", PRINCIPAL));
        assertFalse(guard.referencesPrincipal(null, PRINCIPAL));
    }

    @Test
    void selectedColumnsReadsTheSelectList() {
        assertEquals(List.of("first_name", "last_name"),
            guard.selectedColumns("SELECT first_name, last_name FROM users WHERE id = 7"));
        assertEquals(List.of("*"), guard.selectedColumns("select * from users where id = 7"));
        assertTrue(guard.selectedColumns("not a query").isEmpty());
    }
}
