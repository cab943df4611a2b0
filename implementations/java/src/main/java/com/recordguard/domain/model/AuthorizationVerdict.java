package com.recordguard.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decision of the authorization stage for one request.
 *
 * <p>A candidate query only survives construction when {@code authorized}
 * is true. Scoping the query to the current principal is a policy of the
 * stage, not of this type.
 */
@Value
public class AuthorizationVerdict {

    boolean authorized;
    String reason;
    Set<String> sensitiveFields;
    String candidateQuery;

    @Builder(toBuilder = true)
    public AuthorizationVerdict(
            boolean authorized,
            String reason,
            Set<String> sensitiveFields,
            String candidateQuery) {
        this.authorized = authorized;
        this.reason = reason == null ? "" : reason;
        this.sensitiveFields = sensitiveFields == null ? Set.of() : sensitiveFields.stream()
            .map(field -> field.trim().toLowerCase(Locale.ROOT))
            .filter(field -> !field.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
        this.candidateQuery = authorized ? candidateQuery : null;
    }

    public Optional<String> getCandidateQuery() {
        return Optional.ofNullable(candidateQuery);
    }

    public static AuthorizationVerdict denied(String reason) {
        return new AuthorizationVerdict(false, reason, Set.of(), null);
    }
}
