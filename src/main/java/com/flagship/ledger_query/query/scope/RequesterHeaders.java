package com.flagship.ledger_query.query.scope;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads the requester identity set by the authenticating gateway in front of this service.
 *
 * Headers:
 * - X-Requester-Account-Id: the requester's own account (absent: anonymous)
 * - X-Requester-Root: "true" for root users
 * - X-Requester-Admin-Of: comma-separated ids of administered accounts
 * - X-Requester-Scopes: comma-separated scopes of a delegated token (absent: full session)
 */
@Component
public class RequesterHeaders {

    public static final String ACCOUNT_ID_HEADER = "X-Requester-Account-Id";
    public static final String ROOT_HEADER = "X-Requester-Root";
    public static final String ADMIN_OF_HEADER = "X-Requester-Admin-Of";
    public static final String SCOPES_HEADER = "X-Requester-Scopes";

    public Requester fromRequest(HttpServletRequest request) {
        String accountId = request.getHeader(ACCOUNT_ID_HEADER);
        if (accountId == null || accountId.isBlank()) {
            return Requester.anonymous();
        }

        String scopes = request.getHeader(SCOPES_HEADER);
        return Requester.builder()
            .accountId(parseId(accountId))
            .root(Boolean.parseBoolean(request.getHeader(ROOT_HEADER)))
            .adminOfAccountIds(splitIds(request.getHeader(ADMIN_OF_HEADER)))
            .scopes(scopes != null ? splitValues(scopes) : null)
            .build();
    }

    private static Set<Long> splitIds(String header) {
        return splitValues(header).stream()
            .map(RequesterHeaders::parseId)
            .collect(Collectors.toUnmodifiableSet());
    }

    private static Set<String> splitValues(String header) {
        if (header == null || header.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(header.split(","))
            .map(String::trim)
            .filter(value -> !value.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
    }

    private static Long parseId(String value) {
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid account id in requester headers: " + value, e);
        }
    }
}
