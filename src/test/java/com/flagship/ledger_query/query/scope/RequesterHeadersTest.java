package com.flagship.ledger_query.query.scope;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RequesterHeadersTest {

    private final RequesterHeaders requesterHeaders = new RequesterHeaders();

    @Test
    @DisplayName("No account header means anonymous")
    void anonymous() {
        Requester requester = requesterHeaders.fromRequest(new MockHttpServletRequest());

        assertFalse(requester.isAuthenticated());
        assertSame(Requester.anonymous(), requester);
    }

    @Test
    @DisplayName("Full session: no scopes header, unrestricted scopes")
    void fullSession() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(RequesterHeaders.ACCOUNT_ID_HEADER, "10");
        request.addHeader(RequesterHeaders.ADMIN_OF_HEADER, "20, 21");

        Requester requester = requesterHeaders.fromRequest(request);

        assertEquals(10L, requester.getAccountId());
        assertFalse(requester.isRoot());
        assertEquals(Set.of(20L, 21L), requester.getAdminOfAccountIds());
        assertNull(requester.getScopes());
        assertTrue(new RequesterPermissionChecker().hasScope(requester, PermissionChecker.INCOGNITO_SCOPE));
    }

    @Test
    @DisplayName("Delegated token: only the listed scopes are granted")
    void delegatedToken() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(RequesterHeaders.ACCOUNT_ID_HEADER, "10");
        request.addHeader(RequesterHeaders.ROOT_HEADER, "true");
        request.addHeader(RequesterHeaders.SCOPES_HEADER, "transactions");

        Requester requester = requesterHeaders.fromRequest(request);
        PermissionChecker permissions = new RequesterPermissionChecker();

        assertTrue(permissions.isRoot(requester));
        assertFalse(permissions.hasScope(requester, PermissionChecker.INCOGNITO_SCOPE));
        assertTrue(permissions.hasScope(requester, "transactions"));
    }

    @Test
    @DisplayName("Malformed account ids are rejected")
    void malformedId() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader(RequesterHeaders.ACCOUNT_ID_HEADER, "ten");

        assertThrows(IllegalArgumentException.class, () -> requesterHeaders.fromRequest(request));
    }
}
