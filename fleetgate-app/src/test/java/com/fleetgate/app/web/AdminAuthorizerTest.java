package com.fleetgate.app.web;

import com.fleetgate.common.error.AccessDeniedException;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.junit.jupiter.api.Assertions.*;

class AdminAuthorizerTest {

    @Test
    void emptyTokenLeavesEndpointsOpen() {
        assertDoesNotThrow(() -> new AdminAuthorizer("").authorize(new MockHttpServletRequest()));
    }

    @Test
    void matchingBearerTokenIsAccepted() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("Authorization", "Bearer s3cret");

        assertDoesNotThrow(() -> new AdminAuthorizer("s3cret").authorize(request));
    }

    @Test
    void missingOrWrongTokenIsDenied() {
        AdminAuthorizer authorizer = new AdminAuthorizer("s3cret");
        MockHttpServletRequest wrong = new MockHttpServletRequest();
        wrong.addHeader("Authorization", "Bearer nope");

        assertThrows(AccessDeniedException.class, () -> authorizer.authorize(new MockHttpServletRequest()));
        assertThrows(AccessDeniedException.class, () -> authorizer.authorize(wrong));
    }
}
