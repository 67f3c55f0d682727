package com.example.adaptivestream.infrastructure.security;

import com.example.adaptivestream.common.config.AppSecurityProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.context.SecurityContextHolder;

class ApiTokenAuthFilterTest {

    private ApiTokenAuthFilter filter;

    @BeforeEach
    void setUp() {
        AppSecurityProperties properties = new AppSecurityProperties();
        properties.setApiToken("secret-token");
        filter = new ApiTokenAuthFilter(properties);
    }

    @AfterEach
    void tearDown() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void shouldAuthenticateMatchingBearerToken() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/providers");
        request.addHeader("Authorization", "Bearer secret-token");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        Assertions.assertEquals(200, response.getStatus());
        Assertions.assertNotNull(chain.getRequest());
        Assertions.assertNotNull(SecurityContextHolder.getContext().getAuthentication());
    }

    @Test
    void shouldRejectMissingOrWrongToken() throws Exception {
        MockHttpServletRequest missing = new MockHttpServletRequest("GET", "/api/v1/sessions/abc");
        MockHttpServletResponse missingResponse = new MockHttpServletResponse();
        MockFilterChain missingChain = new MockFilterChain();
        filter.doFilter(missing, missingResponse, missingChain);

        Assertions.assertEquals(401, missingResponse.getStatus());
        Assertions.assertNull(missingChain.getRequest());
        Assertions.assertTrue(missingResponse.getContentAsString().contains("AUTH_MISSING_TOKEN"));

        MockHttpServletRequest wrong = new MockHttpServletRequest("GET", "/api/v1/sessions/abc");
        wrong.addHeader("Authorization", "Bearer other-token");
        MockHttpServletResponse wrongResponse = new MockHttpServletResponse();
        filter.doFilter(wrong, wrongResponse, new MockFilterChain());

        Assertions.assertEquals(401, wrongResponse.getStatus());
        Assertions.assertTrue(wrongResponse.getContentAsString().contains("AUTH_ACCESS_TOKEN_INVALID"));
        Assertions.assertNotNull(wrongResponse.getHeader("WWW-Authenticate"));
    }

    @Test
    void shouldSkipHealthEndpoint() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/actuator/health");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        Assertions.assertNotNull(chain.getRequest());
        Assertions.assertNull(SecurityContextHolder.getContext().getAuthentication());
    }
}
