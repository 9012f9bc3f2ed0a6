package com.phillippitts.tempokey.config.logging;

import com.phillippitts.tempokey.config.properties.AdminProperties;
import com.phillippitts.tempokey.service.security.CallerContext;
import com.phillippitts.tempokey.service.security.CallerContextResolver;
import com.phillippitts.tempokey.service.security.Role;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MdcFilterTest {

    private MdcFilter filter;
    private HttpServletRequest request;
    private HttpServletResponse response;
    private FilterChain chain;

    @BeforeEach
    void setUp() {
        AdminProperties admins = new AdminProperties(List.of("curator-1"), List.of("root-1"));
        filter = new MdcFilter(new CallerContextResolver(admins));
        request = mock(HttpServletRequest.class);
        response = mock(HttpServletResponse.class);
        chain = mock(FilterChain.class);
        ThreadContext.clearAll();
    }

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
    }

    @Test
    void populatesContextDuringChain() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-xyz");
        when(request.getHeader("X-User-ID")).thenReturn(" curator-1 ");
        when(request.getMethod()).thenReturn("GET");
        when(request.getRequestURI()).thenReturn("/api/tempo/tracks/trk-1");

        doAnswer(invocation -> {
            Map<String, String> ctx = ThreadContext.getContext();
            assertThat(ctx).containsEntry("requestId", "req-xyz");
            assertThat(ctx).containsEntry("userId", "curator-1");
            assertThat(ctx).containsEntry("roles", "ADMIN");
            assertThat(ctx).containsEntry("method", "GET");
            assertThat(ctx).containsEntry("uri", "/api/tempo/tracks/trk-1");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(chain).doFilter(request, response);
        verify(request).setAttribute(eq(MdcFilter.CALLER_ATTRIBUTE),
                argThat(c -> c instanceof CallerContext caller && "curator-1".equals(caller.userId())
                        && caller.has(Role.ADMIN) && !caller.has(Role.SUPER_ADMIN)));
        assertThat(ThreadContext.isEmpty()).isTrue();
    }

    @Test
    void superUserRolesAreListedInContext() throws ServletException, IOException {
        when(request.getHeader("X-User-ID")).thenReturn("root-1");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("roles")).isEqualTo("ADMIN,SUPER_ADMIN");
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(request).setAttribute(eq(MdcFilter.CALLER_ATTRIBUTE),
                argThat(c -> c instanceof CallerContext caller && caller.has(Role.SUPER_ADMIN)));
    }

    @Test
    void unknownUserIsIdentifiedWithoutRoles() throws ServletException, IOException {
        when(request.getHeader("X-User-ID")).thenReturn("listener-9");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("userId")).isEqualTo("listener-9");
            assertThat(ThreadContext.containsKey("roles")).isFalse();
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(request).setAttribute(eq(MdcFilter.CALLER_ATTRIBUTE),
                argThat(c -> c instanceof CallerContext caller && caller.roles().isEmpty()));
    }

    @Test
    void echoesRequestIdOnResponse() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-echo");

        filter.doFilter(request, response, chain);

        verify(response).setHeader("X-Request-ID", "req-echo");
    }

    @Test
    void generatesRequestIdWhenMissing() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("  ");

        doAnswer(invocation -> {
            assertThat(ThreadContext.get("requestId")).isNotBlank().hasSize(36);
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(response).setHeader(eq("X-Request-ID"), anyString());
    }

    @Test
    void omitsUserIdWhenAnonymous() throws ServletException, IOException {
        doAnswer(invocation -> {
            assertThat(ThreadContext.containsKey("userId")).isFalse();
            assertThat(ThreadContext.containsKey("roles")).isFalse();
            return null;
        }).when(chain).doFilter(any(), any());

        filter.doFilter(request, response, chain);

        verify(request).setAttribute(MdcFilter.CALLER_ATTRIBUTE, CallerContext.anonymous());
    }

    @Test
    void clearsContextWhenChainThrows() throws ServletException, IOException {
        when(request.getHeader("X-Request-ID")).thenReturn("req-fail");
        doThrow(new IOException("client gone")).when(chain).doFilter(request, response);

        assertThatThrownBy(() -> filter.doFilter(request, response, chain))
                .isInstanceOf(IOException.class);

        assertThat(ThreadContext.get("requestId")).isNull();
    }

    @Test
    void passesThroughNonHttpRequests() throws ServletException, IOException {
        ServletRequest plain = mock(ServletRequest.class);

        filter.doFilter(plain, response, chain);

        verify(chain).doFilter(plain, response);
        assertThat(ThreadContext.isEmpty()).isTrue();
    }
}
