package com.forum.infrastructure.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forum.adapter.in.web.ErrorResponse;
import com.forum.application.port.out.UserRepository;
import com.forum.domain.model.User;
import com.forum.domain.model.UserId;
import com.forum.domain.model.Viewer;
import com.forum.infrastructure.context.RequestContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Establishes the viewer of each request from the {@code X-User-Id} header. No header means an anonymous
 * viewer; a header that is not a positive integer is rejected. Known users are upserted on first sight and
 * their moderator flag is read back from storage.
 */
@Component
@Order(1)
public class AuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AuthFilter.class);

    private static final String USER_ID_HEADER = "X-User-Id";
    private static final String REQUEST_ID_HEADER = "X-Request-Id";

    private final UserRepository userRepository;
    private final ObjectMapper objectMapper;

    public AuthFilter(UserRepository userRepository, ObjectMapper objectMapper) {
        this.userRepository = userRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {

        String requestId = requestIdOf(request);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        String userIdHeader = request.getHeader(USER_ID_HEADER);
        Viewer viewer = Viewer.anonymous();
        if (userIdHeader != null && !userIdHeader.isBlank()) {
            var userIdResult = UserId.parse(userIdHeader);
            if (userIdResult.isFailure()) {
                var error = userIdResult.errorOrNull();
                log.warn("Rejecting {} {}: {}", request.getMethod(), request.getRequestURI(), error.message());
                response.setStatus(HttpServletResponse.SC_BAD_REQUEST);
                response.setContentType(MediaType.APPLICATION_JSON_VALUE);
                objectMapper.writeValue(response.getWriter(),
                    new ErrorResponse(error.code(), error.message(), requestId));
                return;
            }
            viewer = loadViewer(userIdResult.getOrThrow());
        }

        RequestContext.set(viewer, requestId);
        log.debug("{} {} as {}{}", request.getMethod(), request.getRequestURI(),
            viewer.isAuthenticated() ? "user " + viewer.userId() : "anonymous",
            viewer.moderator() ? " (moderator)" : "");

        try {
            filterChain.doFilter(request, response);
        } finally {
            RequestContext.clear();
        }
    }

    private Viewer loadViewer(UserId userId) {
        userRepository.upsert(User.create(userId));
        return userRepository.findById(userId)
            .map(Viewer::of)
            .orElseGet(() -> Viewer.member(userId));
    }

    private static String requestIdOf(HttpServletRequest request) {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        return requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId;
    }
}
