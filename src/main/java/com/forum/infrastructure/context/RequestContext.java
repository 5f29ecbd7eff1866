package com.forum.infrastructure.context;

import com.forum.domain.model.Viewer;
import org.slf4j.MDC;

public final class RequestContext {

    private static final String USER_ID_KEY = "userId";
    private static final String REQUEST_ID_KEY = "requestId";
    private static final String ANONYMOUS = "anonymous";

    private static final ThreadLocal<Viewer> currentViewer = new ThreadLocal<>();
    private static final ThreadLocal<String> currentRequestId = new ThreadLocal<>();

    private RequestContext() {}

    public static void set(Viewer viewer, String requestId) {
        currentViewer.set(viewer);
        currentRequestId.set(requestId);
        MDC.put(USER_ID_KEY, viewer.isAuthenticated() ? viewer.userId().toString() : ANONYMOUS);
        MDC.put(REQUEST_ID_KEY, requestId);
    }

    /**
     * The viewer of the current request; anonymous outside of a request.
     */
    public static Viewer getViewer() {
        Viewer viewer = currentViewer.get();
        return viewer != null ? viewer : Viewer.anonymous();
    }

    public static String getRequestId() {
        return currentRequestId.get();
    }

    public static void clear() {
        currentViewer.remove();
        currentRequestId.remove();
        MDC.remove(USER_ID_KEY);
        MDC.remove(REQUEST_ID_KEY);
    }
}
