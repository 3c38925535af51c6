package uk.gegc.eventpay.shared.api.problem;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;

import java.net.URI;
import java.time.Instant;

/**
 * Builds the RFC 7807 bodies for every error response, so webhook rejections and security
 * failures carry the same fields.
 */
public final class ProblemDetailBuilder {

    /** Request attribute holding the delivery's correlation id once a webhook endpoint has resolved it. */
    public static final String REQUEST_ID_ATTRIBUTE = "eventpay.requestId";

    private ProblemDetailBuilder() {
    }

    /**
     * @param request used for {@code instance} and, when a webhook endpoint has set one, {@code requestId};
     *                may be {@code null}
     */
    public static ProblemDetail create(HttpStatus status, URI type, String title, String detail,
                                       HttpServletRequest request) {
        ProblemDetail problem = ProblemDetail.forStatus(status);
        problem.setType(type);
        problem.setTitle(title);
        problem.setDetail(detail);
        problem.setProperty("timestamp", Instant.now());
        if (request == null) {
            return problem;
        }

        problem.setInstance(URI.create(request.getRequestURI()));
        String requestId = requestId(request);
        if (requestId != null) {
            problem.setProperty("requestId", requestId);
        }
        return problem;
    }

    public static String requestId(HttpServletRequest request) {
        Object value = request.getAttribute(REQUEST_ID_ATTRIBUTE);
        return value == null ? null : value.toString();
    }
}
