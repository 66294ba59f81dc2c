package com.williamcallahan.photo_print_preview;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Logs print-preview API calls with upload size and render time
 *
 * @author William Callahan
 *
 * Features:
 * - Ignores everything outside /api
 * - Records the uploaded body size so slow renders can be traced to large photos
 * - Warns when a request runs past the slow-render threshold
 */
@Component
public class RequestLoggingFilter implements Filter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);
    private static final long SLOW_RENDER_MS = 2000;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        HttpServletRequest httpRequest = (HttpServletRequest) request;
        String path = httpRequest.getRequestURI();
        if (!path.startsWith("/api")) {
            chain.doFilter(request, response);
            return;
        }

        long uploadBytes = httpRequest.getContentLengthLong();
        long started = System.currentTimeMillis();
        logger.debug("{} {} started ({} bytes uploaded)", httpRequest.getMethod(), path, Math.max(uploadBytes, 0));
        try {
            chain.doFilter(request, response);
        } finally {
            long elapsed = System.currentTimeMillis() - started;
            int status = response instanceof HttpServletResponse httpResponse ? httpResponse.getStatus() : 0;
            if (elapsed > SLOW_RENDER_MS) {
                logger.warn("{} {} -> {} took {} ms for a {} byte upload", httpRequest.getMethod(), path, status, elapsed, uploadBytes);
            } else {
                logger.info("{} {} -> {} in {} ms", httpRequest.getMethod(), path, status, elapsed);
            }
        }
    }
}
