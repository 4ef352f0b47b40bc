package net.readtrack;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Logs method, path, acting user, status and duration of API and admin requests.
 * Actuator endpoints are skipped.
 */
@Component
public class RequestLoggingFilter implements Filter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        HttpServletRequest req = (HttpServletRequest) request;
        String uri = req.getRequestURI();
        if (!uri.startsWith("/api") && !uri.startsWith("/admin")) {
            chain.doFilter(request, response);
            return;
        }
        long startTime = System.currentTimeMillis();
        String user = req.getHeader("X-User-Id");
        logger.info("Incoming request: {} {} from {} (user {})", req.getMethod(), uri, req.getRemoteAddr(),
            user == null ? "-" : user);
        try {
            chain.doFilter(request, response);
        } finally {
            long duration = System.currentTimeMillis() - startTime;
            int status = response instanceof HttpServletResponse http ? http.getStatus() : 0;
            logger.info("Completed request: {} {} with status {} in {} ms", req.getMethod(), uri, status, duration);
        }
    }
}
