package com.phillippitts.groundstation.config.logging;

import com.phillippitts.groundstation.config.WebSocketConfig;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags log lines of an inbound HTTP request with the ground station's MDC keys.
 *
 * <ul>
 *   <li>requestId: the X-Request-ID header, or a generated UUID</li>
 *   <li>deviceId: the X-Device-ID header; the text endpoint replaces it with the body's
 *       device_id</li>
 *   <li>channel: {@code satellite} for the satellite WebSocket upgrade, {@code http} otherwise</li>
 *   <li>remote: client address, on satellite upgrades only</li>
 *   <li>method and uri</li>
 * </ul>
 *
 * <p>Header values that are not plain identifiers are ignored so clients cannot forge log lines.
 * The context is cleared once the request completes.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String DEVICE_ID_HEADER = "X-Device-ID";

    private static final Pattern SAFE_VALUE = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        try {
            if (request instanceof HttpServletRequest http) {
                String requestId = safeHeader(http, REQUEST_ID_HEADER);
                ThreadContext.put("requestId", requestId != null ? requestId : UUID.randomUUID().toString());

                String deviceId = safeHeader(http, DEVICE_ID_HEADER);
                if (deviceId != null) {
                    ThreadContext.put("deviceId", deviceId);
                }

                if (isSatelliteUpgrade(http)) {
                    ThreadContext.put("channel", "satellite");
                    ThreadContext.put("remote", http.getRemoteAddr() + ":" + http.getRemotePort());
                } else {
                    ThreadContext.put("channel", "http");
                }
                ThreadContext.put("method", http.getMethod());
                ThreadContext.put("uri", http.getRequestURI());
            }
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    static boolean isSatelliteUpgrade(HttpServletRequest request) {
        return WebSocketConfig.SATELLITE_PATH.equals(request.getRequestURI())
                && "websocket".equalsIgnoreCase(request.getHeader("Upgrade"));
    }

    private static String safeHeader(HttpServletRequest request, String name) {
        String value = request.getHeader(name);
        if (value == null) {
            return null;
        }
        value = value.trim();
        return SAFE_VALUE.matcher(value).matches() ? value : null;
    }
}
