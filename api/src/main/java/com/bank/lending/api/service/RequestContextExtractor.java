package com.bank.lending.api.service;

import com.bank.lending.application.model.RequestMetadata;
import com.bank.lending.domain.geolocation.GeolocationService;
import com.bank.lending.domain.model.Actor;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

/**
 * Extracts the calling user and client details from the HTTP request.
 * Authentication happens upstream; the gateway forwards the user as {@code X-User-Id} / {@code X-User-Name}.
 */
@Component
public class RequestContextExtractor {

    private static final Logger log = LoggerFactory.getLogger(RequestContextExtractor.class);

    static final String USER_ID_HEADER = "X-User-Id";
    static final String USER_NAME_HEADER = "X-User-Name";

    private final GeolocationService geolocationService;

    public RequestContextExtractor(GeolocationService geolocationService) {
        this.geolocationService = geolocationService;
    }

    /**
     * Id of the authenticated user
     *
     * @throws ResponseStatusException 401 when the request carries no usable user id
     */
    public Long requireUserId(HttpServletRequest request) {
        String userId = request.getHeader(USER_ID_HEADER);
        if (userId == null) {
            userId = request.getHeader("user-id");
        }
        if (userId == null || userId.isBlank()) {
            log.warn("Request to {} without user context", request.getRequestURI());
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Usuario no autenticado");
        }
        try {
            return Long.valueOf(userId.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid user id header '{}'", userId);
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Usuario no autenticado", e);
        }
    }

    public Actor actor(HttpServletRequest request) {
        Long userId = requireUserId(request);
        String name = request.getHeader(USER_NAME_HEADER);
        return Actor.of(userId, name != null && !name.isBlank() ? name : "Usuario " + userId);
    }

    /**
     * Client IP, user agent and approximate location; must be called outside any transaction
     */
    public RequestMetadata metadata(HttpServletRequest request) {
        String ip = getClientIp(request);
        return new RequestMetadata(ip, request.getHeader("User-Agent"), geolocationService.locate(ip).orElse(null));
    }

    /**
     * Client IP, honouring proxy headers. Only the first X-Forwarded-For hop is used.
     */
    String getClientIp(HttpServletRequest request) {
        String ip = request.getHeader("X-Forwarded-For");
        if (ip != null && !ip.isEmpty() && !"unknown".equalsIgnoreCase(ip)) {
            return ip.split(",")[0].trim();
        }
        ip = request.getHeader("X-Real-IP");
        if (ip == null || ip.isEmpty() || "unknown".equalsIgnoreCase(ip)) {
            ip = request.getRemoteAddr();
        }
        return ip;
    }
}
