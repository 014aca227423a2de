package com.sandy.aiot.alert.digest.aspect;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Logs every digest API call with its arguments and result. Acknowledgment tokens are masked:
 * they are the only credential of a public link.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class ApiLoggingAspect {

    private static final Set<String> SECRET_FIELDS = Set.of("token", "ackToken");
    private static final Pattern TOKEN_QUERY = Pattern.compile("(token=)[^&]*");
    private static final String MASK = "***";

    private final ObjectMapper objectMapper;

    @Around("within(com.sandy.aiot.alert.digest.controller..*) && @within(org.springframework.web.bind.annotation.RestController)")
    public Object logApiCall(ProceedingJoinPoint pjp) throws Throwable {
        long start = System.currentTimeMillis();
        ServletRequestAttributes attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        HttpServletRequest request = attrs != null ? attrs.getRequest() : null;
        String method = request != null ? request.getMethod() : "";
        String uri = request != null ? request.getRequestURI() : "";
        String query = request != null ? maskQuery(request.getQueryString()) : null;

        MethodSignature sig = (MethodSignature) pjp.getSignature();
        Object[] args = pjp.getArgs();
        String[] paramNames = sig.getParameterNames();

        Map<String, Object> argMap = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            Object a = args[i];
            if (a instanceof HttpServletRequest || a instanceof HttpServletResponse) continue;
            String name = paramNames != null && i < paramNames.length ? paramNames[i] : ("arg" + i);
            argMap.put(name, SECRET_FIELDS.contains(name) && a != null ? MASK : a);
        }

        log.info("API Request: method={} uri={} query={} handler={} args={}", method, uri, query, sig.toShortString(), toJson(argMap));

        Object result = null;
        Throwable error = null;
        try {
            result = pjp.proceed();
            return result;
        } catch (Throwable t) {
            error = t;
            throw t;
        } finally {
            long cost = System.currentTimeMillis() - start;
            if (error == null) {
                if (result instanceof ResponseEntity<?> re) {
                    log.info("API Response: method={} uri={} handler={} status={} durationMs={} body={}", method, uri, sig.toShortString(), re.getStatusCode(), cost, toJson(re.getBody()));
                } else {
                    log.info("API Response: method={} uri={} handler={} durationMs={} result={}", method, uri, sig.toShortString(), cost, toJson(result));
                }
            } else {
                log.error("API Error: method={} uri={} handler={} durationMs={} errorType={} message={}", method, uri, sig.toShortString(), cost, error.getClass().getSimpleName(), error.getMessage());
            }
        }
    }

    static String maskQuery(String query) {
        if (query == null) return null;
        return TOKEN_QUERY.matcher(query).replaceAll("$1" + MASK);
    }

    private String toJson(Object obj) {
        if (obj == null) return "null";
        try {
            JsonNode tree = objectMapper.valueToTree(obj);
            maskSecrets(tree);
            String s = objectMapper.writeValueAsString(tree);
            int max = 2000;
            if (s.length() > max) {
                return s.substring(0, max) + "...(" + (s.length() - max) + " more chars)";
            }
            return s;
        } catch (Exception e) {
            return obj.getClass().getSimpleName();
        }
    }

    private void maskSecrets(JsonNode node) {
        if (node instanceof ObjectNode on) {
            for (String field : SECRET_FIELDS) {
                if (on.hasNonNull(field)) on.put(field, MASK);
            }
        }
        if (node != null && node.isContainerNode()) {
            node.forEach(this::maskSecrets);
        }
    }
}
