package com.codegym.backend.audit;

import java.lang.reflect.Method;
import java.util.LinkedHashMap;
import java.util.Map;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;
import org.springframework.util.ReflectionUtils;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import com.codegym.backend.entities.AuditEvent;
import com.codegym.backend.enums.AuditEventStatus;
import com.codegym.backend.security.SecurityService;
import com.codegym.backend.services.AuditService;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Aspect
@Component
@RequiredArgsConstructor
public class AuditAspect {

    static final String ANONYMOUS = "ANONYMOUS";

    private final AuditService auditService;
    private final SecurityService securityService;

    @Around("@annotation(auditable)")
    public Object audit(ProceedingJoinPoint joinPoint, Auditable auditable) throws Throwable {
        String actor = securityService.getCurrentUsername().orElse(ANONYMOUS);
        String ipAddress = resolveClientIp();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("arguments", describeArguments(joinPoint.getArgs()));
        AuditEventStatus status = AuditEventStatus.SUCCESS;
        String entityId = null;

        try {
            Object result = joinPoint.proceed();
            entityId = extractEntityId(result);
            return result;
        } catch (Throwable e) {
            status = AuditEventStatus.FAILURE;
            details.put("error", e.getMessage());
            details.put("errorType", e.getClass().getSimpleName());
            throw e;
        } finally {
            AuditEvent event = auditService.createEvent(
                    actor,
                    ipAddress,
                    auditable.action(),
                    entityId,
                    auditable.entityType(),
                    details,
                    status
            );
            auditService.logEvent(event);
        }
    }

    private String resolveClientIp() {
        if (!(RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attributes)) {
            return null;
        }
        HttpServletRequest request = attributes.getRequest();
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    // works for both Lombok getters and record accessors
    private String extractEntityId(Object result) {
        if (result == null) return null;
        for (String accessor : new String[] {"getId", "id"}) {
            Method method = ReflectionUtils.findMethod(result.getClass(), accessor);
            if (method == null || method.getParameterCount() != 0) {
                continue;
            }
            try {
                Object id = method.invoke(result);
                return id != null ? id.toString() : null;
            } catch (ReflectiveOperationException e) {
                log.debug("Could not read id from {}: {}", result.getClass().getSimpleName(), e.getMessage());
                return null;
            }
        }
        return null;
    }

    // request bodies may hold passwords, so only scalars are recorded by value
    private Map<String, Object> describeArguments(Object[] args) {
        Map<String, Object> described = new LinkedHashMap<>();
        if (args == null) return described;
        for (int i = 0; i < args.length; i++) {
            Object arg = args[i];
            if (arg == null) continue;
            if (arg instanceof Number || arg instanceof Boolean || arg instanceof java.util.UUID) {
                described.put("arg" + i, arg.toString());
            } else {
                described.put("arg" + i + "_type", arg.getClass().getSimpleName());
            }
        }
        return described;
    }
}
