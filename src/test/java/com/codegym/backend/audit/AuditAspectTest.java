package com.codegym.backend.audit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Map;
import java.util.Optional;

import org.aspectj.lang.ProceedingJoinPoint;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.codegym.backend.enums.AuditEventStatus;
import com.codegym.backend.exceptions.ConflictException;
import com.codegym.backend.security.SecurityService;
import com.codegym.backend.services.AuditService;

@ExtendWith(MockitoExtension.class)
class AuditAspectTest {

    @Mock
    private AuditService auditService;

    @Mock
    private SecurityService securityService;

    @Mock
    private ProceedingJoinPoint joinPoint;

    @InjectMocks
    private AuditAspect auditAspect;

    record Saved(String id) {
    }

    @Auditable(action = "PACKAGE_DELETED", entityType = "MembershipPackage")
    void annotated() {
    }

    private Auditable auditable() throws NoSuchMethodException {
        return AuditAspectTest.class.getDeclaredMethod("annotated").getAnnotation(Auditable.class);
    }

    @Test
    void audit_success_recordsActorAndEntityId() throws Throwable {
        Saved saved = new Saved("42");
        when(securityService.getCurrentUsername()).thenReturn(Optional.of("cashier"));
        when(joinPoint.getArgs()).thenReturn(new Object[] {7, "secret-body"});
        when(joinPoint.proceed()).thenReturn(saved);

        Object result = auditAspect.audit(joinPoint, auditable());

        assertSame(saved, result);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, Object>> details = ArgumentCaptor.forClass(Map.class);
        verify(auditService).createEvent(eq("cashier"), isNull(), eq("PACKAGE_DELETED"), eq("42"),
                eq("MembershipPackage"), details.capture(), eq(AuditEventStatus.SUCCESS));

        @SuppressWarnings("unchecked")
        Map<String, Object> arguments = (Map<String, Object>) details.getValue().get("arguments");
        assertEquals("7", arguments.get("arg0"));
        assertEquals("String", arguments.get("arg1_type"));
    }

    @Test
    void audit_failure_recordsFailureAndRethrows() throws Throwable {
        when(securityService.getCurrentUsername()).thenReturn(Optional.empty());
        when(joinPoint.getArgs()).thenReturn(new Object[0]);
        when(joinPoint.proceed()).thenThrow(new ConflictException("Package has invoices"));

        assertThrows(ConflictException.class, () -> auditAspect.audit(joinPoint, auditable()));

        verify(auditService).createEvent(eq(AuditAspect.ANONYMOUS), isNull(), eq("PACKAGE_DELETED"), isNull(),
                eq("MembershipPackage"), anyMap(), eq(AuditEventStatus.FAILURE));
    }
}
