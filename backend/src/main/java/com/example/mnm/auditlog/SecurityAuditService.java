package com.example.mnm.auditlog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Writes authentication and authorization events to the {@code audit} logger.
 * Secrets and hashes never reach this class.
 */
@Service
public class SecurityAuditService {

    private static final Logger audit = LoggerFactory.getLogger("audit");

    public void recordRegistration(String userId, String role) {
        audit.info("REGISTERED user={} role={}", userId, role);
    }

    public void recordLoginSuccess(String userId) {
        audit.info("LOGIN_SUCCESS user={}", userId);
    }

    public void recordLoginFailure(String identifier) {
        audit.warn("LOGIN_FAILURE identifier={}", sanitize(identifier));
    }

    public void recordLoginThrottled(String identifier) {
        audit.warn("LOGIN_THROTTLED identifier={}", sanitize(identifier));
    }

    public void recordAccessDenied(String userId, String collection, String recordId, String operation) {
        audit.warn("ACCESS_DENIED user={} collection={} record={} operation={}",
                userId != null ? userId : "anonymous", collection, recordId != null ? recordId : "-", operation);
    }

    public void recordContractStatusChange(String userId, String contractId, String from, String to) {
        audit.info("CONTRACT_STATUS user={} contract={} from={} to={}", userId, contractId, from, to);
    }

    private String sanitize(String identifier) {
        if (identifier == null) {
            return "unknown";
        }
        return identifier.replaceAll("[^a-zA-Z0-9@._-]", "?");
    }
}
