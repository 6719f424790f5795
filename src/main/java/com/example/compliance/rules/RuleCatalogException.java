package com.example.compliance.rules;

/**
 * Raised while building the rule catalog when a rule definition is invalid.
 * The catalog is built at startup, so this prevents the application from starting.
 */
public class RuleCatalogException extends IllegalStateException {

    public RuleCatalogException(String message) {
        super(message);
    }

    public RuleCatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
