package com.vidnyan.configguard.exception;

import lombok.Getter;

/**
 * Rule document could not be turned into a usable rule set. Fatal to the scan:
 * no partial rule set is ever returned.
 */
@Getter
public class RuleLoadException extends RuntimeException {

    private final String source;

    public RuleLoadException(String source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public RuleLoadException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }
}
