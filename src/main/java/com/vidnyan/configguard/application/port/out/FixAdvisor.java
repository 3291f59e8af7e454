package com.vidnyan.configguard.application.port.out;

/**
 * Port for remediation advice. Total over the rule id space: unknown ids get a generic
 * suggestion instead of an error.
 */
public interface FixAdvisor {

    String fixFor(String ruleId);
}
