package com.vidnyan.configguard.application.port.out;

import com.vidnyan.configguard.domain.rule.RuleSet;
import com.vidnyan.configguard.exception.RuleLoadException;
import org.springframework.core.io.Resource;

/**
 * Port for loading rule definitions from an explicit rule document.
 */
public interface RuleRepository {

    /**
     * Load and validate every rule in the document, preserving document order.
     *
     * @throws RuleLoadException if the document is missing, malformed, or any entry is invalid
     */
    RuleSet load(Resource source);
}
