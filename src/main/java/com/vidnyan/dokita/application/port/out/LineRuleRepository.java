package com.vidnyan.dokita.application.port.out;

import com.vidnyan.dokita.domain.rule.LineRule;

import java.util.List;

/**
 * Port for loading line rule definitions.
 * Implemented by adapters that read from files, classpath resources, etc.
 */
public interface LineRuleRepository {

    /**
     * All rules, in evaluation order.
     */
    List<LineRule> findAll();
}
