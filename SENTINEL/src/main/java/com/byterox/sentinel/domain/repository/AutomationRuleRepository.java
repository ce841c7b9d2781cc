package com.byterox.sentinel.domain.repository;

import com.byterox.sentinel.domain.model.AutomationRule;

/**
 * Repository abstraction for automation rules.
 */
public interface AutomationRuleRepository extends EntityRepository<AutomationRule> {
}
