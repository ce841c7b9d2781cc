package com.byterox.sentinel.domain.repository;

import com.byterox.sentinel.domain.model.AutomationRule;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryAutomationRuleRepository extends InMemoryEntityRepository<AutomationRule>
        implements AutomationRuleRepository {

    public InMemoryAutomationRuleRepository() {
        super(AutomationRule::getId);
    }
}
