package com.byterox.sentinel.domain.repository;

import com.byterox.sentinel.domain.model.DetectionRule;

public interface DetectionRuleRepository extends EntityRepository<DetectionRule> {
}
