package com.byterox.sentinel.domain.repository;

import com.byterox.sentinel.domain.model.NotificationRule;

public interface NotificationRuleRepository extends EntityRepository<NotificationRule> {
}
