package com.byterox.sentinel.domain.repository;

import com.byterox.sentinel.domain.model.NotificationRule;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryNotificationRuleRepository extends InMemoryEntityRepository<NotificationRule>
        implements NotificationRuleRepository {

    public InMemoryNotificationRuleRepository() {
        super(NotificationRule::getId);
    }
}
