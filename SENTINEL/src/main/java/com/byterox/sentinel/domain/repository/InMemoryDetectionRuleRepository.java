package com.byterox.sentinel.domain.repository;

import com.byterox.sentinel.domain.model.DetectionRule;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryDetectionRuleRepository extends InMemoryEntityRepository<DetectionRule>
        implements DetectionRuleRepository {

    public InMemoryDetectionRuleRepository() {
        super(DetectionRule::getId);
    }
}
