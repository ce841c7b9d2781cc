package com.byterox.sentinel.domain.repository;

import com.byterox.sentinel.domain.model.Workflow;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryWorkflowRepository extends InMemoryEntityRepository<Workflow>
        implements WorkflowRepository {

    public InMemoryWorkflowRepository() {
        super(Workflow::getId);
    }
}
