package com.byterox.sentinel.domain.repository;

import com.byterox.sentinel.domain.model.Workflow;

/**
 * Repository abstraction for workflow definitions. Executions live in the history store.
 */
public interface WorkflowRepository extends EntityRepository<Workflow> {
}
