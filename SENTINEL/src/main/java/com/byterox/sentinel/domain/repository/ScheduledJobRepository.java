package com.byterox.sentinel.domain.repository;

import com.byterox.sentinel.domain.model.ScheduledJob;

/**
 * Repository abstraction for scheduled job persistence.
 */
public interface ScheduledJobRepository extends EntityRepository<ScheduledJob> {
}
