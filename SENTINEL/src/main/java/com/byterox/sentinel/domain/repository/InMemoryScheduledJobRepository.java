package com.byterox.sentinel.domain.repository;

import com.byterox.sentinel.domain.model.ScheduledJob;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryScheduledJobRepository extends InMemoryEntityRepository<ScheduledJob>
        implements ScheduledJobRepository {

    public InMemoryScheduledJobRepository() {
        super(ScheduledJob::getId);
    }
}
