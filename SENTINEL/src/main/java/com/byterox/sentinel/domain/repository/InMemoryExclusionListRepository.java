package com.byterox.sentinel.domain.repository;

import com.byterox.sentinel.domain.model.ExclusionList;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryExclusionListRepository extends InMemoryEntityRepository<ExclusionList>
        implements ExclusionListRepository {

    public InMemoryExclusionListRepository() {
        super(ExclusionList::getId);
    }
}
