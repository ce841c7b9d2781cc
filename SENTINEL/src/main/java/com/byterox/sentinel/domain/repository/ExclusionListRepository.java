package com.byterox.sentinel.domain.repository;

import com.byterox.sentinel.domain.model.ExclusionList;

public interface ExclusionListRepository extends EntityRepository<ExclusionList> {
}
