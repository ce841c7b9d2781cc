package com.byterox.sentinel.domain.repository;

import com.byterox.sentinel.domain.model.ScanProfile;

public interface ScanProfileRepository extends EntityRepository<ScanProfile> {
}
