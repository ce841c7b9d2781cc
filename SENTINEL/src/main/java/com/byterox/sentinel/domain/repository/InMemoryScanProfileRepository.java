package com.byterox.sentinel.domain.repository;

import com.byterox.sentinel.domain.model.ScanProfile;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryScanProfileRepository extends InMemoryEntityRepository<ScanProfile>
        implements ScanProfileRepository {

    public InMemoryScanProfileRepository() {
        super(ScanProfile::getId);
    }
}
