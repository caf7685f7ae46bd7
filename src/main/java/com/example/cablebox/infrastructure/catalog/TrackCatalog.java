package com.example.cablebox.infrastructure.catalog;

import com.example.cablebox.domain.model.CandidateFilter;
import com.example.cablebox.infrastructure.persistence.entity.TrackEntity;
import java.util.List;

/**
 * Read access to the imported track catalog.
 */
public interface TrackCatalog {

    long count(CandidateFilter filter);

    /** Matching rows ordered by id ascending, starting at {@code offset}. */
    List<TrackEntity> findPage(CandidateFilter filter, long offset, int limit);
}
