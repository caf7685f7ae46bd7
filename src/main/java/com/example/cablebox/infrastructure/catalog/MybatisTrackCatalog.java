package com.example.cablebox.infrastructure.catalog;

import com.example.cablebox.domain.model.CandidateFilter;
import com.example.cablebox.infrastructure.persistence.entity.TrackEntity;
import com.example.cablebox.infrastructure.persistence.mapper.TrackMapper;
import java.util.Collections;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class MybatisTrackCatalog implements TrackCatalog {

    private final TrackMapper trackMapper;

    public MybatisTrackCatalog(TrackMapper trackMapper) {
        this.trackMapper = trackMapper;
    }

    @Override
    public long count(CandidateFilter filter) {
        return trackMapper.countByFilter(filter);
    }

    @Override
    public List<TrackEntity> findPage(CandidateFilter filter, long offset, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        return trackMapper.selectPageByFilter(filter, Math.max(0L, offset), limit);
    }
}
