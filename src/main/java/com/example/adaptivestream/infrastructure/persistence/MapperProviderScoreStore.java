package com.example.adaptivestream.infrastructure.persistence;

import com.example.adaptivestream.application.streaming.ProviderScoreEntry;
import com.example.adaptivestream.application.streaming.ProviderScoreStore;
import com.example.adaptivestream.infrastructure.persistence.entity.ProviderScoreEntity;
import com.example.adaptivestream.infrastructure.persistence.mapper.ProviderScoreMapper;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider scores in the {@code provider_score} table.
 */
public class MapperProviderScoreStore implements ProviderScoreStore {

    private final ProviderScoreMapper providerScoreMapper;

    public MapperProviderScoreStore(ProviderScoreMapper providerScoreMapper) {
        this.providerScoreMapper = providerScoreMapper;
    }

    @Override
    public Map<String, Double> load() {
        List<ProviderScoreEntity> rows = providerScoreMapper.selectAll();
        Map<String, Double> scores = new LinkedHashMap<>();
        if (rows == null) {
            return scores;
        }
        for (ProviderScoreEntity row : rows) {
            if (row.getProviderName() != null && row.getScore() != null) {
                scores.put(row.getProviderName(), row.getScore());
            }
        }
        return scores;
    }

    @Override
    public void save(Collection<ProviderScoreEntry> entries) {
        for (ProviderScoreEntry entry : entries) {
            ProviderScoreEntity entity = new ProviderScoreEntity();
            entity.setProviderName(entry.getProviderName());
            entity.setScore(entry.getScore());
            entity.setConsecutiveFailures(entry.getConsecutiveFailures());
            providerScoreMapper.upsert(entity);
        }
    }
}
