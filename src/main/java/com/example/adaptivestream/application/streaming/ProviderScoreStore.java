package com.example.adaptivestream.application.streaming;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;

/**
 * External persistence of provider scores, keyed by provider name, last write wins.
 */
public interface ProviderScoreStore {

    Map<String, Double> load();

    void save(Collection<ProviderScoreEntry> entries);

    ProviderScoreStore NONE = new ProviderScoreStore() {
        @Override
        public Map<String, Double> load() {
            return Collections.emptyMap();
        }

        @Override
        public void save(Collection<ProviderScoreEntry> entries) {
        }
    };
}
