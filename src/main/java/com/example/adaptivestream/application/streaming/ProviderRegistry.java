package com.example.adaptivestream.application.streaming;

import com.example.adaptivestream.common.config.AppProviderProperties;
import com.example.adaptivestream.common.util.Clock;
import com.example.adaptivestream.domain.model.Provider;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared table of content providers and their reliability scores.
 *
 * <p>Every state change goes through {@link ConcurrentMap#compute}, so concurrent outcome
 * reports for the same provider never lose an update. Sessions only ever see immutable
 * {@link Provider} snapshots.
 */
public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final AppProviderProperties properties;
    private final ProviderScoreStore scoreStore;
    private final Clock clock;
    private final Random random;
    private final List<String> order;
    private final ConcurrentMap<String, Provider> providers = new ConcurrentHashMap<>();
    private final AtomicBoolean dirty = new AtomicBoolean(false);

    public ProviderRegistry(AppProviderProperties properties, ProviderScoreStore scoreStore, Clock clock, Random random) {
        this.properties = properties;
        this.scoreStore = scoreStore == null ? ProviderScoreStore.NONE : scoreStore;
        this.clock = clock;
        this.random = random;
        List<String> names = new ArrayList<>();
        for (AppProviderProperties.Endpoint endpoint : properties.getEndpoints()) {
            if (endpoint.getName() == null || endpoint.getUrlTemplate() == null) {
                throw new IllegalArgumentException("provider endpoint needs a name and a url template");
            }
            String displayName = endpoint.getDisplayName() == null ? endpoint.getName() : endpoint.getDisplayName();
            Provider previous = providers.putIfAbsent(endpoint.getName(), new Provider(
                    endpoint.getName(), displayName, endpoint.getUrlTemplate(), properties.getInitialScore()));
            if (previous != null) {
                throw new IllegalArgumentException("duplicate provider " + endpoint.getName());
            }
            names.add(endpoint.getName());
        }
        this.order = Collections.unmodifiableList(names);
    }

    /**
     * Restores persisted scores. A store failure leaves the configured initial scores in place.
     */
    public void loadScores() {
        Map<String, Double> persisted;
        try {
            persisted = scoreStore.load();
        } catch (RuntimeException e) {
            log.warn("PROVIDER_SCORE_LOAD_FAILED reason={}", e.getMessage(), e);
            return;
        }
        int restored = 0;
        for (Map.Entry<String, Double> entry : persisted.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            if (providers.computeIfPresent(entry.getKey(), (name, p) -> p.withScore(entry.getValue())) != null) {
                restored++;
            }
        }
        log.info("PROVIDER_SCORE_LOADED providers={} restored={}", providers.size(), restored);
    }

    /**
     * Providers eligible for selection, best first. When nothing qualifies, the non-excluded
     * provider disabled longest ago is returned alone; the list is empty only when every
     * provider is excluded.
     */
    public List<Provider> rank(Set<String> excluding) {
        long now = clock.nowMs();
        double threshold = properties.getDisableThreshold();
        double jitter = Math.max(0D, properties.getTieJitter());
        List<Ranked> eligible = new ArrayList<>();
        List<Provider> fallback = new ArrayList<>();
        for (String name : order) {
            if (excluding != null && excluding.contains(name)) {
                continue;
            }
            Provider provider = providers.get(name);
            if (provider.isEligible(threshold, now)) {
                double noise = jitter > 0D ? random.nextDouble() * jitter : 0D;
                eligible.add(new Ranked(provider, provider.getScore() + noise));
            } else {
                fallback.add(provider);
            }
        }
        if (!eligible.isEmpty()) {
            eligible.sort(Comparator.comparingDouble((Ranked r) -> r.key).reversed()
                    .thenComparing(Comparator.comparingLong((Ranked r) -> r.provider.getLastSuccessAtMs()).reversed()));
            List<Provider> result = new ArrayList<>(eligible.size());
            for (Ranked ranked : eligible) {
                result.add(ranked.provider);
            }
            return result;
        }
        if (fallback.isEmpty()) {
            return Collections.emptyList();
        }
        fallback.sort(Comparator.comparingLong(Provider::getDisabledAtMs));
        Provider lastResort = fallback.get(0);
        log.warn("PROVIDER_LAST_RESORT provider={} excluded={}", lastResort.getName(), excluding);
        return Collections.singletonList(lastResort);
    }

    public Provider reportOutcome(String providerName, boolean success) {
        long now = clock.nowMs();
        Provider updated = providers.compute(providerName, (name, current) -> {
            if (current == null) {
                throw new IllegalArgumentException("unknown provider " + name);
            }
            if (success) {
                return current.withSuccess(properties.getSuccessGain(), now);
            }
            Provider next = current.withFailure(properties.getDecayFactor(), properties.getRetryBudget(),
                    properties.getDisableThreshold(), properties.getCooldownMs(), now);
            if (next.getCooldownUntilMs() != current.getCooldownUntilMs()) {
                log.info("PROVIDER_COOLDOWN_STARTED provider={} failures={} score={} untilMs={}",
                        name, next.getConsecutiveFailures(), next.getScore(), next.getCooldownUntilMs());
            }
            return next;
        });
        dirty.set(true);
        return updated;
    }

    public Provider disable(String providerName) {
        long now = clock.nowMs();
        Provider updated = update(providerName, p -> p.withDisabled(now));
        log.info("PROVIDER_DISABLED provider={}", providerName);
        return updated;
    }

    public Provider reenable(String providerName) {
        Provider updated = update(providerName, Provider::withEnabled);
        log.info("PROVIDER_REENABLED provider={} score={}", providerName, updated.getScore());
        return updated;
    }

    public Provider get(String providerName) {
        Provider provider = providers.get(providerName);
        if (provider == null) {
            throw new IllegalArgumentException("unknown provider " + providerName);
        }
        return provider;
    }

    public boolean contains(String providerName) {
        return providerName != null && providers.containsKey(providerName);
    }

    /**
     * All providers in configuration order.
     */
    public List<Provider> snapshot() {
        List<Provider> result = new ArrayList<>(order.size());
        for (String name : order) {
            result.add(providers.get(name));
        }
        return result;
    }

    /**
     * Writes scores through the store if any changed since the last flush.
     *
     * @return number of entries written
     */
    public int flush() {
        if (!dirty.compareAndSet(true, false)) {
            return 0;
        }
        Map<String, ProviderScoreEntry> entries = new LinkedHashMap<>();
        for (Provider provider : snapshot()) {
            entries.put(provider.getName(), new ProviderScoreEntry(
                    provider.getName(), provider.getScore(), provider.getConsecutiveFailures()));
        }
        Collection<ProviderScoreEntry> values = entries.values();
        try {
            scoreStore.save(values);
        } catch (RuntimeException e) {
            dirty.set(true);
            throw e;
        }
        return values.size();
    }

    public boolean isDirty() {
        return dirty.get();
    }

    private Provider update(String providerName, UnaryOperator<Provider> change) {
        Provider updated = providers.computeIfPresent(providerName, (name, p) -> change.apply(p));
        if (updated == null) {
            throw new IllegalArgumentException("unknown provider " + providerName);
        }
        dirty.set(true);
        return updated;
    }

    private static final class Ranked {

        private final Provider provider;
        private final double key;

        private Ranked(Provider provider, double key) {
            this.provider = provider;
            this.key = key;
        }
    }
}
