package com.example.adaptivestream.application.service;

import com.example.adaptivestream.api.response.ProviderStatusResponse;
import com.example.adaptivestream.application.streaming.ProviderRegistry;
import com.example.adaptivestream.common.exception.BusinessException;
import com.example.adaptivestream.common.util.Clock;
import com.example.adaptivestream.domain.model.Provider;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class ProviderAdminService {

    private final ProviderRegistry providerRegistry;
    private final Clock clock;

    public ProviderAdminService(ProviderRegistry providerRegistry, Clock clock) {
        this.providerRegistry = providerRegistry;
        this.clock = clock;
    }

    public List<ProviderStatusResponse> listProviders() {
        List<ProviderStatusResponse> result = new ArrayList<>();
        for (Provider provider : providerRegistry.snapshot()) {
            result.add(toResponse(provider));
        }
        return result;
    }

    public ProviderStatusResponse disable(String name) {
        requireKnown(name);
        return toResponse(providerRegistry.disable(name));
    }

    public ProviderStatusResponse enable(String name) {
        requireKnown(name);
        return toResponse(providerRegistry.reenable(name));
    }

    private void requireKnown(String name) {
        if (!providerRegistry.contains(name)) {
            throw new BusinessException("404", "Provider not found", "Check the provider list");
        }
    }

    private ProviderStatusResponse toResponse(Provider provider) {
        return new ProviderStatusResponse(
                provider.getName(),
                provider.getDisplayName(),
                provider.getUrlTemplate(),
                provider.getScore(),
                provider.getConsecutiveFailures(),
                provider.isDisabled(),
                provider.isCoolingDown(clock.nowMs()),
                provider.getCooldownUntilMs(),
                provider.getLastSuccessAtMs());
    }
}
