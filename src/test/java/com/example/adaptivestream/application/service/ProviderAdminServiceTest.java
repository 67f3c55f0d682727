package com.example.adaptivestream.application.service;

import com.example.adaptivestream.api.response.ProviderStatusResponse;
import com.example.adaptivestream.application.streaming.ProviderRegistry;
import com.example.adaptivestream.application.streaming.ProviderScoreStore;
import com.example.adaptivestream.common.config.AppProviderProperties;
import com.example.adaptivestream.common.exception.BusinessException;
import com.example.adaptivestream.support.FakeClock;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProviderAdminServiceTest {

    private ProviderRegistry registry;
    private ProviderAdminService service;

    @BeforeEach
    void setUp() {
        AppProviderProperties properties = new AppProviderProperties();
        properties.setTieJitter(0D);
        properties.setEndpoints(Arrays.asList(
                new AppProviderProperties.Endpoint("alpha", "Alpha", "https://alpha.test/ipfs/{contentId}"),
                new AppProviderProperties.Endpoint("beta", "Beta", "https://{contentId}.beta.test")));
        FakeClock clock = new FakeClock(10_000L);
        registry = new ProviderRegistry(properties, ProviderScoreStore.NONE, clock, new Random(5L));
        service = new ProviderAdminService(registry, clock);
    }

    @Test
    void shouldListProvidersInConfigurationOrder() {
        List<ProviderStatusResponse> providers = service.listProviders();

        Assertions.assertEquals(2, providers.size());
        Assertions.assertEquals("alpha", providers.get(0).getName());
        Assertions.assertEquals("Beta", providers.get(1).getDisplayName());
        Assertions.assertEquals(1D, providers.get(0).getScore(), 1e-9);
        Assertions.assertFalse(providers.get(0).getDisabled());
    }

    @Test
    void shouldDisableAndReenableProvider() {
        ProviderStatusResponse disabled = service.disable("alpha");
        Assertions.assertTrue(disabled.getDisabled());
        Assertions.assertEquals("beta", registry.rank(Collections.<String>emptySet()).get(0).getName());
        Assertions.assertEquals(1, registry.rank(Collections.<String>emptySet()).size());

        ProviderStatusResponse enabled = service.enable("alpha");
        Assertions.assertFalse(enabled.getDisabled());
        Assertions.assertEquals(2, registry.rank(Collections.<String>emptySet()).size());
    }

    @Test
    void shouldRejectUnknownProvider() {
        BusinessException e = Assertions.assertThrows(BusinessException.class, () -> service.disable("nope"));
        Assertions.assertEquals("404", e.getCode());
        Assertions.assertThrows(BusinessException.class, () -> service.enable(null));
    }
}
