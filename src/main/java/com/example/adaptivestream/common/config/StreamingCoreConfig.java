package com.example.adaptivestream.common.config;

import com.example.adaptivestream.application.streaming.ProviderRegistry;
import com.example.adaptivestream.application.streaming.SegmentTransport;
import com.example.adaptivestream.common.util.Clock;
import com.example.adaptivestream.common.util.SystemClock;
import com.example.adaptivestream.infrastructure.http.HttpContentValidator;
import com.example.adaptivestream.infrastructure.http.HttpSegmentTransport;
import com.example.adaptivestream.infrastructure.http.MeteredSegmentTransport;
import com.example.adaptivestream.infrastructure.persistence.MapperProviderScoreStore;
import com.example.adaptivestream.infrastructure.persistence.mapper.ProviderScoreMapper;
import com.example.adaptivestream.infrastructure.persistence.mapper.ValidatedContentMapper;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Random;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StreamingCoreConfig {

    @Bean
    public Clock clock() {
        return new SystemClock();
    }

    @Bean(destroyMethod = "close")
    public CloseableHttpClient streamHttpClient(AppFetchProperties appFetchProperties) {
        RequestConfig requestConfig = RequestConfig.custom()
                .setConnectTimeout(appFetchProperties.getConnectTimeoutMs())
                .setConnectionRequestTimeout(appFetchProperties.getConnectTimeoutMs())
                .setSocketTimeout(appFetchProperties.getSocketTimeoutMs())
                .build();
        PoolingHttpClientConnectionManager cm = new PoolingHttpClientConnectionManager();
        cm.setMaxTotal(appFetchProperties.getMaxConnectionsTotal());
        cm.setDefaultMaxPerRoute(appFetchProperties.getMaxConnectionsPerRoute());
        return HttpClients.custom()
                .setConnectionManager(cm)
                .setDefaultRequestConfig(requestConfig)
                .build();
    }

    @Bean
    public ProviderRegistry providerRegistry(AppProviderProperties appProviderProperties,
                                             ProviderScoreMapper providerScoreMapper,
                                             Clock clock) {
        ProviderRegistry registry = new ProviderRegistry(
                appProviderProperties, new MapperProviderScoreStore(providerScoreMapper), clock, new Random());
        registry.loadScores();
        return registry;
    }

    @Bean
    public SegmentTransport segmentTransport(CloseableHttpClient streamHttpClient,
                                             ObjectProvider<MeterRegistry> meterRegistryProvider) {
        return new MeteredSegmentTransport(new HttpSegmentTransport(streamHttpClient), meterRegistryProvider);
    }

    @Bean
    public HttpContentValidator contentValidator(CloseableHttpClient streamHttpClient,
                                                 ValidatedContentMapper validatedContentMapper,
                                                 AppContentProperties appContentProperties,
                                                 ObjectMapper objectMapper,
                                                 Clock clock) {
        return new HttpContentValidator(
                streamHttpClient, validatedContentMapper, appContentProperties, objectMapper, clock);
    }
}
