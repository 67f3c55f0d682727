package com.example.adaptivestream.domain.model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ProviderTest {

    private static final QualityTier HD = new QualityTier(1_500_000L, 720);

    @Test
    void shouldResolvePathAndSubdomainTemplates() {
        Provider path = new Provider("ipfs.io", "IPFS Gateway", "https://ipfs.io/ipfs/{contentId}", 1D);
        Provider subdomain = new Provider("dweb.link", "IPFS", "https://{contentId}.ipfs.dweb.link", 1D);

        Assertions.assertEquals("https://ipfs.io/ipfs/bafyabc?quality=720p",
                path.resolveUri("bafyabc", HD).toString());
        Assertions.assertEquals("https://bafyabc.ipfs.dweb.link?quality=720p",
                subdomain.resolveUri("bafyabc", HD).toString());
    }

    @Test
    void shouldFillQualityPlaceholdersWithoutQueryParameter() {
        Provider provider = new Provider("cdn", "CDN", "https://cdn.test/{contentId}/{height}.mp4?token=x", 1D);

        Assertions.assertEquals("https://cdn.test/bafyabc/720.mp4?token=x",
                provider.resolveUri("bafyabc", HD).toString());
    }

    @Test
    void shouldEscalateDecayWithFailureStreak() {
        Provider provider = new Provider("p", "P", "https://p.test/{contentId}", 0.9D);

        Provider once = provider.withFailure(0.8D, 3, 0.1D, 5_000L, 0L);
        Provider twice = once.withFailure(0.8D, 3, 0.1D, 5_000L, 0L);

        Assertions.assertEquals(0.72D, once.getScore(), 1e-9);
        Assertions.assertEquals(0.4608D, twice.getScore(), 1e-9);
        Assertions.assertFalse(twice.isCoolingDown(0L));
    }

    @Test
    void shouldClampRestoredScore() {
        Provider provider = new Provider("p", "P", "https://p.test/{contentId}", 1D);

        Assertions.assertEquals(1D, provider.withScore(3D).getScore(), 0D);
        Assertions.assertEquals(0D, provider.withScore(-1D).getScore(), 0D);
        Assertions.assertEquals(0D, provider.withScore(Double.NaN).getScore(), 0D);
    }
}
