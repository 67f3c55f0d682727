package com.example.adaptivestream.infrastructure.http;

import com.example.adaptivestream.application.streaming.ContentValidationException;
import com.example.adaptivestream.application.streaming.ContentValidator;
import com.example.adaptivestream.common.config.AppContentProperties;
import com.example.adaptivestream.common.util.Clock;
import com.example.adaptivestream.domain.model.ContentMetadata;
import com.example.adaptivestream.infrastructure.persistence.entity.ValidatedContentEntity;
import com.example.adaptivestream.infrastructure.persistence.mapper.ValidatedContentMapper;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Pattern;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates content ids against the gateway's DAG metadata endpoint.
 *
 * <p>Positive results are cached in memory and in {@code validated_content} for the configured
 * validity window; preloaded ids are accepted without a lookup. Negative results are not cached.
 */
public class HttpContentValidator implements ContentValidator {

    private static final Logger log = LoggerFactory.getLogger(HttpContentValidator.class);

    private static final Pattern CONTENT_ID_PATTERN =
            Pattern.compile("^(Qm[1-9A-HJ-NP-Za-km-z]{44}|b[a-z2-7]{20,})$");
    private static final Pattern VIDEO_FILE_PATTERN =
            Pattern.compile(".*\\.(mp4|webm|mov)$", Pattern.CASE_INSENSITIVE);

    private final CloseableHttpClient httpClient;
    private final ValidatedContentMapper validatedContentMapper;
    private final AppContentProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Set<String> preloaded;
    private final ConcurrentMap<String, CachedValidation> cache = new ConcurrentHashMap<>();

    public HttpContentValidator(CloseableHttpClient httpClient,
                                ValidatedContentMapper validatedContentMapper,
                                AppContentProperties properties,
                                ObjectMapper objectMapper,
                                Clock clock) {
        this.httpClient = httpClient;
        this.validatedContentMapper = validatedContentMapper;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.preloaded = new HashSet<>(properties.getPreloadedContentIds());
    }

    @Override
    public ContentMetadata validate(String contentId) {
        if (contentId == null || !CONTENT_ID_PATTERN.matcher(contentId).matches()) {
            throw new ContentValidationException(contentId, "malformed content id");
        }
        if (preloaded.contains(contentId)) {
            return ContentMetadata.preloaded(contentId);
        }
        long now = clock.nowMs();
        CachedValidation cached = cache.get(contentId);
        if (cached != null && cached.isFresh(now, validityMs())) {
            return cached.metadata;
        }
        ContentMetadata persisted = loadPersisted(contentId, now);
        if (persisted != null) {
            cache.put(contentId, new CachedValidation(persisted, now));
            return persisted;
        }
        ContentMetadata fetched = fetchAndCheck(contentId);
        cache.put(contentId, new CachedValidation(fetched, now));
        persist(fetched, now);
        log.info("CONTENT_VALIDATED contentId={} durationSec={} totalBytes={}",
                contentId, fetched.getDurationSec(), fetched.getTotalBytes());
        return fetched;
    }

    /**
     * Applies the acceptance rules to a metadata document: an object carrying Links or Data,
     * where Links must list a non-empty video file and Data must hold a video content type.
     */
    ContentMetadata parseMetadata(String contentId, JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ContentValidationException(contentId, "metadata is not an object");
        }
        JsonNode links = root.get("Links");
        JsonNode data = root.get("Data");
        if (isAbsent(links) && isAbsent(data)) {
            throw new ContentValidationException(contentId, "metadata has neither Links nor Data");
        }
        long videoBytes = 0L;
        if (!isAbsent(links)) {
            boolean hasVideoFile = false;
            if (links.isArray()) {
                for (JsonNode link : links) {
                    String name = link.path("Name").asText("");
                    long size = link.path("Size").asLong(0L);
                    if (size > 0 && VIDEO_FILE_PATTERN.matcher(name).matches()) {
                        hasVideoFile = true;
                        videoBytes = Math.max(videoBytes, size);
                    }
                }
            }
            if (!hasVideoFile) {
                throw new ContentValidationException(contentId, "no video file among Links");
            }
        }
        if (!isAbsent(data)) {
            boolean isVideo = false;
            if (data.isArray()) {
                for (JsonNode chunk : data) {
                    if (isVideoType(chunk.path("type").asText(null))
                            || isVideoType(chunk.path("contentType").asText(null))) {
                        isVideo = true;
                        break;
                    }
                }
            }
            if (!isVideo) {
                throw new ContentValidationException(contentId, "Data does not describe video content");
            }
        }
        return new ContentMetadata(contentId, readDuration(root), videoBytes, false);
    }

    private ContentMetadata fetchAndCheck(String contentId) {
        String url;
        try {
            url = properties.getMetadataUrlTemplate()
                    .replace("{contentId}", URLEncoder.encode(contentId, StandardCharsets.UTF_8.name()));
        } catch (IOException e) {
            throw new ContentValidationException(contentId, "cannot encode content id", e);
        }
        int timeout = properties.getValidationTimeoutMs();
        HttpGet get = new HttpGet(url);
        get.setConfig(RequestConfig.custom()
                .setConnectTimeout(timeout)
                .setConnectionRequestTimeout(timeout)
                .setSocketTimeout(timeout)
                .build());
        try (CloseableHttpResponse response = httpClient.execute(get)) {
            int status = response.getStatusLine().getStatusCode();
            if (status < 200 || status >= 300) {
                EntityUtils.consumeQuietly(response.getEntity());
                throw new ContentValidationException(contentId, "metadata request failed: HTTP " + status);
            }
            String body = response.getEntity() == null ? "" : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
            return parseMetadata(contentId, objectMapper.readTree(body));
        } catch (IOException e) {
            log.warn("CONTENT_METADATA_FETCH_FAILED contentId={} url={} reason={}", contentId, url, e.getMessage());
            throw new ContentValidationException(contentId, "metadata request failed: " + e.getMessage(), e);
        }
    }

    private ContentMetadata loadPersisted(String contentId, long now) {
        ValidatedContentEntity entity;
        try {
            entity = validatedContentMapper.selectByContentId(contentId);
        } catch (RuntimeException e) {
            log.warn("CONTENT_CACHE_READ_FAILED contentId={} reason={}", contentId, e.getMessage());
            return null;
        }
        if (entity == null || entity.getValidatedAt() == null) {
            return null;
        }
        long validatedAtMs = entity.getValidatedAt().atZone(ZoneId.systemDefault()).toInstant().toEpochMilli();
        if (now - validatedAtMs >= validityMs()) {
            return null;
        }
        long totalBytes = entity.getTotalBytes() == null ? 0L : entity.getTotalBytes();
        return new ContentMetadata(contentId, entity.getDurationSec(), totalBytes, false);
    }

    private void persist(ContentMetadata metadata, long now) {
        ValidatedContentEntity entity = new ValidatedContentEntity();
        entity.setContentId(metadata.getContentId());
        entity.setDurationSec(metadata.getDurationSec());
        entity.setTotalBytes(metadata.getTotalBytes());
        entity.setValidatedAt(LocalDateTime.ofInstant(Instant.ofEpochMilli(now), ZoneId.systemDefault()));
        try {
            validatedContentMapper.upsert(entity);
        } catch (RuntimeException e) {
            log.warn("CONTENT_CACHE_WRITE_FAILED contentId={} reason={}", metadata.getContentId(), e.getMessage());
        }
    }

    /**
     * Removes persisted validations older than the validity window.
     */
    public int purgeExpired() {
        LocalDateTime before = LocalDateTime.ofInstant(
                Instant.ofEpochMilli(clock.nowMs() - validityMs()), ZoneId.systemDefault());
        long now = clock.nowMs();
        cache.entrySet().removeIf(e -> !e.getValue().isFresh(now, validityMs()));
        return validatedContentMapper.deleteValidatedBefore(before);
    }

    private long validityMs() {
        return properties.getValidityHours() * 60L * 60L * 1000L;
    }

    private static Double readDuration(JsonNode root) {
        for (String field : new String[] {"Duration", "durationSeconds", "duration"}) {
            JsonNode node = root.get(field);
            if (node != null && node.isNumber() && node.asDouble() > 0D) {
                return node.asDouble();
            }
        }
        return null;
    }

    private static boolean isVideoType(String type) {
        return type != null && type.toLowerCase(Locale.ROOT).startsWith("video/");
    }

    private static boolean isAbsent(JsonNode node) {
        return node == null || node.isNull();
    }

    private static final class CachedValidation {

        private final ContentMetadata metadata;
        private final long validatedAtMs;

        private CachedValidation(ContentMetadata metadata, long validatedAtMs) {
            this.metadata = metadata;
            this.validatedAtMs = validatedAtMs;
        }

        private boolean isFresh(long nowMs, long validityMs) {
            return nowMs - validatedAtMs < validityMs;
        }
    }
}
