package com.heronix.trailcam.service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;

import org.springframework.stereotype.Service;

import com.heronix.trailcam.adapter.CameraCloudAdapter;
import com.heronix.trailcam.exception.MediaFetchException;
import com.heronix.trailcam.model.domain.MediaReference;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Latest photo per camera.
 *
 * Only the sync cycle writes; readers get whatever was stored last.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MediaReferenceCache {

    private final CameraCloudAdapter adapter;
    private final Clock clock;

    private final Map<String, CachedMedia> cache = new ConcurrentHashMap<>();

    /**
     * Downloaded photo and the reference it came from.
     */
    public record CachedMedia(MediaReference reference, byte[] bytes, Instant fetchedAt) {
    }

    /**
     * Result of a lookup. A failed download still carries the previously
     * cached bytes, if any.
     */
    public record MediaLookup(byte[] bytes, Instant fetchedAt, boolean downloaded, MediaFetchException error) {

        static MediaLookup hit(CachedMedia media) {
            return new MediaLookup(media.bytes(), media.fetchedAt(), false, null);
        }

        public boolean hasBytes() {
            return bytes != null;
        }

        public boolean failed() {
            return error != null;
        }
    }

    /**
     * Serve the cached photo when it matches the candidate reference and has
     * not expired, otherwise download it.
     */
    public MediaLookup getOrRefresh(String deviceId, MediaReference candidate) {
        return getOrRefresh(deviceId, candidate, () -> true);
    }

    /**
     * As {@link #getOrRefresh(String, MediaReference)}, storing a download only
     * if {@code commit} still allows it once the bytes have arrived.
     */
    public MediaLookup getOrRefresh(String deviceId, MediaReference candidate, BooleanSupplier commit) {
        Instant now = clock.instant();
        CachedMedia current = cache.get(deviceId);

        if (current != null && current.reference().sameUrl(candidate) && !current.reference().isExpiredAt(now)) {
            return MediaLookup.hit(current);
        }

        try {
            byte[] bytes = adapter.downloadMedia(candidate.remoteUrl());
            if (!commit.getAsBoolean()) {
                log.debug("Discarded photo download for camera {}", deviceId);
                return current != null ? MediaLookup.hit(current) : new MediaLookup(null, null, false, null);
            }
            CachedMedia fresh = new CachedMedia(candidate, bytes, now);
            cache.put(deviceId, fresh);
            log.debug("Cached {} byte photo for camera {}", bytes.length, deviceId);
            return new MediaLookup(bytes, now, true, null);

        } catch (MediaFetchException e) {
            log.warn("Photo download failed for camera {}: {} ({})", deviceId, e.getMessage(), e.getKind());
            return current != null
                    ? new MediaLookup(current.bytes(), current.fetchedAt(), false, e)
                    : new MediaLookup(null, null, false, e);
        }
    }

    public Optional<CachedMedia> cached(String deviceId) {
        return Optional.ofNullable(cache.get(deviceId));
    }

    public int size() {
        return cache.size();
    }
}
