package com.heronix.trailcam.adapter.reveal;

import java.net.URI;
import java.time.Duration;

import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.heronix.trailcam.config.TrailCamProperties;
import com.heronix.trailcam.exception.MediaFetchException;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Downloads photos from pre-signed S3 URLs.
 *
 * URLs are used verbatim; re-encoding would break the signature.
 */
@Component
@Slf4j
public class PresignedMediaClient {

    private final WebClient client;
    private final TrailCamProperties properties;

    public PresignedMediaClient(WebClient.Builder webClientBuilder, TrailCamProperties properties) {
        this.properties = properties;
        this.client = webClientBuilder.clone()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(properties.getMedia().getMaxSizeBytes()))
                .build();
    }

    public byte[] download(String remoteUrl) {
        Duration timeout = Duration.ofSeconds(properties.getMedia().getTimeoutSeconds());

        try {
            byte[] bytes = client.get()
                    .uri(URI.create(remoteUrl))
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .timeout(timeout, Mono.error(() -> new MediaFetchException(
                            MediaFetchException.Kind.NETWORK_ERROR, "Photo download timed out")))
                    .block();

            if (bytes == null || bytes.length == 0) {
                throw new MediaFetchException(MediaFetchException.Kind.GONE, "Photo download returned no content");
            }
            return bytes;

        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == 403) {
                throw new MediaFetchException(MediaFetchException.Kind.FORBIDDEN, "Photo URL rejected (HTTP 403)", e);
            }
            if (status == 404 || status == 410) {
                throw new MediaFetchException(MediaFetchException.Kind.GONE, "Photo no longer available (HTTP "
                        + status + ")", e);
            }
            throw new MediaFetchException(MediaFetchException.Kind.NETWORK_ERROR, "Photo download failed (HTTP "
                    + status + ")", e);
        } catch (WebClientRequestException e) {
            throw new MediaFetchException(MediaFetchException.Kind.NETWORK_ERROR, "Photo download failed: "
                    + e.getMessage(), e);
        } catch (DataBufferLimitException e) {
            throw new MediaFetchException(MediaFetchException.Kind.NETWORK_ERROR, "Photo exceeds "
                    + properties.getMedia().getMaxSizeBytes() + " bytes", e);
        } catch (IllegalArgumentException e) {
            throw new MediaFetchException(MediaFetchException.Kind.GONE, "Invalid photo URL", e);
        }
    }
}
