package com.heronix.trailcam.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Configuration properties for Heronix TrailCam.
 *
 * Supplied once at startup; a credential change requires a restart.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "heronix.trailcam")
public class TrailCamProperties {

    /**
     * Vendor account login
     */
    @Valid
    private AccountConfig account = new AccountConfig();

    /**
     * Polling cadence and fan-out
     */
    @Valid
    private PollConfig poll = new PollConfig();

    /**
     * Identity provider (AWS Cognito) configuration
     */
    private IdentityConfig identity = new IdentityConfig();

    /**
     * Camera API configuration
     */
    private ApiConfig api = new ApiConfig();

    /**
     * Photo download configuration
     */
    private MediaConfig media = new MediaConfig();

    /**
     * Encryption configuration
     */
    private EncryptionConfig encryption = new EncryptionConfig();

    /**
     * REST API security configuration
     */
    private SecurityConfig security = new SecurityConfig();

    @Data
    public static class AccountConfig {
        /**
         * Account e-mail used as Cognito USERNAME
         */
        @NotBlank
        private String identifier;

        /**
         * Account password, plain or "enc:" prefixed AES-GCM ciphertext.
         * In production, use environment variable: TRAILCAM_SECRET
         */
        @NotBlank
        private String secret;
    }

    @Data
    public static class PollConfig {
        /**
         * Enable the scheduled polling loop
         */
        private boolean enabled = true;

        /**
         * Seconds between cycles (default: 5 minutes)
         */
        @Min(30)
        private long intervalSeconds = 300;

        /**
         * Delay before the first cycle after startup
         */
        private long initialDelaySeconds = 10;

        /**
         * Maximum concurrent device state fetches
         */
        @Min(1)
        private int maxConcurrency = 4;

        /**
         * Per-device deadline within a cycle
         */
        private long deviceTimeoutSeconds = 120;

        /**
         * Consecutive session failures before cameras are reported unavailable
         */
        @Min(1)
        private int unavailableAfterFailures = 3;
    }

    @Data
    public static class IdentityConfig {
        private String url = "https://cognito-idp.us-east-1.amazonaws.com/";

        private String clientId = "6r9tpojvgvkci5trla0ip14mon";

        private int timeoutSeconds = 30;

        /**
         * Minimum time left on a session before it is renewed. The effective
         * margin is never shorter than one poll interval.
         */
        private long sessionMarginSeconds = 300;

        /**
         * Lifetime assumed when the provider omits ExpiresIn (12 hours)
         */
        private long defaultExpiresInSeconds = 43200;
    }

    @Data
    public static class ApiConfig {
        private String baseUrl = "https://api.reveal.ishareit.net";

        private String version = "v1";

        /**
         * Value of the reveal-user-agent header
         */
        private String userAgent = "RevealWeb/5.4.0";

        /**
         * Origin of the vendor web app, sent as Origin and Referer
         */
        private String origin = "https://account.revealcellcam.com";

        private int timeoutSeconds = 30;

        /**
         * Photos requested per camera; also the ceiling of the reported photo count
         */
        private int photoSampleSize = 1000;

        /**
         * Recent photos used for battery and signal averages
         */
        private int averageWindow = 10;
    }

    @Data
    public static class MediaConfig {
        private int timeoutSeconds = 30;

        /**
         * Largest photo accepted, in bytes
         */
        private int maxSizeBytes = 16 * 1024 * 1024;
    }

    @Data
    public static class EncryptionConfig {
        /**
         * Passphrase for "enc:" secrets.
         * In production, use environment variable: TRAILCAM_MASTER_KEY
         */
        private String masterKey;
    }

    @Data
    public static class SecurityConfig {
        /**
         * Operator account for the REST API under the prod profile
         */
        private String username = "operator";

        private String password;
    }
}
