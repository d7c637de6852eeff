package com.scholary.audiosync.ledger;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the sync ledger.
 *
 * <p>These map to the "audiosync.ledger.*" keys in application.yml. When {@code enabled} is false
 * the upload path neither consults nor writes per-file records; sessions are still kept.
 */
@ConfigurationProperties(prefix = "audiosync.ledger")
@Validated
public record LedgerProperties(
    @NotBlank String path,
    boolean enabled,
    @Positive int busyTimeoutMs,
    @NotNull Duration statsCacheTtl,
    @Positive int retentionDays) {}
