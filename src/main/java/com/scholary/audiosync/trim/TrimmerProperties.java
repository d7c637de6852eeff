package com.scholary.audiosync.trim;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for silence trimming and encoding.
 *
 * <p>These map to the "audiosync.trimmer.*" keys in application.yml. The defaults are tuned for
 * speech recorded on handheld voice recorders.
 */
@ConfigurationProperties(prefix = "audiosync.trimmer")
@Validated
public record TrimmerProperties(
    double silenceThresholdDb,
    @Positive int minSilenceMs,
    @PositiveOrZero int marginMs,
    @Positive int targetSampleRate,
    @NotBlank String targetBitrate,
    double targetLoudnessDb,
    @PositiveOrZero double minVoiceRatioPercent,
    @Positive int processingThreads) {}
