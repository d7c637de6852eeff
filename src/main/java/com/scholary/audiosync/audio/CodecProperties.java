package com.scholary.audiosync.audio;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the ffmpeg binaries ("audiosync.codec.*"). */
@ConfigurationProperties(prefix = "audiosync.codec")
@Validated
public record CodecProperties(
    @NotBlank String ffmpegPath, @NotBlank String ffprobePath, @Positive int timeoutSeconds) {}
