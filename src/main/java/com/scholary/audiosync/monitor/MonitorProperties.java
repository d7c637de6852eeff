package com.scholary.audiosync.monitor;

import com.scholary.audiosync.config.PathExpander;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for mount watching.
 *
 * <p>These map to the "audiosync.monitor.*" keys in application.yml. A volume matches when its
 * directory name contains {@code volumeLabel}, ignoring case. A blank label accepts every
 * directory that appears under {@code mountsRoot}.
 */
@ConfigurationProperties(prefix = "audiosync.monitor")
@Validated
public record MonitorProperties(
    @NotBlank String mountsRoot,
    String volumeLabel,
    @NotNull Duration pollInterval,
    @NotNull Duration settleDelay) {

  public Path mountsRootPath() {
    return PathExpander.expand(mountsRoot).toAbsolutePath().normalize();
  }

  public boolean matchesLabel(Path volume) {
    if (volumeLabel == null || volumeLabel.isBlank()) {
      return true;
    }
    Path name = volume.getFileName();
    return name != null
        && name.toString().toLowerCase(Locale.ROOT).contains(volumeLabel.toLowerCase(Locale.ROOT));
  }
}
