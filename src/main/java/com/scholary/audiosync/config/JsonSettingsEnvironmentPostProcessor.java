package com.scholary.audiosync.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.apache.commons.logging.Log;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.boot.logging.DeferredLogFactory;
import org.springframework.core.env.CommandLinePropertySource;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;
import org.springframework.core.env.MutablePropertySources;

/**
 * Loads the flat JSON settings file named by {@code --config=<file.json>}.
 *
 * <p>Keys such as {@code silenceThresholdDb} or {@code parallel_uploads} are matched ignoring case,
 * underscores and dashes, and mapped onto the {@code audiosync.*} properties. The file overrides
 * application.yml; explicit command line properties still win. Keys missing from the file keep
 * their application.yml defaults. An unreadable file is reported and ignored.
 */
public class JsonSettingsEnvironmentPostProcessor implements EnvironmentPostProcessor {

  static final String CONFIG_OPTION = "config";
  static final String PROPERTY_SOURCE_NAME = "audiosyncJsonSettings";

  private static final Map<String, String> KEY_MAPPING = new LinkedHashMap<>();

  static {
    KEY_MAPPING.put("basedir", "audiosync.staging.base-dir");
    KEY_MAPPING.put("tempdir", "audiosync.staging.temp-dir");
    KEY_MAPPING.put("patterns", "audiosync.staging.patterns");
    KEY_MAPPING.put("excludefolders", "audiosync.staging.exclude-folders");
    KEY_MAPPING.put("retentiondays", "audiosync.staging.retention-days");
    KEY_MAPPING.put("autocleanup", "audiosync.staging.auto-cleanup");
    KEY_MAPPING.put("verifycopy", "audiosync.staging.verify-copy");
    KEY_MAPPING.put("maxstoragegb", "audiosync.staging.max-storage-gb");
    KEY_MAPPING.put("silencethresholddb", "audiosync.trimmer.silence-threshold-db");
    KEY_MAPPING.put("minsilencems", "audiosync.trimmer.min-silence-ms");
    KEY_MAPPING.put("marginms", "audiosync.trimmer.margin-ms");
    KEY_MAPPING.put("targetsamplerate", "audiosync.trimmer.target-sample-rate");
    KEY_MAPPING.put("targetbitrate", "audiosync.trimmer.target-bitrate");
    KEY_MAPPING.put("targetloudnessdb", "audiosync.trimmer.target-loudness-db");
    KEY_MAPPING.put("minvoiceratiopercent", "audiosync.trimmer.min-voice-ratio-percent");
    KEY_MAPPING.put("processingthreads", "audiosync.trimmer.processing-threads");
    KEY_MAPPING.put("paralleluploads", "audiosync.upload.parallel-uploads");
    KEY_MAPPING.put("retryattempts", "audiosync.upload.retry-attempts");
    KEY_MAPPING.put("maxfilesizemb", "audiosync.upload.max-file-size-mb");
    KEY_MAPPING.put("preservefolderstructure", "audiosync.upload.preserve-folder-structure");
    KEY_MAPPING.put("useledger", "audiosync.ledger.enabled");
    KEY_MAPPING.put("ledgerpath", "audiosync.ledger.path");
    KEY_MAPPING.put("remotefolderid", "audiosync.remote.root-folder");
    KEY_MAPPING.put("gdrivefolderid", "audiosync.remote.root-folder");
    KEY_MAPPING.put("remotetype", "audiosync.remote.type");
    KEY_MAPPING.put("usbidentifier", "audiosync.monitor.volume-label");
    KEY_MAPPING.put("volumelabel", "audiosync.monitor.volume-label");
  }

  private final Log logger;
  private final ObjectMapper objectMapper = new ObjectMapper();

  public JsonSettingsEnvironmentPostProcessor(DeferredLogFactory logFactory) {
    this.logger = logFactory.getLog(JsonSettingsEnvironmentPostProcessor.class);
  }

  @Override
  public void postProcessEnvironment(
      ConfigurableEnvironment environment, SpringApplication application) {
    String location = environment.getProperty(CONFIG_OPTION);
    if (location == null || location.isBlank()) {
      return;
    }
    Path file = PathExpander.expand(location);
    if (!Files.isRegularFile(file)) {
      logger.warn("Settings file " + file + " not found, using defaults");
      return;
    }

    Map<String, Object> properties;
    try {
      properties = mapSettings(objectMapper.readTree(file.toFile()));
    } catch (IOException e) {
      logger.warn("Cannot read settings file " + file + ", using defaults: " + e.getMessage());
      return;
    }
    if (properties.isEmpty()) {
      return;
    }

    MapPropertySource source = new MapPropertySource(PROPERTY_SOURCE_NAME, properties);
    MutablePropertySources sources = environment.getPropertySources();
    if (sources.contains(CommandLinePropertySource.COMMAND_LINE_PROPERTY_SOURCE_NAME)) {
      sources.addAfter(CommandLinePropertySource.COMMAND_LINE_PROPERTY_SOURCE_NAME, source);
    } else {
      sources.addFirst(source);
    }
    logger.info("Loaded " + properties.size() + " settings from " + file);
  }

  Map<String, Object> mapSettings(JsonNode root) {
    Map<String, Object> properties = new LinkedHashMap<>();
    if (root == null || !root.isObject()) {
      logger.warn("Settings file must contain a JSON object, ignoring it");
      return properties;
    }
    Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      String property = KEY_MAPPING.get(normalize(field.getKey()));
      JsonNode value = field.getValue();
      if (property == null) {
        logger.debug("Ignoring unknown setting '" + field.getKey() + "'");
      } else if (value.isNull() || value.isObject()) {
        logger.warn("Ignoring setting '" + field.getKey() + "' with unsupported value");
      } else if (value.isArray()) {
        List<String> items = new ArrayList<>();
        value.forEach(item -> items.add(item.asText()));
        properties.put(property, String.join(",", items));
      } else {
        properties.put(property, value.asText());
      }
    }
    return properties;
  }

  static String normalize(String key) {
    return key.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
  }
}
