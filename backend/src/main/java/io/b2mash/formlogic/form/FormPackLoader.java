package io.b2mash.formlogic.form;

import io.b2mash.formlogic.config.FormLogicProperties;
import io.b2mash.formlogic.exception.StructuralReferenceException;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

/**
 * Loads form packs (JSON structure snapshots) from {@code formlogic.pack-location} into the {@link
 * FormRegistry} on startup. A pack that does not parse stops startup; a pack whose structure fails
 * validation is skipped with a warning.
 */
@Component
public class FormPackLoader implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(FormPackLoader.class);

  private final ResourcePatternResolver resourceResolver;
  private final ObjectMapper objectMapper;
  private final FormRegistry formRegistry;
  private final FormLogicProperties properties;

  public FormPackLoader(
      ResourcePatternResolver resourceResolver,
      ObjectMapper objectMapper,
      FormRegistry formRegistry,
      FormLogicProperties properties) {
    this.resourceResolver = resourceResolver;
    this.objectMapper = objectMapper;
    this.formRegistry = formRegistry;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) {
    if (!properties.loadPacks()) {
      log.info("Form pack loading disabled");
      return;
    }
    List<FormPackDefinition> packs = loadPacks();
    if (packs.isEmpty()) {
      log.info("No form packs found at {}", properties.packLocation());
      return;
    }
    int registered = 0;
    for (FormPackDefinition pack : packs) {
      try {
        formRegistry.register(pack.form());
        registered++;
        log.info("Loaded form pack {} v{}", pack.packId(), pack.version());
      } catch (StructuralReferenceException e) {
        log.warn(
            "Skipping form pack {} v{}: {}",
            pack.packId(),
            pack.version(),
            e.getBody().getDetail());
      }
    }
    log.info("Form pack loading complete: {} of {} registered", registered, packs.size());
  }

  List<FormPackDefinition> loadPacks() {
    try {
      Resource[] resources = resourceResolver.getResources(properties.packLocation());
      return Arrays.stream(resources).map(this::readPack).toList();
    } catch (IOException e) {
      log.warn("Failed to scan for form packs at {}", properties.packLocation(), e);
      return List.of();
    }
  }

  private FormPackDefinition readPack(Resource resource) {
    try {
      return objectMapper.readValue(resource.getInputStream(), FormPackDefinition.class);
    } catch (Exception e) {
      throw new IllegalStateException("Failed to parse form pack: " + resource.getFilename(), e);
    }
  }
}
