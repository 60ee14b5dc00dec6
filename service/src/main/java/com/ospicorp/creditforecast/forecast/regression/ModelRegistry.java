package com.ospicorp.creditforecast.forecast.regression;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ModelRegistry {

  private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

  private final Map<String, RegressionBackend> backends = new LinkedHashMap<>();

  public ModelRegistry(List<RegressionBackend> backends) {
    for (RegressionBackend backend : backends) {
      String name = backend.name().toLowerCase(Locale.ROOT);
      if (this.backends.putIfAbsent(name, backend) != null) {
        throw new IllegalStateException("Duplicate regression backend: " + name);
      }
      if (backend.isAvailable()) {
        log.info("Model backend {} available", name);
      } else {
        log.warn("Model backend {} not available in this runtime", name);
      }
    }
  }

  public List<String> available() {
    List<String> names = new ArrayList<>();
    backends.forEach((name, backend) -> {
      if (backend.isAvailable()) {
        names.add(name);
      }
    });
    return names;
  }

  public RegressionBackend resolve(String kind) {
    RegressionBackend backend = kind == null ? null : backends.get(kind.toLowerCase(Locale.ROOT));
    if (backend == null || !backend.isAvailable()) {
      throw new ModelUnavailableException(kind);
    }
    return backend;
  }
}
