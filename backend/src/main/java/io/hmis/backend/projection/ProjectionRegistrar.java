package io.hmis.backend.projection;

import io.hmis.backend.event.EventHandlerRegistry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.stereotype.Component;

/**
 * Registers every {@link ProjectionMaintainer} bean once all singletons exist, then freezes the
 * registry. Nothing may subscribe afterwards.
 */
@Component
public class ProjectionRegistrar implements SmartInitializingSingleton {

  private static final Logger log = LoggerFactory.getLogger(ProjectionRegistrar.class);

  private final EventHandlerRegistry registry;
  private final List<ProjectionMaintainer> maintainers;

  public ProjectionRegistrar(
      EventHandlerRegistry registry, List<ProjectionMaintainer> maintainers) {
    this.registry = registry;
    this.maintainers = maintainers;
  }

  @Override
  public void afterSingletonsInstantiated() {
    for (ProjectionMaintainer maintainer : maintainers) {
      maintainer.register(registry);
      log.info("Registered projection {}", maintainer.getClass().getSimpleName());
    }
    registry.freeze();
  }
}
