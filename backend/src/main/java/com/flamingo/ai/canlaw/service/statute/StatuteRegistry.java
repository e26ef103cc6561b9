package com.flamingo.ai.canlaw.service.statute;

import com.flamingo.ai.canlaw.exception.StatuteNotFoundException;
import com.flamingo.ai.canlaw.service.statute.model.StatuteHierarchy;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Completed statute hierarchies available for citation lookup, keyed by act code. */
@Component
@Slf4j
public class StatuteRegistry {

  private final Map<String, StatuteHierarchy> hierarchies = new ConcurrentHashMap<>();

  /**
   * Publishes a hierarchy, replacing any earlier one for the same Act.
   *
   * @throws IllegalArgumentException if the hierarchy is still being built
   */
  public void register(StatuteHierarchy hierarchy) {
    if (!hierarchy.isComplete()) {
      throw new IllegalArgumentException(
          "Cannot register incomplete hierarchy for " + hierarchy.getAct().actCode());
    }
    StatuteHierarchy previous = hierarchies.put(key(hierarchy.getAct().actCode()), hierarchy);
    log.info(
        "Registered {} ({} nodes){}",
        hierarchy.getAct().actCode(),
        hierarchy.size(),
        previous != null ? ", replacing previous version" : "");
  }

  public Optional<StatuteHierarchy> find(String actCode) {
    return Optional.ofNullable(hierarchies.get(key(actCode)));
  }

  /** @throws StatuteNotFoundException if nothing is registered for {@code actCode} */
  public StatuteHierarchy require(String actCode) {
    return find(actCode).orElseThrow(() -> new StatuteNotFoundException(actCode));
  }

  public Set<String> actCodes() {
    return new TreeSet<>(hierarchies.keySet());
  }

  private static String key(String actCode) {
    return actCode.toLowerCase(Locale.ROOT);
  }
}
