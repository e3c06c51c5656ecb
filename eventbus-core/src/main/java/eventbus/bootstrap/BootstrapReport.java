package eventbus.bootstrap;

import java.util.List;

/**
 * Summary of one {@link BootstrapLoader#bootstrapEventHandlers()} run.
 *
 * @param modules        modules processed, in bootstrap order
 * @param registered     descriptors registered
 * @param failed         descriptors (or whole modules) that could not be registered
 * @param failedModules  names of modules with at least one failure
 */
public record BootstrapReport(List<String> modules, int registered, int failed,
    List<String> failedModules) {

  public BootstrapReport {
    modules = List.copyOf(modules);
    failedModules = List.copyOf(failedModules);
  }

  public boolean isClean() {
    return failed == 0;
  }
}
