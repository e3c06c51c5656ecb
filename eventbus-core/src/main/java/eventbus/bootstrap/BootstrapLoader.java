package eventbus.bootstrap;

import eventbus.HandlerDescriptor;
import eventbus.registry.HandlerRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Registers every module's handlers into a {@link HandlerRegistry} once, at startup.
 *
 * <p>Modules are processed in alphabetical order of {@link HandlerModule#moduleName()}. A
 * module whose {@code handlers()} throws, or one of whose descriptors is rejected, is logged
 * and reported; bootstrap carries on with the next descriptor and the next module.
 *
 * <p>Bootstrap runs once per registry: later calls, on this loader or on another loader filling
 * the same registry, log and return the first report. Descriptors built without a handler id
 * get a fresh generated id each time a module's {@code handlers()} is called, so registering
 * the same modules twice would otherwise duplicate them.
 */
public final class BootstrapLoader {
  private static final Logger logger = Logger.getLogger(BootstrapLoader.class.getName());

  // Registries already filled in this JVM, with the report of the run that filled them
  private static final Map<HandlerRegistry, BootstrapReport> BOOTSTRAPPED =
      Collections.synchronizedMap(new WeakHashMap<>());

  private final HandlerRegistry registry;
  private final List<HandlerModule> modules;
  private BootstrapReport report;

  public BootstrapLoader(HandlerRegistry registry, List<? extends HandlerModule> modules) {
    this.registry = Objects.requireNonNull(registry, "registry");
    List<HandlerModule> sorted = new ArrayList<>(Objects.requireNonNull(modules, "modules"));
    sorted.sort(Comparator.comparing(HandlerModule::moduleName,
        Comparator.nullsLast(Comparator.naturalOrder())));
    this.modules = List.copyOf(sorted);
  }

  /**
   * Creates a loader for the modules listed under
   * {@code META-INF/services/eventbus.bootstrap.HandlerModule} on the given class loader.
   *
   * @param registry    the registry to fill
   * @param classLoader the class loader to search
   * @return a loader for the discovered modules
   */
  public static BootstrapLoader fromServiceLoader(HandlerRegistry registry, ClassLoader classLoader) {
    List<HandlerModule> discovered = new ArrayList<>();
    for (HandlerModule module : ServiceLoader.load(HandlerModule.class, classLoader)) {
      discovered.add(module);
    }
    return new BootstrapLoader(registry, discovered);
  }

  public static BootstrapLoader fromServiceLoader(HandlerRegistry registry) {
    return fromServiceLoader(registry, Thread.currentThread().getContextClassLoader());
  }

  /**
   * Registers the handlers of every module.
   *
   * @return what was registered and what failed
   */
  public BootstrapReport bootstrapEventHandlers() {
    synchronized (BOOTSTRAPPED) {
      BootstrapReport previous = BOOTSTRAPPED.get(registry);
      if (previous != null) {
        logger.info("Event handlers already bootstrapped into this registry; skipping");
        synchronized (this) {
          report = previous;
        }
        return previous;
      }
      BootstrapReport current = bootstrap();
      BOOTSTRAPPED.put(registry, current);
      synchronized (this) {
        report = current;
      }
      return current;
    }
  }

  private BootstrapReport bootstrap() {
    List<String> names = new ArrayList<>();
    Set<String> failedModules = new LinkedHashSet<>();
    int registered = 0;
    int failed = 0;
    for (HandlerModule module : modules) {
      String name = module.moduleName();
      names.add(name);
      List<HandlerDescriptor> handlers;
      try {
        handlers = module.handlers();
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Failed to load event handlers of module " + name, e);
        failedModules.add(name);
        failed++;
        continue;
      }
      if (handlers == null) {
        logger.severe("Module " + name + " returned no handler list");
        failedModules.add(name);
        failed++;
        continue;
      }
      int moduleRegistered = 0;
      for (HandlerDescriptor descriptor : handlers) {
        try {
          registry.register(descriptor);
          moduleRegistered++;
        } catch (RuntimeException e) {
          logger.log(Level.SEVERE, "Failed to register handler " + descriptor
              + " of module " + name, e);
          failedModules.add(name);
          failed++;
        }
      }
      registered += moduleRegistered;
      int count = moduleRegistered;
      logger.fine(() -> "Registered " + count + " handler(s) for module " + name);
    }
    BootstrapReport result =
        new BootstrapReport(names, registered, failed, new ArrayList<>(failedModules));
    if (result.isClean()) {
      logger.info("Bootstrapped " + registered + " event handler(s) from "
          + modules.size() + " module(s)");
    } else {
      logger.warning("Bootstrapped " + registered + " event handler(s) from "
          + modules.size() + " module(s); " + failed + " failure(s) in " + failedModules);
    }
    return result;
  }

  public synchronized boolean isBootstrapped() {
    return report != null;
  }

  public List<HandlerModule> modules() {
    return modules;
  }
}
