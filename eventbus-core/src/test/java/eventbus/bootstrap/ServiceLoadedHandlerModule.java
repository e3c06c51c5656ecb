package eventbus.bootstrap;

import eventbus.HandlerDescriptor;

import java.util.List;

/** Listed in the test {@code META-INF/services} file. */
public class ServiceLoadedHandlerModule implements HandlerModule {

  @Override
  public String moduleName() {
    return "notifications";
  }

  @Override
  public List<HandlerDescriptor> handlers() {
    return List.of(HandlerDescriptor.builder("users:user.created")
        .module("notifications")
        .handlerId("notifications-welcome-email")
        .handler(event -> { })
        .build());
  }
}
