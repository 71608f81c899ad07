package ca.gc.cra.prism.application.component;

import java.util.Collection;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Fatal startup error raised when a configured component name is not in the catalog.
 *
 * @since 0.1.0
 */
public final class ComponentResolutionException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final ComponentRole role;
  private final String componentName;

  public ComponentResolutionException(ComponentRole role, String componentName, Collection<String> known) {
    super("Unknown " + role.label() + " '" + componentName + "' (" + role.settingName() + "); known: "
        + new TreeSet<>(known));
    this.role = Objects.requireNonNull(role, "role");
    this.componentName = componentName;
  }

  public ComponentRole role() {
    return role;
  }

  public String componentName() {
    return componentName;
  }
}
