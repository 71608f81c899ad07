package ca.gc.cra.prism.infrastructure.storage;

import ca.gc.cra.prism.application.port.ImageStorage;
import java.util.Optional;

/**
 * Storage that keeps nothing, registered as {@code prism.storages.none}.
 */
public final class NoStorage implements ImageStorage {
  public static final String NAME = "prism.storages.none";

  @Override
  public void put(String path, byte[] bytes) {}

  @Override
  public Optional<byte[]> get(String path) {
    return Optional.empty();
  }

  @Override
  public boolean exists(String path) {
    return false;
  }

  @Override
  public void remove(String path) {}
}
