package ca.gc.cra.metawriter.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Factory port opening new persistent array stores.
 * <p><strong>Why:</strong> The writer creates exactly one store per Idle to Open transition; keeping creation behind
 * a port lets tests count creations and lets deployments swap the file format.</p>
 * <p><strong>Role:</strong> Output port implemented by {@code MetaStoreFileAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from several writers.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ArrayStorePort {
  /**
   * Creates a new store at {@code path}, replacing any existing file.
   *
   * @param path target file
   * @return open store
   * @throws IOException when the file cannot be created
   */
  ArrayStore create(Path path) throws IOException;
}
