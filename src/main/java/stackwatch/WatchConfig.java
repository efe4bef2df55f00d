package stackwatch;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

/** A parameter object for the paths and flags of a watch session. */
public class WatchConfig {

  public static final String DEFAULT_BUILD_DIR = ".aws-sam/build";
  public static final String DEFAULT_CACHE_DIR = ".aws-sam/cache";

  public final Path template;
  public final Path baseDir;
  public final Path buildDir;
  public final Path cacheDir;
  public final boolean buildInSource;
  private final Map<String, List<String>> watchExcludes;
  private final Map<String, String> parameterOverrides;

  /** Uses the template's directory as the base directory, and the default build/cache directories. */
  public static WatchConfig forTemplate(Path template) {
    Path baseDir = template.toAbsolutePath().normalize().getParent();
    return new WatchConfig(
      template,
      baseDir,
      baseDir.resolve(DEFAULT_BUILD_DIR),
      baseDir.resolve(DEFAULT_CACHE_DIR),
      false,
      Collections.emptyMap(),
      Collections.emptyMap());
  }

  public WatchConfig(
    Path template,
    Path baseDir,
    Path buildDir,
    Path cacheDir,
    boolean buildInSource,
    Map<String, List<String>> watchExcludes,
    Map<String, String> parameterOverrides) {
    this.template = template.toAbsolutePath().normalize();
    this.baseDir = baseDir.toAbsolutePath().normalize();
    this.buildDir = buildDir.toAbsolutePath().normalize();
    this.cacheDir = cacheDir.toAbsolutePath().normalize();
    this.buildInSource = buildInSource;
    this.watchExcludes = ImmutableMap.copyOf(watchExcludes);
    this.parameterOverrides = ImmutableMap.copyOf(parameterOverrides);
  }

  /** @return user exclude patterns keyed by resource id, with {@code *} for every resource */
  public Map<String, List<String>> getWatchExcludes() {
    return watchExcludes;
  }

  public Map<String, String> getParameterOverrides() {
    return parameterOverrides;
  }

}
