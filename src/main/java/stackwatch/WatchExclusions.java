package stackwatch;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import stackwatch.model.ResourceIdentifier;

/**
 * Works out what each resource's code watch should ignore, so that builds writing into the
 * watched tree don't re-trigger themselves.
 *
 * Patterns are .gitignore-style, and evaluated relative to each resource's code directory.
 */
public class WatchExclusions {

  private static final Logger log = LoggerFactory.getLogger(WatchExclusions.class);
  public static final String ALL_RESOURCES = "*";
  static final List<String> DEFAULT_EXCLUDES = ImmutableList.of(".aws-sam", "node_modules");
  static final List<String> BUILD_IN_SOURCE_EXCLUDES = ImmutableList.of("*.pyc", "__pycache__", "*.class", "target/", "build/");
  private final List<String> baseExcludes;
  private final Map<String, List<String>> userExcludes;

  public static WatchExclusions forConfig(WatchConfig config) {
    List<String> base = new ArrayList<>(DEFAULT_EXCLUDES);
    if (config.buildInSource) {
      base.addAll(BUILD_IN_SOURCE_EXCLUDES);
    }
    // a build/cache dir outside the base dir can't be inside a code dir, so there's nothing to exclude
    relativeRule(config.baseDir, config.cacheDir).ifPresent(base::add);
    relativeRule(config.baseDir, config.buildDir).ifPresent(base::add);
    return new WatchExclusions(base, config.getWatchExcludes());
  }

  WatchExclusions(List<String> baseExcludes, Map<String, List<String>> userExcludes) {
    this.baseExcludes = ImmutableList.copyOf(baseExcludes);
    this.userExcludes = userExcludes;
  }

  public List<String> getBaseExcludes() {
    return baseExcludes;
  }

  /** @return the engine's excludes, plus the user's excludes for every resource and for {@code id} */
  public PathRules forResource(ResourceIdentifier id) {
    PathRules rules = new PathRules(baseExcludes);
    userExcludes.getOrDefault(ALL_RESOURCES, Collections.emptyList()).forEach(rules::addRule);
    userExcludes.getOrDefault(id.toString(), Collections.emptyList()).forEach(rules::addRule);
    return rules;
  }

  /**
   * @return warnings about build/cache directories inside the watched tree, which can cause rebuild loops; never fatal
   */
  public static List<String> checkWatchSafety(WatchConfig config) {
    List<String> warnings = new ArrayList<>();
    if (config.buildInSource && isUnder(config.baseDir, config.cacheDir)) {
      warnings.add("Cache directory " + config.cacheDir + " is under project directory " + config.baseDir + ". This may cause build loops.");
    }
    Path defaultBuildDir = config.baseDir.resolve(WatchConfig.DEFAULT_BUILD_DIR);
    if (!config.buildDir.equals(defaultBuildDir) && isUnder(config.baseDir, config.buildDir)) {
      warnings.add("Custom build directory " + config.buildDir + " is under project directory. This may cause watch recursion.");
    }
    for (String warning : warnings) {
      log.warn("Build watch safety warning: " + warning);
    }
    return warnings;
  }

  static Optional<String> relativeRule(Path baseDir, Path dir) {
    if (!isUnder(baseDir, dir)) {
      return Optional.empty();
    }
    String relative = Utils.toRelativePath(baseDir, dir);
    // a single name matches at any depth, but a multi-segment one would be anchored to the code dir
    return Optional.of(relative.contains("/") ? "**/" + relative : relative);
  }

  private static boolean isUnder(Path parent, Path child) {
    return !child.equals(parent) && child.startsWith(parent);
  }

}
