package stackwatch;

import static org.hamcrest.CoreMatchers.hasItem;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import stackwatch.model.ResourceIdentifier;

public class WatchExclusionsTest {

  private static final Path base = Paths.get("/work/app");

  @Test
  public void testDefaults() {
    WatchExclusions e = WatchExclusions.forConfig(WatchConfig.forTemplate(base.resolve("template.yaml")));
    PathRules rules = e.forResource(ResourceIdentifier.parse("HelloFunction"));
    assertThat(rules.matches("node_modules/x/index.js", false), is(true));
    assertThat(rules.matches(".aws-sam", true), is(true));
    assertThat(rules.matches("app.py", false), is(false));
    // build-in-source patterns are only added when asked for
    assertThat(rules.matches("app.pyc", false), is(false));
  }

  @Test
  public void testBuildInSourceWithBuildDirInsideProject() {
    // given the build writes into the sources, and to a build dir under the project
    WatchConfig config = config(base.resolve(".build"), base.resolve(".cache"), true, Collections.emptyMap());
    // when
    WatchExclusions e = WatchExclusions.forConfig(config);
    List<String> warnings = WatchExclusions.checkWatchSafety(config);
    // then both dirs are flagged
    assertThat(warnings, hasSize(2));
    // and every resource ignores the build dir and build outputs
    for (String id : ImmutableList.of("HelloFunction", "Child/OtherFunction")) {
      PathRules rules = e.forResource(ResourceIdentifier.parse(id));
      assertThat(rules.matches(".build", true), is(true));
      assertThat(rules.matches(".build/HelloFunction/app.py", false), is(true));
      assertThat(rules.matches("__pycache__/app.cpython-39.pyc", false), is(true));
      assertThat(rules.matches("app.py", false), is(false));
    }
  }

  @Test
  public void testDefaultDirsAreNotWarnedAbout() {
    WatchConfig config = WatchConfig.forTemplate(base.resolve("template.yaml"));
    assertThat(WatchExclusions.checkWatchSafety(config), is(empty()));
  }

  @Test
  public void testDirsOutsideProjectAreNotExcluded() {
    WatchConfig config = config(Paths.get("/tmp/build"), Paths.get("/tmp/cache"), false, Collections.emptyMap());
    WatchExclusions e = WatchExclusions.forConfig(config);
    assertThat(e.getBaseExcludes(), is(WatchExclusions.DEFAULT_EXCLUDES));
    assertThat(WatchExclusions.checkWatchSafety(config), is(empty()));
  }

  @Test
  public void testUserExcludesPerResourceAndForAll() {
    Map<String, List<String>> user = ImmutableMap.of(
      "*", ImmutableList.of("*.log"),
      "HelloFunction", ImmutableList.of("tests/"));
    WatchExclusions e = new WatchExclusions(WatchExclusions.DEFAULT_EXCLUDES, user);
    PathRules hello = e.forResource(ResourceIdentifier.parse("HelloFunction"));
    PathRules other = e.forResource(ResourceIdentifier.parse("OtherFunction"));
    assertThat(hello.matches("debug.log", false), is(true));
    assertThat(hello.matches("tests", true), is(true));
    assertThat(other.matches("debug.log", false), is(true));
    assertThat(other.matches("tests", true), is(false));
  }

  @Test
  public void testRelativeRule() {
    assertThat(WatchExclusions.relativeRule(base, base.resolve(".build")), is(Optional.of(".build")));
    assertThat(WatchExclusions.relativeRule(base, base.resolve(".aws-sam/build")), is(Optional.of("**/.aws-sam/build")));
    assertThat(WatchExclusions.relativeRule(base, Paths.get("/elsewhere")), is(Optional.empty()));
    assertThat(WatchExclusions.relativeRule(base, base), is(Optional.empty()));
  }

  @Test
  public void testBaseExcludesIncludeBuildDir() {
    WatchExclusions e = WatchExclusions.forConfig(config(base.resolve(".build"), base.resolve(".aws-sam/cache"), false, Collections.emptyMap()));
    assertThat(e.getBaseExcludes(), hasItem(".build"));
  }

  private static WatchConfig config(Path buildDir, Path cacheDir, boolean buildInSource, Map<String, List<String>> excludes) {
    return new WatchConfig(base.resolve("template.yaml"), base, buildDir, cacheDir, buildInSource, excludes, Collections.emptyMap());
  }

}
