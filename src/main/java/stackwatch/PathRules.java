package stackwatch;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.lang3.tuple.Pair;
import org.eclipse.jgit.ignore.FastIgnoreRule;
import org.jooq.lambda.Seq;

/**
 * Keeps a list of .gitignore-style rules, and evaluates paths against them.
 *
 * Used for watch excludes, where paths are relative to the watched directory,
 * e.g. {@code node_modules/left-pad/index.js} for a function's code directory.
 */
public class PathRules {

  private final List<Pair<String, FastIgnoreRule>> rules = new ArrayList<>();

  public PathRules() {
  }

  public PathRules(String... lines) {
    this(Arrays.asList(lines));
  }

  public PathRules(List<String> lines) {
    for (String line : lines) {
      if (line.length() > 0 && !line.startsWith("#") && !line.equals("/")) {
        addRule(line);
      }
    }
  }

  public void addRule(String line) {
    FastIgnoreRule rule = new FastIgnoreRule(line);
    if (!rule.isEmpty()) {
      rules.add(Pair.of(line, rule));
    }
  }

  /** @return true if we should ignore {@code path}, or any of its parent directories */
  public boolean matches(String path, boolean isDirectory) {
    boolean result = false;
    for (Pair<String, FastIgnoreRule> t : rules) {
      FastIgnoreRule rule = t.getRight();
      if (rule.isMatch(path, isDirectory)) {
        result = rule.getResult();
        // don't break, keep going so we can look for a "!..." after this
      }
    }
    return result;
  }

  public List<String> getLines() {
    return Seq.seq(rules).map(Pair::getLeft).toList();
  }

  public boolean hasAnyRules() {
    return !rules.isEmpty();
  }

  @Override
  public String toString() {
    return getLines().toString();
  }

}
