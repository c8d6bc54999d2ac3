package io.intellixity.varplan.reference;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Syntax-only scan of a variable payload for references to other variables.\n
 *
 * Walks a JSON-like tree (maps, collections, arrays, Jackson {@link JsonNode}s) and scans every string leaf
 * for {@code $name} and {@code ${name}} tokens, where name is {@code [A-Za-z_][A-Za-z0-9_]*}.\n
 *
 * Rules:\n
 * - matching is greedy; a consumed token is never re-scanned\n
 * - all-digit tokens ({@code $1}, {@code ${42}}) are regex back-references, not variables\n
 * - map keys are not scanned, only values\n
 * - anything else (numbers, booleans, unknown objects) contributes nothing\n
 *
 * The result keeps first-seen order. Extraction never throws on odd payloads.
 */
public final class VariableReferenceExtractor {
  // Body is captured wider than a name so that "$1abc" is consumed whole and then rejected.
  private static final Pattern TOKEN = Pattern.compile("\\$(?:\\{([A-Za-z0-9_]+)}|([A-Za-z0-9_]+))");

  private VariableReferenceExtractor() {}

  public static Set<String> extractReferences(Object spec) {
    Set<String> out = new LinkedHashSet<>();
    walk(spec, out, Collections.newSetFromMap(new IdentityHashMap<>()));
    return out;
  }

  /** Scans a single string. */
  public static Set<String> scan(CharSequence text) {
    Set<String> out = new LinkedHashSet<>();
    scanInto(text, out);
    return out;
  }

  /** True for names that a reference token can designate. */
  public static boolean isReferenceable(String name) {
    if (name == null || name.isEmpty()) return false;
    char first = name.charAt(0);
    if (!(first == '_' || isAsciiLetter(first))) return false;
    for (int i = 1; i < name.length(); i++) {
      char c = name.charAt(i);
      if (!(c == '_' || isAsciiLetter(c) || (c >= '0' && c <= '9'))) return false;
    }
    return true;
  }

  private static void walk(Object v, Set<String> out, Set<Object> seen) {
    if (v == null) return;

    if (v instanceof CharSequence s) {
      scanInto(s, out);
      return;
    }

    if (v instanceof JsonNode n) {
      walkJson(n, out);
      return;
    }

    if (v instanceof Map<?, ?> m) {
      if (!seen.add(m)) return;
      for (Object x : m.values()) walk(x, out, seen);
      return;
    }

    if (v instanceof Iterable<?> it) {
      if (!seen.add(it)) return;
      for (Object x : it) walk(x, out, seen);
      return;
    }

    if (v instanceof Object[] arr) {
      if (!seen.add(arr)) return;
      for (Object x : arr) walk(x, out, seen);
    }
  }

  private static void walkJson(JsonNode n, Set<String> out) {
    if (n.isTextual()) {
      scanInto(n.textValue(), out);
      return;
    }
    if (n.isContainerNode()) {
      for (JsonNode child : n) walkJson(child, out);
    }
  }

  private static void scanInto(CharSequence text, Set<String> out) {
    if (text == null || text.length() == 0) return;
    Matcher m = TOKEN.matcher(text);
    while (m.find()) {
      String name = m.group(1) != null ? m.group(1) : m.group(2);
      if (isReferenceable(name)) out.add(name);
    }
  }

  private static boolean isAsciiLetter(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
  }
}
