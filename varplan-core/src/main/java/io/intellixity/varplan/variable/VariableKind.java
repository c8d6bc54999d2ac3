package io.intellixity.varplan.variable;

/**
 * Declared variable kinds.\n
 *
 * Only {@link #computed()} kinds are scanned for references to other variables.\n
 */
public enum VariableKind {
  /** Constant value typed by the dashboard author. */
  TEXT("TextVariable", false),

  /** Values produced by a plugin (usually a query against a datasource). */
  LIST("ListVariable", true);

  private final String wireKind;
  private final boolean computed;

  VariableKind(String wireKind, boolean computed) {
    this.wireKind = wireKind;
    this.computed = computed;
  }

  /** Kind name used in dashboard documents. */
  public String wireKind() { return wireKind; }

  public boolean computed() { return computed; }

  /** Accepts the document kind ({@code TextVariable}) or the short form ({@code text}), case-insensitive. */
  public static VariableKind fromWire(String kind) {
    if (kind == null || kind.isBlank()) throw new IllegalArgumentException("Variable kind is required");
    String k = kind.trim();
    for (VariableKind vk : values()) {
      if (vk.wireKind.equalsIgnoreCase(k) || vk.name().equalsIgnoreCase(k)) return vk;
    }
    throw new IllegalArgumentException("Unknown variable kind: " + kind);
  }
}
