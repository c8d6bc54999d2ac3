package io.intellixity.varplan.variable;

/**
 * Presentation settings of a variable.
 *
 * @param name label shown instead of the variable name (optional)
 * @param description tooltip text (optional)
 * @param hidden whether the selector is hidden
 */
public record Display(String name, String description, boolean hidden) {
}
