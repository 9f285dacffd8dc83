package org.pragmatica.calculator.tree;

import java.util.Optional;

/**
 * Mathematical constants available in expressions, with 100 significant digits.
 */
public final class Constants {
    public static final String E_DIGITS =
        "2.7182818284590452353602874713526624977572470936999595749669676277240766303535475945713821785251664274";
    public static final String PI_DIGITS =
        "3.1415926535897932384626433832795028841971693993751058209749445923078164062862089986280348253421170679";

    public static final Node.Number E = Node.Number.constant(E_DIGITS);
    public static final Node.Number PI = Node.Number.constant(PI_DIGITS);

    private Constants() {}

    /**
     * Constant denoted by a normalized symbol: {@code e} or {@code p}.
     */
    public static Optional<Node.Number> forSymbol(char c) {
        return switch (c) {
            case 'e' -> Optional.of(E);
            case 'p' -> Optional.of(PI);
            default -> Optional.empty();
        };
    }
}
