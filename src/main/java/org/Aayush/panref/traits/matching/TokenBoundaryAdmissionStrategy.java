package org.Aayush.panref.traits.matching;

/**
 * Admits a line only when the name occurs as a whole token.
 *
 * <p>Token boundaries are line start/end, whitespace, double quotes and square
 * brackets, so {@code web1} matches {@code [ web1 web2 ]} and {@code "web1"} but
 * not {@code web10}.</p>
 */
public final class TokenBoundaryAdmissionStrategy implements AdmissionStrategy {

    @Override
    public String id() {
        return AdmissionStrategyRegistry.STRATEGY_TOKEN_BOUNDARY;
    }

    @Override
    public boolean admits(String line, String name) {
        if (name.isEmpty()) {
            return false;
        }
        int from = 0;
        int at;
        while ((at = line.indexOf(name, from)) >= 0) {
            int end = at + name.length();
            if (isBoundary(line, at - 1) && isBoundary(line, end)) {
                return true;
            }
            from = at + 1;
        }
        return false;
    }

    private static boolean isBoundary(String line, int index) {
        if (index < 0 || index >= line.length()) {
            return true;
        }
        char c = line.charAt(index);
        return Character.isWhitespace(c) || c == '"' || c == '[' || c == ']';
    }
}
