package org.Aayush.panref.traits.matching;

/**
 * Admits a line when the name occurs anywhere in it as a literal substring.
 *
 * <p>Names that are prefixes or substrings of other names over-match
 * ({@code web1} admits lines naming {@code web10}). This is the default policy.</p>
 */
public final class SubstringAdmissionStrategy implements AdmissionStrategy {

    @Override
    public String id() {
        return AdmissionStrategyRegistry.STRATEGY_SUBSTRING;
    }

    @Override
    public boolean admits(String line, String name) {
        return line.contains(name);
    }
}
