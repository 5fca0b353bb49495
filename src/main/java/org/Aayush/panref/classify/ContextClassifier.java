package org.Aayush.panref.classify;

import org.Aayush.panref.model.RuleContext;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Classifies where a name appears in a rule line by evaluating keyword spans.
 *
 * <p>The line is reduced to an ordered list of {@link KeywordSpan}s for the
 * {@code destination}, {@code source} and {@code service} keywords. The
 * {@link #RULES} table is then evaluated in order: each entry's segment starts
 * right after the first occurrence of its keyword and ends at the next span whose
 * keyword is one of the entry's boundaries (or at end of line). The first segment
 * containing the name decides; with no hit the context is
 * {@link RuleContext#DIRECT_REFERENCE}.</p>
 */
public final class ContextClassifier {
    public static final String DESTINATION = "destination";
    public static final String SOURCE = "source";
    public static final String SERVICE = "service";

    /**
     * Evaluation table in tie-break order.
     */
    public static final List<SegmentRule> RULES = List.of(
            new SegmentRule(DESTINATION, Set.of(DESTINATION, SOURCE), RuleContext.DESTINATION_FIELD),
            new SegmentRule(SOURCE, Set.of(SOURCE, DESTINATION), RuleContext.SOURCE_FIELD),
            new SegmentRule(SERVICE, Set.of(SERVICE), RuleContext.SERVICE_FIELD)
    );

    private static final List<String> KEYWORDS = List.of(DESTINATION, SOURCE, SERVICE);

    private ContextClassifier() {
    }

    /**
     * Classifies the context of {@code name} inside {@code line}.
     */
    public static RuleContext classify(String line, String name) {
        Objects.requireNonNull(line, "line");
        Objects.requireNonNull(name, "name");
        List<KeywordSpan> spans = spans(line);
        for (SegmentRule rule : RULES) {
            String segment = segmentAfter(line, spans, rule.keyword(), rule.boundaries());
            if (segment != null && segment.contains(name)) {
                return rule.context();
            }
        }
        return RuleContext.DIRECT_REFERENCE;
    }

    /**
     * Returns true when {@code name} occurs anywhere after the first {@code keyword}
     * occurrence, up to the keyword's next occurrence.
     */
    public static boolean appearsAfter(String line, String keyword, String name) {
        String segment = segmentAfter(line, spans(line), keyword, Set.of(keyword));
        return segment != null && segment.contains(name);
    }

    /**
     * Returns every non-overlapping keyword occurrence ordered by start offset.
     */
    public static List<KeywordSpan> spans(String line) {
        List<KeywordSpan> spans = new ArrayList<>();
        for (String keyword : KEYWORDS) {
            int from = 0;
            int at;
            while ((at = line.indexOf(keyword, from)) >= 0) {
                spans.add(new KeywordSpan(keyword, at));
                from = at + keyword.length();
            }
        }
        spans.sort(Comparator.comparingInt(KeywordSpan::start));
        return spans;
    }

    private static String segmentAfter(String line, List<KeywordSpan> spans, String keyword, Set<String> boundaries) {
        KeywordSpan first = null;
        for (KeywordSpan span : spans) {
            if (span.keyword().equals(keyword)) {
                first = span;
                break;
            }
        }
        if (first == null) {
            return null;
        }
        int begin = first.end();
        int end = line.length();
        for (KeywordSpan span : spans) {
            if (span.start() >= begin && boundaries.contains(span.keyword())) {
                end = span.start();
                break;
            }
        }
        return line.substring(begin, end);
    }

    /**
     * One keyword occurrence.
     */
    public record KeywordSpan(String keyword, int start) {
        public int end() {
            return start + keyword.length();
        }
    }

    /**
     * One row of the evaluation table.
     */
    public record SegmentRule(String keyword, Set<String> boundaries, RuleContext context) {
    }
}
