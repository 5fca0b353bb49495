package org.Aayush.panref.classify;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits an address-group member definition into its member tokens.
 *
 * <p>Accepts both {@code [ a b c ]} and bare {@code a b c} forms. Tokens are not
 * classified: a token may name an address or another group.</p>
 */
public final class MemberListParser {

    private MemberListParser() {
    }

    /**
     * Parses one raw member definition.
     *
     * @param definition raw definition text as written after {@code static}.
     * @return ordered member tokens (possibly empty).
     */
    public static List<String> parse(String definition) {
        String body = Objects.requireNonNull(definition, "definition").trim();
        if (body.startsWith("[") && body.endsWith("]")) {
            body = body.substring(1, body.length() - 1);
        }
        List<String> members = new ArrayList<>();
        for (String token : body.trim().split("\\s+")) {
            if (!token.isEmpty()) {
                members.add(token);
            }
        }
        return List.copyOf(members);
    }
}
