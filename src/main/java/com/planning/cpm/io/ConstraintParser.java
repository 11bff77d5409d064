package com.planning.cpm.io;

import com.planning.cpm.api.RelationType;
import com.planning.cpm.config.Delimiter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses constraint expressions such as {@code "A[FS+5];B SS-2;CFF"} into
 * relations.
 *
 * <p>
 * Token grammar: {@code <predecessor-id><code>[<signed-lag>]} where code is
 * one of FS, SS, FF, SF (case-sensitive) and the optional lag carries an
 * explicit sign. The code and lag may also be wrapped in brackets:
 * {@code A[FS+5]}. Whitespace around tokens and ids is ignored. Ids cannot
 * contain brackets, commas or semicolons.
 *
 * <p>
 * Never throws on malformed input. Tokens that do not match are dropped and
 * reported in {@link ParsedConstraints#skipped()}. Empty tokens (for example
 * after a trailing delimiter) are ignored and not counted as skipped.
 */
public final class ConstraintParser {
    private static final Pattern TOKEN = Pattern.compile(
            "(?<id>[^\\[\\],;]+?)\\s*(?:"
                    + "\\[\\s*(?<btype>FS|SS|FF|SF)\\s*(?<blag>[+-]\\s*\\d{1,9})?\\s*\\]"
                    + "|(?<type>FS|SS|FF|SF)\\s*(?<lag>[+-]\\s*\\d{1,9})?)");

    private final Delimiter delimiter;

    public ConstraintParser(Delimiter delimiter) {
        this.delimiter = Objects.requireNonNull(delimiter, "delimiter");
    }

    /**
     * @param expression May be null or blank, both yield an empty result.
     */
    public ParsedConstraints parse(String expression) {
        if (expression == null || expression.isBlank())
            return ParsedConstraints.EMPTY;

        List<ConstraintRelation> relations = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (String raw : delimiter.split(expression)) {
            String token = raw.strip();
            if (token.isEmpty())
                continue;
            ConstraintRelation relation = parseToken(token);
            if (relation == null)
                skipped.add(token);
            else
                relations.add(relation);
        }
        return new ParsedConstraints(relations, skipped);
    }

    /**
     * Parses a bare, comma-separated predecessor list. Each id becomes a
     * finish-to-start relation with lag 0.
     */
    public static List<ConstraintRelation> parsePredecessors(String predecessors) {
        List<ConstraintRelation> relations = new ArrayList<>();
        if (predecessors == null || predecessors.isBlank())
            return relations;
        for (String raw : Delimiter.COMMA.split(predecessors)) {
            String id = raw.strip();
            if (!id.isEmpty())
                relations.add(ConstraintRelation.finishToStart(id));
        }
        return relations;
    }

    /** @return the relation, or null when the token does not match the grammar. */
    static ConstraintRelation parseToken(String token) {
        Matcher m = TOKEN.matcher(token);
        if (!m.matches())
            return null;
        String id = m.group("id").strip();
        if (id.isEmpty())
            return null;
        boolean bracketed = m.group("btype") != null;
        RelationType type = RelationType.fromCode(bracketed ? m.group("btype") : m.group("type"));
        String lag = bracketed ? m.group("blag") : m.group("lag");
        return new ConstraintRelation(id, type, lag == null ? 0 : parseLag(lag));
    }

    private static int parseLag(String signed) {
        String digits = signed.substring(1).strip();
        int magnitude = Integer.parseInt(digits);
        return signed.charAt(0) == '-' ? -magnitude : magnitude;
    }
}
