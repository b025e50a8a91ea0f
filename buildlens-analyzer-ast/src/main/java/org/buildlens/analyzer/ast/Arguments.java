package org.buildlens.analyzer.ast;

import java.util.List;
import java.util.stream.Stream;

/**
 * Arguments of a function or method call, elements of an array, or the key-value pairs of a dict.
 * For calls, keyword keys are {@link IdNode}s; for dicts they are arbitrary expressions.
 */
public final class Arguments {
    public static final Arguments EMPTY = new Arguments(List.of(), List.of());

    public record KeywordArgument(Node key, Node value) {
    }

    private final List<Node> positional;
    private final List<KeywordArgument> keywords;

    public Arguments(List<Node> positional, List<KeywordArgument> keywords) {
        this.positional = List.copyOf(positional);
        this.keywords = List.copyOf(keywords);
    }

    public List<Node> positional() {
        return positional;
    }

    public List<KeywordArgument> keywords() {
        return keywords;
    }

    public boolean isEmpty() {
        return positional.isEmpty() && keywords.isEmpty();
    }

    public boolean hasKeywords() {
        return !keywords.isEmpty();
    }

    // only for call arguments, where the keys are identifiers
    public Node keyword(String name) {
        for (KeywordArgument ka : keywords) {
            if (ka.key() instanceof IdNode id && id.name().equals(name)) return ka.value();
        }
        return null;
    }

    public static String keyName(KeywordArgument keywordArgument) {
        if (keywordArgument.key() instanceof IdNode id) return id.name();
        if (keywordArgument.key() instanceof StringNode sn) return sn.value();
        return null;
    }

    // positional arguments first, then the values of the keyword arguments
    public Stream<Node> valueStream() {
        return Stream.concat(positional.stream(), keywords.stream().map(KeywordArgument::value));
    }
}
