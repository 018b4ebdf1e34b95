package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// The parameter list of a function or lambda.
///
/// `keywordDefaults` is aligned with `keywordOnly` and holds `null` for a keyword-only
/// parameter without a default. `varArgAnnotation` and `keywordArgAnnotation` are only
/// produced by grammars that annotate `*args` and `**kwargs` on the parameter list itself
/// instead of on the {@link ArgTree}.
public record ArgumentsTree(
    List<ArgTree> positionalOnly,
    List<ArgTree> positional,
    @Nullable ArgTree varArg,
    List<ArgTree> keywordOnly,
    List<@Nullable ExpressionTree> keywordDefaults,
    @Nullable ArgTree keywordArg,
    List<ExpressionTree> defaults,
    @Nullable ExpressionTree varArgAnnotation,
    @Nullable ExpressionTree keywordArgAnnotation
) implements Tree {
    public ArgumentsTree {
        positionalOnly = List.copyOf(positionalOnly);
        positional = List.copyOf(positional);
        keywordOnly = List.copyOf(keywordOnly);
        keywordDefaults = Collections.unmodifiableList(new ArrayList<>(keywordDefaults));
        defaults = List.copyOf(defaults);
    }

    public static ArgumentsTree empty() {
        return positional(List.of());
    }

    public static ArgumentsTree positional(List<ArgTree> positional) {
        return new ArgumentsTree(List.of(), positional, null, List.of(), List.of(), null, List.of(), null, null);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    public List<Tree> children() {
        return Children.builder()
            .addAll(positionalOnly)
            .addAll(positional)
            .add(varArg)
            .addAll(keywordOnly)
            .addAll(keywordDefaults)
            .add(keywordArg)
            .addAll(defaults)
            .add(varArgAnnotation)
            .add(keywordArgAnnotation)
            .build();
    }
}
