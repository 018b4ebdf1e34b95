package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;
import org.jspecify.annotations.Nullable;

import java.util.List;

/// A replacement field `{value!conversion:formatSpec}` inside a formatted string literal.
/// `conversion` is -1 when absent, otherwise the code point of `s`, `r` or `a`.
public record FormattedValueTree(ExpressionTree value, int conversion, @Nullable FormattedStringTree formatSpec)
    implements ExpressionTree {

    public static final int NO_CONVERSION = -1;

    public static FormattedValueTree of(ExpressionTree value) {
        return new FormattedValueTree(value, NO_CONVERSION, null);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    public List<Tree> children() {
        return Children.builder().add(value).add(formatSpec).build();
    }
}
