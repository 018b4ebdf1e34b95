package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;

import java.util.List;

/// A formatted string literal (f-string). Its values are string literals and {@link FormattedValueTree}s.
public record FormattedStringTree(List<ExpressionTree> values) implements ExpressionTree {
    public FormattedStringTree {
        values = List.copyOf(values);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    public List<Tree> children() {
        return List.copyOf(values);
    }
}
