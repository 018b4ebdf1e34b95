package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;

import java.util.List;

/// A list, set or generator comprehension.
public record ComprehensionExpressionTree(Kind kind, ExpressionTree element, List<ComprehensionTree> generators)
    implements ExpressionTree {
    public ComprehensionExpressionTree {
        generators = List.copyOf(generators);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    public List<Tree> children() {
        return Children.builder().add(element).addAll(generators).build();
    }

    public enum Kind {
        LIST,
        SET,
        GENERATOR
    }
}
