package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;

import java.util.List;

public record TupleTree(List<ExpressionTree> elements) implements ExpressionTree {
    public TupleTree {
        elements = List.copyOf(elements);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    public List<Tree> children() {
        return List.copyOf(elements);
    }
}
