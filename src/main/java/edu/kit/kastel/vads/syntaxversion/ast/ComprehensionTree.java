package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;

import java.util.List;

/// One `for target in iterable if condition...` clause of a comprehension, optionally `async for`.
public record ComprehensionTree(
    ExpressionTree target,
    ExpressionTree iterable,
    List<ExpressionTree> conditions,
    boolean async
) implements Tree {
    public ComprehensionTree {
        conditions = List.copyOf(conditions);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    public List<Tree> children() {
        return Children.builder().add(target).add(iterable).addAll(conditions).build();
    }
}
