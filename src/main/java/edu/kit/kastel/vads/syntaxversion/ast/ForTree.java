package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;

import java.util.List;

/// A `for` or `async for` loop.
public record ForTree(
    ExpressionTree target,
    ExpressionTree iterable,
    List<StatementTree> body,
    List<StatementTree> orElse,
    boolean async
) implements StatementTree {
    public ForTree {
        body = List.copyOf(body);
        orElse = List.copyOf(orElse);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    public List<Tree> children() {
        return Children.builder().add(target).add(iterable).addAll(body).addAll(orElse).build();
    }
}
