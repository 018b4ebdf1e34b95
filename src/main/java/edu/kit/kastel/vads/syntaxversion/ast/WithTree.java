package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;

import java.util.List;

/// A `with` or `async with` statement.
public record WithTree(List<WithItemTree> items, List<StatementTree> body, boolean async)
    implements StatementTree {
    public WithTree {
        items = List.copyOf(items);
        body = List.copyOf(body);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    public List<Tree> children() {
        return Children.builder().addAll(items).addAll(body).build();
    }
}
