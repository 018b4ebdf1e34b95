package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;

import java.util.List;

public record IfTree(ExpressionTree test, List<StatementTree> body, List<StatementTree> orElse)
    implements StatementTree {
    public IfTree {
        body = List.copyOf(body);
        orElse = List.copyOf(orElse);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    public List<Tree> children() {
        return Children.builder().add(test).addAll(body).addAll(orElse).build();
    }
}
