package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;

import java.util.List;

public record AssignTree(List<ExpressionTree> targets, ExpressionTree value) implements StatementTree {
    public AssignTree {
        targets = List.copyOf(targets);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    public List<Tree> children() {
        return Children.builder().addAll(targets).add(value).build();
    }
}
