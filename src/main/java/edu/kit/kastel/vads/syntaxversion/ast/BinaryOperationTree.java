package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;

import java.util.List;

public record BinaryOperationTree(ExpressionTree lhs, OperatorTree operator, ExpressionTree rhs)
    implements ExpressionTree {

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    public List<Tree> children() {
        return List.of(lhs, operator, rhs);
    }
}
