package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;

import java.util.List;

/// `target op= value`
public record AugAssignTree(ExpressionTree target, OperatorTree operator, ExpressionTree value)
    implements StatementTree {

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    public List<Tree> children() {
        return List.of(target, operator, value);
    }
}
