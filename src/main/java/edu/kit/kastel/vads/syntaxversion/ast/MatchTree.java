package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;

import java.util.List;

/// A `match` statement.
public record MatchTree(ExpressionTree subject, List<MatchCaseTree> cases) implements StatementTree {
    public MatchTree {
        cases = List.copyOf(cases);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    public List<Tree> children() {
        return Children.builder().add(subject).addAll(cases).build();
    }
}
