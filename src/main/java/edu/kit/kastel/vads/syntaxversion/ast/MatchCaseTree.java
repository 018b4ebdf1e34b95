package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;
import org.jspecify.annotations.Nullable;

import java.util.List;

public record MatchCaseTree(PatternTree pattern, @Nullable ExpressionTree guard, List<StatementTree> body)
    implements Tree {
    public MatchCaseTree {
        body = List.copyOf(body);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    public List<Tree> children() {
        return Children.builder().add(pattern).add(guard).addAll(body).build();
    }
}
