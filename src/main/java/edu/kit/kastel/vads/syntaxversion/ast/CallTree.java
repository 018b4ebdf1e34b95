package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;

import java.util.List;

public record CallTree(ExpressionTree function, List<ExpressionTree> arguments, List<KeywordTree> keywords)
    implements ExpressionTree {
    public CallTree {
        arguments = List.copyOf(arguments);
        keywords = List.copyOf(keywords);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    public List<Tree> children() {
        return Children.builder().add(function).addAll(arguments).addAll(keywords).build();
    }
}
