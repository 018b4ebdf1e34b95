package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;

import java.util.List;

public record ClassDefTree(
    String name,
    List<ExpressionTree> bases,
    List<KeywordTree> keywords,
    List<StatementTree> body,
    List<ExpressionTree> decorators,
    List<TypeParamTree> typeParams
) implements StatementTree {
    public ClassDefTree {
        bases = List.copyOf(bases);
        keywords = List.copyOf(keywords);
        body = List.copyOf(body);
        decorators = List.copyOf(decorators);
        typeParams = List.copyOf(typeParams);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    public List<Tree> children() {
        return Children.builder()
            .addAll(bases)
            .addAll(keywords)
            .addAll(body)
            .addAll(decorators)
            .addAll(typeParams)
            .build();
    }
}
