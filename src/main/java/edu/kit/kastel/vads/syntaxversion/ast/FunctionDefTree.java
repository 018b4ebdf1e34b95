package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;
import org.jspecify.annotations.Nullable;

import java.util.List;

/// A `def` or `async def` statement.
public record FunctionDefTree(
    String name,
    ArgumentsTree arguments,
    List<StatementTree> body,
    List<ExpressionTree> decorators,
    @Nullable ExpressionTree returns,
    List<TypeParamTree> typeParams,
    boolean async
) implements StatementTree {
    public FunctionDefTree {
        body = List.copyOf(body);
        decorators = List.copyOf(decorators);
        typeParams = List.copyOf(typeParams);
    }

    public static FunctionDefTree simple(String name, ArgumentsTree arguments, List<StatementTree> body) {
        return new FunctionDefTree(name, arguments, body, List.of(), null, List.of(), false);
    }

    public static FunctionDefTree asyncFunction(String name, ArgumentsTree arguments, List<StatementTree> body) {
        return new FunctionDefTree(name, arguments, body, List.of(), null, List.of(), true);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    public List<Tree> children() {
        return Children.builder()
            .add(arguments)
            .addAll(body)
            .addAll(decorators)
            .add(returns)
            .addAll(typeParams)
            .build();
    }
}
