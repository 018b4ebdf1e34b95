package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;

import java.util.List;

/// A `try` statement. If `star` is set, the handlers are exception-group handlers (`except*`).
public record TryTree(
    List<StatementTree> body,
    List<ExceptHandlerTree> handlers,
    List<StatementTree> orElse,
    List<StatementTree> finalBody,
    boolean star
) implements StatementTree {
    public TryTree {
        body = List.copyOf(body);
        handlers = List.copyOf(handlers);
        orElse = List.copyOf(orElse);
        finalBody = List.copyOf(finalBody);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    public List<Tree> children() {
        return Children.builder().addAll(body).addAll(handlers).addAll(orElse).addAll(finalBody).build();
    }
}
