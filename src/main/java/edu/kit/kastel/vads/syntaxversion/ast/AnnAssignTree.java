package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;
import org.jspecify.annotations.Nullable;

import java.util.List;

/// An assignment with a type annotation, `target: annotation = value`. The value is optional.
public record AnnAssignTree(
    ExpressionTree target,
    ExpressionTree annotation,
    @Nullable ExpressionTree value,
    boolean simple
) implements StatementTree {

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    public List<Tree> children() {
        return Children.builder().add(target).add(annotation).add(value).build();
    }
}
