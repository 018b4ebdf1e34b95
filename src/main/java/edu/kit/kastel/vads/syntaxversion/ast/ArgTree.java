package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;
import org.jspecify.annotations.Nullable;

import java.util.List;

/// A single parameter.
public record ArgTree(String name, @Nullable ExpressionTree annotation) implements Tree {

    public static ArgTree named(String name) {
        return new ArgTree(name, null);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    public List<Tree> children() {
        return Children.builder().add(annotation).build();
    }
}
