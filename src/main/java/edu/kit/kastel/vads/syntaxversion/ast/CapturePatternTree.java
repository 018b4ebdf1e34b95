package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;
import org.jspecify.annotations.Nullable;

import java.util.List;

/// Binds the subject to `name`. Without a name this is the wildcard `_`.
public record CapturePatternTree(@Nullable String name) implements PatternTree {

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    public List<Tree> children() {
        return List.of();
    }
}
