package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;
import org.jspecify.annotations.Nullable;

import java.util.List;

/// `contextExpression as optionalVars`
public record WithItemTree(ExpressionTree contextExpression, @Nullable ExpressionTree optionalVars)
    implements Tree {

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    public List<Tree> children() {
        return Children.builder().add(contextExpression).add(optionalVars).build();
    }
}
