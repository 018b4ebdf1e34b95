package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;

import java.util.List;

/// The top-level program unit. The only kind accepted as the root of an analysis.
public record ModuleTree(List<StatementTree> body) implements Tree {
    public ModuleTree {
        body = List.copyOf(body);
    }

    @Override
    public <T, R> R accept(Visitor<T, R> visitor, T data) {
        return visitor.visit(this, data);
    }

    @Override
    public List<Tree> children() {
        return List.copyOf(body);
    }
}
