package edu.kit.kastel.vads.syntaxversion.ast;

public interface ExpressionTree extends Tree {
}
