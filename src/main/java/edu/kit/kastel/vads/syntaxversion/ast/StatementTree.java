package edu.kit.kastel.vads.syntaxversion.ast;

public interface StatementTree extends Tree {
}
