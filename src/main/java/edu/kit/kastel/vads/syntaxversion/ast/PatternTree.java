package edu.kit.kastel.vads.syntaxversion.ast;

/// A pattern of a `case` clause.
public interface PatternTree extends Tree {
}
