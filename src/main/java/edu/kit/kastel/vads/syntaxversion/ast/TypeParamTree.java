package edu.kit.kastel.vads.syntaxversion.ast;

/// A type parameter declared on a generic function or class.
public interface TypeParamTree extends Tree {
    String name();
}
