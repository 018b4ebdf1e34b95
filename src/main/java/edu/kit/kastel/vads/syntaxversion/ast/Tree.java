package edu.kit.kastel.vads.syntaxversion.ast;

import edu.kit.kastel.vads.syntaxversion.visitor.Visitor;

import java.util.List;

public interface Tree {

    <T, R> R accept(Visitor<T, R> visitor, T data);

    /// The child nodes in field order.
    /// Absent optional fields and scalar fields (names, flags, literal text) are not included.
    List<Tree> children();
}
