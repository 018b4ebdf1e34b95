package edu.kit.kastel.vads.syntaxversion.version;

/// The outcome of visiting a subtree: either the walk goes on, or a node pinned an exact
/// version and the rest of the tree is skipped. Checked after every recursive step.
public sealed interface Traversal permits Traversal.Continue, Traversal.Pinned {

    Traversal CONTINUE = new Continue();

    static Traversal pinned(Version version) {
        return new Pinned(version);
    }

    default boolean isPinned() {
        return this instanceof Pinned;
    }

    record Continue() implements Traversal {
    }

    record Pinned(Version version) implements Traversal {
    }
}
