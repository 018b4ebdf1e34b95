package edu.kit.kastel.vads.syntaxversion.ast;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/// Collects the children of a node in field order, skipping absent optional fields.
final class Children {
    private final List<Tree> trees = new ArrayList<>();

    private Children() {
    }

    static Children builder() {
        return new Children();
    }

    Children add(@Nullable Tree tree) {
        if (tree != null) {
            this.trees.add(tree);
        }
        return this;
    }

    Children addAll(List<? extends @Nullable Tree> trees) {
        for (Tree tree : trees) {
            add(tree);
        }
        return this;
    }

    List<Tree> build() {
        return List.copyOf(this.trees);
    }
}
