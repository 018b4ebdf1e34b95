package edu.kit.kastel.vads.syntaxversion.version;

import edu.kit.kastel.vads.syntaxversion.ast.ExpressionStatementTree;
import edu.kit.kastel.vads.syntaxversion.ast.ExpressionTree;
import edu.kit.kastel.vads.syntaxversion.ast.FormattedStringTree;
import edu.kit.kastel.vads.syntaxversion.ast.FormattedValueTree;
import edu.kit.kastel.vads.syntaxversion.ast.LiteralTree;
import edu.kit.kastel.vads.syntaxversion.ast.ModuleTree;
import edu.kit.kastel.vads.syntaxversion.ast.NameTree;
import edu.kit.kastel.vads.syntaxversion.ast.StatementTree;
import edu.kit.kastel.vads.syntaxversion.ast.StringLiteralTree;

import java.util.List;

/// Shorthands for building test trees.
final class SyntaxTrees {

    private SyntaxTrees() {
    }

    static ModuleTree module(StatementTree... body) {
        return new ModuleTree(List.of(body));
    }

    static ExpressionStatementTree expr(ExpressionTree expression) {
        return new ExpressionStatementTree(expression);
    }

    static NameTree name(String id) {
        return new NameTree(id);
    }

    static LiteralTree number(int value) {
        return new LiteralTree(Integer.toString(value));
    }

    static StringLiteralTree str(String value) {
        return new StringLiteralTree(value);
    }

    /// `f"{value}"`
    static FormattedStringTree fstring(ExpressionTree value) {
        return new FormattedStringTree(List.of(FormattedValueTree.of(value)));
    }

    /// `levels` formatted string literals nested inside each other around `innermost`.
    static FormattedStringTree nestedFstrings(int levels, ExpressionTree innermost) {
        FormattedStringTree tree = fstring(innermost);
        for (int i = 1; i < levels; i++) {
            tree = fstring(tree);
        }
        return tree;
    }
}
