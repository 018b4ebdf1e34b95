package edu.kit.kastel.vads.syntaxversion.visitor;

import edu.kit.kastel.vads.syntaxversion.ast.BinaryOperationTree;
import edu.kit.kastel.vads.syntaxversion.ast.ExpressionStatementTree;
import edu.kit.kastel.vads.syntaxversion.ast.ModuleTree;
import edu.kit.kastel.vads.syntaxversion.ast.NameTree;
import edu.kit.kastel.vads.syntaxversion.ast.OperatorTree;
import edu.kit.kastel.vads.syntaxversion.ast.OperatorTree.OperatorType;
import edu.kit.kastel.vads.syntaxversion.ast.Tree;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DescendingVisitorTest {

    /// Records every visited node in visiting order. Names are recorded by their id.
    private static final class Recorder implements DescendingVisitor<List<String>, Integer> {

        @Override
        public Integer descend(Tree tree, List<String> visited) {
            visited.add(tree.getClass().getSimpleName());
            int count = 1;
            for (Tree child : tree.children()) {
                count += child.accept(this, visited);
            }
            return count;
        }

        @Override
        public Integer visit(NameTree nameTree, List<String> visited) {
            visited.add("name:" + nameTree.id());
            return 1;
        }
    }

    @Test
    void whenVisiting_givenDefaultMethods_shouldDescendInPreorder() {
        ModuleTree module = new ModuleTree(List.of(new ExpressionStatementTree(
            new BinaryOperationTree(new NameTree("a"), OperatorTree.of(OperatorType.MAT_MULT), new NameTree("b"))
        )));
        List<String> visited = new ArrayList<>();

        int count = module.accept(new Recorder(), visited);

        assertEquals(6, count);
        assertEquals(List.of(
            "ModuleTree", "ExpressionStatementTree", "BinaryOperationTree", "name:a", "OperatorTree", "name:b"
        ), visited);
    }
}
