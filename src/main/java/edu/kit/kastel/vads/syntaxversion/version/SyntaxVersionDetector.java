package edu.kit.kastel.vads.syntaxversion.version;

import edu.kit.kastel.vads.syntaxversion.ast.AnnAssignTree;
import edu.kit.kastel.vads.syntaxversion.ast.ArgTree;
import edu.kit.kastel.vads.syntaxversion.ast.ArgumentsTree;
import edu.kit.kastel.vads.syntaxversion.ast.AwaitTree;
import edu.kit.kastel.vads.syntaxversion.ast.BytesLiteralTree;
import edu.kit.kastel.vads.syntaxversion.ast.ComprehensionTree;
import edu.kit.kastel.vads.syntaxversion.ast.ForTree;
import edu.kit.kastel.vads.syntaxversion.ast.FormattedStringTree;
import edu.kit.kastel.vads.syntaxversion.ast.FormattedValueTree;
import edu.kit.kastel.vads.syntaxversion.ast.FunctionDefTree;
import edu.kit.kastel.vads.syntaxversion.ast.MatchTree;
import edu.kit.kastel.vads.syntaxversion.ast.ModuleTree;
import edu.kit.kastel.vads.syntaxversion.ast.NamedExpressionTree;
import edu.kit.kastel.vads.syntaxversion.ast.NonlocalTree;
import edu.kit.kastel.vads.syntaxversion.ast.OperatorTree;
import edu.kit.kastel.vads.syntaxversion.ast.OperatorTree.OperatorType;
import edu.kit.kastel.vads.syntaxversion.ast.ParamSpecTree;
import edu.kit.kastel.vads.syntaxversion.ast.ReprTree;
import edu.kit.kastel.vads.syntaxversion.ast.StringLiteralTree;
import edu.kit.kastel.vads.syntaxversion.ast.Tree;
import edu.kit.kastel.vads.syntaxversion.ast.TryTree;
import edu.kit.kastel.vads.syntaxversion.ast.TypeVarTree;
import edu.kit.kastel.vads.syntaxversion.ast.TypeVarTupleTree;
import edu.kit.kastel.vads.syntaxversion.ast.WithTree;
import edu.kit.kastel.vads.syntaxversion.ast.YieldFromTree;
import edu.kit.kastel.vads.syntaxversion.visitor.DescendingVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/// Determines the range of grammar versions that can parse a syntax tree.
///
/// The tree is walked once, depth-first in pre-order. Most kinds only raise the floor of the
/// range; a few prove one exact version, which ends the walk immediately.
public final class SyntaxVersionDetector {

    private static final Logger LOG = LoggerFactory.getLogger(SyntaxVersionDetector.class);

    /// The oldest grammar known to the detector.
    public static final Version BASELINE = Version.of(2, 7);

    /// Formatted string literals may nest at most this deep before the grammar of 3.12.
    static final int MAX_FORMATTED_STRING_NESTING = 4;

    private static final Version LEGACY_STRING_CONVERSION = Version.of(2, 7);
    private static final Version PARAMETER_ANNOTATIONS = Version.of(3, 0);
    private static final Version KEYWORD_ONLY_PARAMETERS = Version.of(3, 0);
    private static final Version NONLOCAL = Version.of(3, 0);
    private static final Version YIELD_FROM = Version.of(3, 3);
    private static final Version MATRIX_MULTIPLICATION = Version.of(3, 5);
    private static final Version ASYNC_AWAIT = Version.of(3, 5);
    private static final Version FORMATTED_STRINGS = Version.of(3, 6);
    private static final Version VARIABLE_ANNOTATIONS = Version.of(3, 6);
    private static final Version ASYNC_COMPREHENSIONS = Version.of(3, 6);
    private static final Version ASSIGNMENT_EXPRESSIONS = Version.of(3, 8);
    private static final Version POSITION_ONLY_PARAMETERS = Version.of(3, 8);
    private static final Version PATTERN_MATCHING = Version.of(3, 10);
    private static final Version EXCEPTION_GROUPS = Version.of(3, 11);
    private static final Version TYPE_PARAMETERS = Version.of(3, 12);
    private static final Version DEEPLY_NESTED_FORMATTED_STRINGS = Version.of(3, 12);

    private static final Rules RULES = new Rules();

    private SyntaxVersionDetector() {
    }

    /// Returns the versions whose grammar accepts `root`.
    ///
    /// Without a pin the range starts at {@link #BASELINE} raised by every rule that applied, and ends at
    /// `host` or the raised floor, whichever is newer.
    ///
    /// @param root the module to analyse
    /// @param host the version of the runtime performing the analysis
    /// @throws InvariantViolationException if `root` is not a {@link ModuleTree}
    public static VersionRange detect(Tree root, Version host) {
        Objects.requireNonNull(host, "host");
        if (!(root instanceof ModuleTree module)) {
            throw new InvariantViolationException(
                "expected a module as root but got " + (root == null ? "null" : root.getClass().getSimpleName())
            );
        }

        Detection detection = new Detection(host);
        Traversal traversal = module.accept(RULES, detection);
        VersionRange range = traversal instanceof Traversal.Pinned pinned
            ? VersionRange.exactly(pinned.version())
            : new VersionRange(detection.floor, detection.ceiling);

        LOG.debug("Detected syntax versions {} (host {})", range, host);
        return range;
    }

    /// Per-call state. Never shared between calls.
    private static final class Detection {
        private Version floor = BASELINE;
        private Version ceiling;
        private int formattedStringDepth;

        private Detection(Version host) {
            this.ceiling = Version.max(BASELINE, host);
        }

        private void raiseFloor(Version version) {
            this.floor = Version.max(this.floor, version);
            this.ceiling = Version.max(this.ceiling, version);
        }

        private boolean nestingExceededOnEntry() {
            return this.formattedStringDepth + 1 > MAX_FORMATTED_STRING_NESTING;
        }
    }

    private static final class Rules implements DescendingVisitor<Detection, Traversal> {

        @Override
        public Traversal descend(Tree tree, Detection detection) {
            for (Tree child : tree.children()) {
                Traversal result = child.accept(this, detection);
                if (result.isPinned()) {
                    return result;
                }
            }
            return Traversal.CONTINUE;
        }

        private Traversal raiseAndDescend(Version floor, Tree tree, Detection detection) {
            detection.raiseFloor(floor);
            return descend(tree, detection);
        }

        private static Traversal pin(Version version, Tree tree) {
            LOG.debug("{} pins the syntax to exactly {}", tree.getClass().getSimpleName(), version);
            return Traversal.pinned(version);
        }

        // Literals

        @Override
        public Traversal visit(FormattedStringTree formattedStringTree, Detection detection) {
            detection.raiseFloor(FORMATTED_STRINGS);
            if (detection.nestingExceededOnEntry()) {
                return pin(DEEPLY_NESTED_FORMATTED_STRINGS, formattedStringTree);
            }
            detection.formattedStringDepth++;
            Traversal result = descend(formattedStringTree, detection);
            detection.formattedStringDepth--;
            return result;
        }

        @Override
        public Traversal visit(FormattedValueTree formattedValueTree, Detection detection) {
            // the format specifier is not visited
            return formattedValueTree.value().accept(this, detection);
        }

        @Override
        public Traversal visit(StringLiteralTree stringLiteralTree, Detection detection) {
            if (detection.nestingExceededOnEntry()) {
                return pin(DEEPLY_NESTED_FORMATTED_STRINGS, stringLiteralTree);
            }
            return Traversal.CONTINUE;
        }

        @Override
        public Traversal visit(BytesLiteralTree bytesLiteralTree, Detection detection) {
            if (detection.nestingExceededOnEntry()) {
                return pin(DEEPLY_NESTED_FORMATTED_STRINGS, bytesLiteralTree);
            }
            return Traversal.CONTINUE;
        }

        @Override
        public Traversal visit(ReprTree reprTree, Detection detection) {
            return pin(LEGACY_STRING_CONVERSION, reprTree);
        }

        // Expressions

        @Override
        public Traversal visit(NamedExpressionTree namedExpressionTree, Detection detection) {
            return raiseAndDescend(ASSIGNMENT_EXPRESSIONS, namedExpressionTree, detection);
        }

        @Override
        public Traversal visit(OperatorTree operatorTree, Detection detection) {
            if (operatorTree.type() == OperatorType.MAT_MULT) {
                detection.raiseFloor(MATRIX_MULTIPLICATION);
            }
            return Traversal.CONTINUE;
        }

        @Override
        public Traversal visit(YieldFromTree yieldFromTree, Detection detection) {
            return raiseAndDescend(YIELD_FROM, yieldFromTree, detection);
        }

        @Override
        public Traversal visit(AwaitTree awaitTree, Detection detection) {
            return raiseAndDescend(ASYNC_AWAIT, awaitTree, detection);
        }

        @Override
        public Traversal visit(ComprehensionTree comprehensionTree, Detection detection) {
            if (comprehensionTree.async()) {
                detection.raiseFloor(ASYNC_COMPREHENSIONS);
            }
            return descend(comprehensionTree, detection);
        }

        // Statements

        @Override
        public Traversal visit(AnnAssignTree annAssignTree, Detection detection) {
            return raiseAndDescend(VARIABLE_ANNOTATIONS, annAssignTree, detection);
        }

        @Override
        public Traversal visit(NonlocalTree nonlocalTree, Detection detection) {
            return raiseAndDescend(NONLOCAL, nonlocalTree, detection);
        }

        @Override
        public Traversal visit(FunctionDefTree functionDefTree, Detection detection) {
            if (functionDefTree.async()) {
                detection.raiseFloor(ASYNC_AWAIT);
            }
            return descend(functionDefTree, detection);
        }

        @Override
        public Traversal visit(ForTree forTree, Detection detection) {
            if (forTree.async()) {
                detection.raiseFloor(ASYNC_AWAIT);
            }
            return descend(forTree, detection);
        }

        @Override
        public Traversal visit(WithTree withTree, Detection detection) {
            if (withTree.async()) {
                detection.raiseFloor(ASYNC_AWAIT);
            }
            return descend(withTree, detection);
        }

        @Override
        public Traversal visit(MatchTree matchTree, Detection detection) {
            return raiseAndDescend(PATTERN_MATCHING, matchTree, detection);
        }

        @Override
        public Traversal visit(TryTree tryTree, Detection detection) {
            if (tryTree.star()) {
                detection.raiseFloor(EXCEPTION_GROUPS);
            }
            return descend(tryTree, detection);
        }

        // Parameters

        @Override
        public Traversal visit(ArgumentsTree argumentsTree, Detection detection) {
            if (!argumentsTree.positionalOnly().isEmpty()) {
                detection.raiseFloor(POSITION_ONLY_PARAMETERS);
            }
            if (!argumentsTree.keywordOnly().isEmpty()) {
                detection.raiseFloor(KEYWORD_ONLY_PARAMETERS);
            }
            if (argumentsTree.varArgAnnotation() != null || argumentsTree.keywordArgAnnotation() != null) {
                detection.raiseFloor(PARAMETER_ANNOTATIONS);
            }
            return descend(argumentsTree, detection);
        }

        @Override
        public Traversal visit(ArgTree argTree, Detection detection) {
            if (argTree.annotation() != null) {
                detection.raiseFloor(PARAMETER_ANNOTATIONS);
            }
            return descend(argTree, detection);
        }

        // Type parameters

        @Override
        public Traversal visit(TypeVarTree typeVarTree, Detection detection) {
            return pin(TYPE_PARAMETERS, typeVarTree);
        }

        @Override
        public Traversal visit(TypeVarTupleTree typeVarTupleTree, Detection detection) {
            return pin(TYPE_PARAMETERS, typeVarTupleTree);
        }

        @Override
        public Traversal visit(ParamSpecTree paramSpecTree, Detection detection) {
            return pin(TYPE_PARAMETERS, paramSpecTree);
        }
    }
}
