package edu.kit.kastel.vads.syntaxversion.visitor;

import edu.kit.kastel.vads.syntaxversion.ast.AnnAssignTree;
import edu.kit.kastel.vads.syntaxversion.ast.ArgTree;
import edu.kit.kastel.vads.syntaxversion.ast.ArgumentsTree;
import edu.kit.kastel.vads.syntaxversion.ast.AssignTree;
import edu.kit.kastel.vads.syntaxversion.ast.AttributeTree;
import edu.kit.kastel.vads.syntaxversion.ast.AugAssignTree;
import edu.kit.kastel.vads.syntaxversion.ast.AwaitTree;
import edu.kit.kastel.vads.syntaxversion.ast.BinaryOperationTree;
import edu.kit.kastel.vads.syntaxversion.ast.BreakTree;
import edu.kit.kastel.vads.syntaxversion.ast.BytesLiteralTree;
import edu.kit.kastel.vads.syntaxversion.ast.CallTree;
import edu.kit.kastel.vads.syntaxversion.ast.CapturePatternTree;
import edu.kit.kastel.vads.syntaxversion.ast.ClassDefTree;
import edu.kit.kastel.vads.syntaxversion.ast.ComprehensionExpressionTree;
import edu.kit.kastel.vads.syntaxversion.ast.ComprehensionTree;
import edu.kit.kastel.vads.syntaxversion.ast.ContinueTree;
import edu.kit.kastel.vads.syntaxversion.ast.ExceptHandlerTree;
import edu.kit.kastel.vads.syntaxversion.ast.ExpressionStatementTree;
import edu.kit.kastel.vads.syntaxversion.ast.ForTree;
import edu.kit.kastel.vads.syntaxversion.ast.FormattedStringTree;
import edu.kit.kastel.vads.syntaxversion.ast.FormattedValueTree;
import edu.kit.kastel.vads.syntaxversion.ast.FunctionDefTree;
import edu.kit.kastel.vads.syntaxversion.ast.GlobalTree;
import edu.kit.kastel.vads.syntaxversion.ast.IfTree;
import edu.kit.kastel.vads.syntaxversion.ast.KeywordTree;
import edu.kit.kastel.vads.syntaxversion.ast.LambdaTree;
import edu.kit.kastel.vads.syntaxversion.ast.ListTree;
import edu.kit.kastel.vads.syntaxversion.ast.LiteralTree;
import edu.kit.kastel.vads.syntaxversion.ast.MatchCaseTree;
import edu.kit.kastel.vads.syntaxversion.ast.MatchTree;
import edu.kit.kastel.vads.syntaxversion.ast.ModuleTree;
import edu.kit.kastel.vads.syntaxversion.ast.NameTree;
import edu.kit.kastel.vads.syntaxversion.ast.NamedExpressionTree;
import edu.kit.kastel.vads.syntaxversion.ast.NonlocalTree;
import edu.kit.kastel.vads.syntaxversion.ast.OperatorTree;
import edu.kit.kastel.vads.syntaxversion.ast.ParamSpecTree;
import edu.kit.kastel.vads.syntaxversion.ast.PassTree;
import edu.kit.kastel.vads.syntaxversion.ast.RaiseTree;
import edu.kit.kastel.vads.syntaxversion.ast.ReprTree;
import edu.kit.kastel.vads.syntaxversion.ast.ReturnTree;
import edu.kit.kastel.vads.syntaxversion.ast.StringLiteralTree;
import edu.kit.kastel.vads.syntaxversion.ast.Tree;
import edu.kit.kastel.vads.syntaxversion.ast.TryTree;
import edu.kit.kastel.vads.syntaxversion.ast.TupleTree;
import edu.kit.kastel.vads.syntaxversion.ast.TypeVarTree;
import edu.kit.kastel.vads.syntaxversion.ast.TypeVarTupleTree;
import edu.kit.kastel.vads.syntaxversion.ast.ValuePatternTree;
import edu.kit.kastel.vads.syntaxversion.ast.WhileTree;
import edu.kit.kastel.vads.syntaxversion.ast.WithItemTree;
import edu.kit.kastel.vads.syntaxversion.ast.WithTree;
import edu.kit.kastel.vads.syntaxversion.ast.YieldFromTree;
import edu.kit.kastel.vads.syntaxversion.ast.YieldTree;

/// A visitor for which every kind is pass-through: each method defaults to {@link #descend}.
/// Implementations override only the kinds they care about.
public interface DescendingVisitor<T, R> extends Visitor<T, R> {

    /// Visits the children of `tree`.
    R descend(Tree tree, T data);

    @Override
    default R visit(ModuleTree moduleTree, T data) {
        return descend(moduleTree, data);
    }

    @Override
    default R visit(FunctionDefTree functionDefTree, T data) {
        return descend(functionDefTree, data);
    }

    @Override
    default R visit(ClassDefTree classDefTree, T data) {
        return descend(classDefTree, data);
    }

    @Override
    default R visit(ReturnTree returnTree, T data) {
        return descend(returnTree, data);
    }

    @Override
    default R visit(AssignTree assignTree, T data) {
        return descend(assignTree, data);
    }

    @Override
    default R visit(AugAssignTree augAssignTree, T data) {
        return descend(augAssignTree, data);
    }

    @Override
    default R visit(AnnAssignTree annAssignTree, T data) {
        return descend(annAssignTree, data);
    }

    @Override
    default R visit(ForTree forTree, T data) {
        return descend(forTree, data);
    }

    @Override
    default R visit(WhileTree whileTree, T data) {
        return descend(whileTree, data);
    }

    @Override
    default R visit(IfTree ifTree, T data) {
        return descend(ifTree, data);
    }

    @Override
    default R visit(WithTree withTree, T data) {
        return descend(withTree, data);
    }

    @Override
    default R visit(WithItemTree withItemTree, T data) {
        return descend(withItemTree, data);
    }

    @Override
    default R visit(MatchTree matchTree, T data) {
        return descend(matchTree, data);
    }

    @Override
    default R visit(MatchCaseTree matchCaseTree, T data) {
        return descend(matchCaseTree, data);
    }

    @Override
    default R visit(TryTree tryTree, T data) {
        return descend(tryTree, data);
    }

    @Override
    default R visit(ExceptHandlerTree exceptHandlerTree, T data) {
        return descend(exceptHandlerTree, data);
    }

    @Override
    default R visit(NonlocalTree nonlocalTree, T data) {
        return descend(nonlocalTree, data);
    }

    @Override
    default R visit(GlobalTree globalTree, T data) {
        return descend(globalTree, data);
    }

    @Override
    default R visit(ExpressionStatementTree expressionStatementTree, T data) {
        return descend(expressionStatementTree, data);
    }

    @Override
    default R visit(PassTree passTree, T data) {
        return descend(passTree, data);
    }

    @Override
    default R visit(BreakTree breakTree, T data) {
        return descend(breakTree, data);
    }

    @Override
    default R visit(ContinueTree continueTree, T data) {
        return descend(continueTree, data);
    }

    @Override
    default R visit(RaiseTree raiseTree, T data) {
        return descend(raiseTree, data);
    }

    @Override
    default R visit(NameTree nameTree, T data) {
        return descend(nameTree, data);
    }

    @Override
    default R visit(LiteralTree literalTree, T data) {
        return descend(literalTree, data);
    }

    @Override
    default R visit(StringLiteralTree stringLiteralTree, T data) {
        return descend(stringLiteralTree, data);
    }

    @Override
    default R visit(BytesLiteralTree bytesLiteralTree, T data) {
        return descend(bytesLiteralTree, data);
    }

    @Override
    default R visit(FormattedStringTree formattedStringTree, T data) {
        return descend(formattedStringTree, data);
    }

    @Override
    default R visit(FormattedValueTree formattedValueTree, T data) {
        return descend(formattedValueTree, data);
    }

    @Override
    default R visit(BinaryOperationTree binaryOperationTree, T data) {
        return descend(binaryOperationTree, data);
    }

    @Override
    default R visit(OperatorTree operatorTree, T data) {
        return descend(operatorTree, data);
    }

    @Override
    default R visit(CallTree callTree, T data) {
        return descend(callTree, data);
    }

    @Override
    default R visit(KeywordTree keywordTree, T data) {
        return descend(keywordTree, data);
    }

    @Override
    default R visit(AttributeTree attributeTree, T data) {
        return descend(attributeTree, data);
    }

    @Override
    default R visit(ListTree listTree, T data) {
        return descend(listTree, data);
    }

    @Override
    default R visit(TupleTree tupleTree, T data) {
        return descend(tupleTree, data);
    }

    @Override
    default R visit(NamedExpressionTree namedExpressionTree, T data) {
        return descend(namedExpressionTree, data);
    }

    @Override
    default R visit(AwaitTree awaitTree, T data) {
        return descend(awaitTree, data);
    }

    @Override
    default R visit(YieldTree yieldTree, T data) {
        return descend(yieldTree, data);
    }

    @Override
    default R visit(YieldFromTree yieldFromTree, T data) {
        return descend(yieldFromTree, data);
    }

    @Override
    default R visit(LambdaTree lambdaTree, T data) {
        return descend(lambdaTree, data);
    }

    @Override
    default R visit(ComprehensionExpressionTree comprehensionExpressionTree, T data) {
        return descend(comprehensionExpressionTree, data);
    }

    @Override
    default R visit(ComprehensionTree comprehensionTree, T data) {
        return descend(comprehensionTree, data);
    }

    @Override
    default R visit(ReprTree reprTree, T data) {
        return descend(reprTree, data);
    }

    @Override
    default R visit(ArgumentsTree argumentsTree, T data) {
        return descend(argumentsTree, data);
    }

    @Override
    default R visit(ArgTree argTree, T data) {
        return descend(argTree, data);
    }

    @Override
    default R visit(ValuePatternTree valuePatternTree, T data) {
        return descend(valuePatternTree, data);
    }

    @Override
    default R visit(CapturePatternTree capturePatternTree, T data) {
        return descend(capturePatternTree, data);
    }

    @Override
    default R visit(TypeVarTree typeVarTree, T data) {
        return descend(typeVarTree, data);
    }

    @Override
    default R visit(TypeVarTupleTree typeVarTupleTree, T data) {
        return descend(typeVarTupleTree, data);
    }

    @Override
    default R visit(ParamSpecTree paramSpecTree, T data) {
        return descend(paramSpecTree, data);
    }
}
