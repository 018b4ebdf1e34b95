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

public interface Visitor<T, R> {
    R visit(ModuleTree moduleTree, T data);

    // Statements
    R visit(FunctionDefTree functionDefTree, T data);
    R visit(ClassDefTree classDefTree, T data);
    R visit(ReturnTree returnTree, T data);
    R visit(AssignTree assignTree, T data);
    R visit(AugAssignTree augAssignTree, T data);
    R visit(AnnAssignTree annAssignTree, T data);
    R visit(ForTree forTree, T data);
    R visit(WhileTree whileTree, T data);
    R visit(IfTree ifTree, T data);
    R visit(WithTree withTree, T data);
    R visit(WithItemTree withItemTree, T data);
    R visit(MatchTree matchTree, T data);
    R visit(MatchCaseTree matchCaseTree, T data);
    R visit(TryTree tryTree, T data);
    R visit(ExceptHandlerTree exceptHandlerTree, T data);
    R visit(NonlocalTree nonlocalTree, T data);
    R visit(GlobalTree globalTree, T data);
    R visit(ExpressionStatementTree expressionStatementTree, T data);
    R visit(PassTree passTree, T data);
    R visit(BreakTree breakTree, T data);
    R visit(ContinueTree continueTree, T data);
    R visit(RaiseTree raiseTree, T data);

    // Expressions
    R visit(NameTree nameTree, T data);
    R visit(LiteralTree literalTree, T data);
    R visit(StringLiteralTree stringLiteralTree, T data);
    R visit(BytesLiteralTree bytesLiteralTree, T data);
    R visit(FormattedStringTree formattedStringTree, T data);
    R visit(FormattedValueTree formattedValueTree, T data);
    R visit(BinaryOperationTree binaryOperationTree, T data);
    R visit(OperatorTree operatorTree, T data);
    R visit(CallTree callTree, T data);
    R visit(KeywordTree keywordTree, T data);
    R visit(AttributeTree attributeTree, T data);
    R visit(ListTree listTree, T data);
    R visit(TupleTree tupleTree, T data);
    R visit(NamedExpressionTree namedExpressionTree, T data);
    R visit(AwaitTree awaitTree, T data);
    R visit(YieldTree yieldTree, T data);
    R visit(YieldFromTree yieldFromTree, T data);
    R visit(LambdaTree lambdaTree, T data);
    R visit(ComprehensionExpressionTree comprehensionExpressionTree, T data);
    R visit(ComprehensionTree comprehensionTree, T data);
    R visit(ReprTree reprTree, T data);

    // Parameters
    R visit(ArgumentsTree argumentsTree, T data);
    R visit(ArgTree argTree, T data);

    // Patterns
    R visit(ValuePatternTree valuePatternTree, T data);
    R visit(CapturePatternTree capturePatternTree, T data);

    // Type parameters
    R visit(TypeVarTree typeVarTree, T data);
    R visit(TypeVarTupleTree typeVarTupleTree, T data);
    R visit(ParamSpecTree paramSpecTree, T data);
}
