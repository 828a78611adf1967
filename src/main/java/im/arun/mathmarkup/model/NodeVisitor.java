package im.arun.mathmarkup.model;

public interface NodeVisitor<R> {
    R visitText(TextNode node);
    R visitFraction(FractionNode node);
    R visitBevelledFraction(BevelledFractionNode node);
    R visitSqrt(SqrtNode node);
    R visitNthRoot(NthRootNode node);
    R visitScript(ScriptNode node);
    R visitBracket(BracketNode node);
    R visitLargeOperator(LargeOperatorNode node);
    R visitDerivative(DerivativeNode node);
    R visitIntegral(IntegralNode node);
    R visitMatrix(MatrixNode node);
    R visitStack(StackNode node);
    R visitCases(CasesNode node);
    R visitAccent(AccentNode node);
    R visitFunction(FunctionNode node);
}
