package me.christianrobert.convertifier.translator.semantic.statement;

/**
 * Visitor over the closed family of statement nodes.
 * Adding a statement class means adding a method here, which every translator must implement.
 */
public interface StatementVisitor<R> {

    R visitFunctionDef(FunctionDef node);

    R visitAssign(Assign node);

    R visitAugAssign(AugAssign node);

    R visitIf(If node);

    R visitWhile(While node);

    R visitFor(For node);

    R visitReturn(Return node);

    R visitExprStatement(ExprStatement node);

    R visitPass(Pass node);

    R visitLoopControl(LoopControl node);

    R visitImport(Import node);

    R visitImportFrom(ImportFrom node);

    R visitUnsupported(UnsupportedStatement node);
}
