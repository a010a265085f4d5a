package fangless.ast;

/**
 * Exhaustive dispatch over the closed set of AST nodes.
 *
 * Adding a node type means adding a method here, so every visitor must handle it.
 */
public interface AstVisitor<R> {
	R visitModule(Module node);

	R visitBlock(Block node);

	R visitElifClause(ElifClause node);

	R visitParameter(Parameter node);

	R visitDictEntry(DictEntry node);

	// statements

	R visitExprStmt(ExprStmt node);

	R visitAssignStmt(AssignStmt node);

	R visitReturnStmt(ReturnStmt node);

	R visitBreakStmt(BreakStmt node);

	R visitContinueStmt(ContinueStmt node);

	R visitPassStmt(PassStmt node);

	R visitIfStmt(IfStmt node);

	R visitWhileStmt(WhileStmt node);

	R visitForStmt(ForStmt node);

	R visitFunctionDef(FunctionDef node);

	R visitClassDef(ClassDef node);

	// expressions

	R visitLiteral(LiteralExpr node);

	R visitIdentifier(Identifier node);

	R visitUnary(UnaryExpr node);

	R visitBinary(BinaryExpr node);

	R visitComparison(ComparisonExpr node);

	R visitCall(CallExpr node);

	R visitAttribute(AttributeExpr node);

	R visitSubscript(SubscriptExpr node);

	R visitSlice(SliceExpr node);

	R visitTuple(TupleExpr node);

	R visitList(ListExpr node);

	R visitSet(SetExpr node);

	R visitDict(DictExpr node);
}
