package fangless.ast;

public sealed interface Stmt extends Node permits ExprStmt, AssignStmt, ReturnStmt, BreakStmt, ContinueStmt,
		PassStmt, IfStmt, WhileStmt, ForStmt, FunctionDef, ClassDef {
}
