package fangless.ast;

public sealed interface Expr extends Node permits LiteralExpr, Identifier, UnaryExpr, BinaryExpr, ComparisonExpr,
		CallExpr, AttributeExpr, SubscriptExpr, SliceExpr, TupleExpr, ListExpr, SetExpr, DictExpr {
}
