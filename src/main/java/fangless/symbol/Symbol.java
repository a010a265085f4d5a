package fangless.symbol;

public record Symbol(String name, int line, int column, String kind) {
}
