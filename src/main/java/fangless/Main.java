package fangless;

import fangless.ast.Node;
import fangless.diag.Diagnostic;
import fangless.print.AstJson;
import fangless.print.AstPrinter;
import fangless.print.TokenPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command line front-end.
 *
 * <pre>
 * fangless [--tree | --json | --tokens] [--positions] [--strict-indent] [--tab-width N] (--expr TEXT | FILE)
 * </pre>
 *
 * Exit status: 0 for valid input, 1 when diagnostics were reported, 2 for usage or I/O errors.
 */
public final class Main {
	private static final Logger log = LoggerFactory.getLogger(Main.class);

	static final int OK = 0;
	static final int INVALID_INPUT = 1;
	static final int USAGE = 2;

	private static final String USAGE_TEXT = "Usage: fangless [--tree | --json | --tokens] [--positions]"
			+ " [--strict-indent] [--tab-width N] (--expr TEXT | FILE)";

	private enum Output {
		TREE, JSON, TOKENS
	}

	private Main() {
	}

	public static void main(String[] args) {
		System.exit(run(args, System.out, System.err));
	}

	static int run(String[] args, PrintStream out, PrintStream err) {
		Output output = Output.TREE;
		FrontendOptions options = FrontendOptions.defaults();
		boolean positions = false;
		String expr = null;
		Path file = null;

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			switch (arg) {
				case "--tree":
					output = Output.TREE;
					break;
				case "--json":
					output = Output.JSON;
					break;
				case "--tokens":
					output = Output.TOKENS;
					break;
				case "--positions":
					positions = true;
					break;
				case "--strict-indent":
					options = options.withStrictIndentation(true);
					break;
				case "--tab-width":
					if (i + 1 >= args.length) {
						return usage(err, "--tab-width needs a value");
					}
					try {
						options = options.withTabWidth(Integer.parseInt(args[++i]));
					} catch (IllegalArgumentException ex) {
						return usage(err, "invalid tab width: " + args[i]);
					}
					break;
				case "--expr":
					if (i + 1 >= args.length) {
						return usage(err, "--expr needs a value");
					}
					expr = args[++i];
					break;
				default:
					if (arg.startsWith("--") || file != null) {
						return usage(err, "unexpected argument: " + arg);
					}
					file = Path.of(arg);
					break;
			}
		}

		if ((expr == null) == (file == null)) {
			return usage(err, "give exactly one of --expr or FILE");
		}

		String source;
		if (expr != null) {
			source = expr;
		} else {
			try {
				source = Files.readString(file);
			} catch (IOException e) {
				log.error("Failed to read {}", file, e);
				err.println("cannot read " + file + ": " + e.getMessage());
				return USAGE;
			}
		}

		Frontend frontend = new Frontend(options);
		List<Diagnostic> diagnostics;
		if (output == Output.TOKENS) {
			TokenizeResult result = frontend.tokenize(source);
			out.print(new TokenPrinter().print(result.tokens()));
			diagnostics = result.diagnostics();
		} else if (expr != null) {
			ExpressionResult result = frontend.parseExpression(source);
			render(out, result.expression(), output, positions);
			diagnostics = result.diagnostics();
		} else {
			ParseResult result = frontend.parse(source);
			render(out, result.module(), output, positions);
			diagnostics = result.diagnostics();
		}

		for (Diagnostic d : diagnostics) {
			err.println(d.expanded());
		}
		return diagnostics.isEmpty() ? OK : INVALID_INPUT;
	}

	private static void render(PrintStream out, Node root, Output output, boolean positions) {
		if (root == null) {
			return;
		}
		if (output == Output.JSON) {
			out.println(new AstJson().write(root));
		} else {
			out.print(new AstPrinter(positions).print(root));
		}
	}

	private static int usage(PrintStream err, String problem) {
		err.println(problem);
		err.println(USAGE_TEXT);
		return USAGE;
	}
}
