package notasyn.trans.passes.parse.declaration;

import notasyn.errors.IssueContext;
import notasyn.model.command.*;
import notasyn.model.notation.*;
import notasyn.model.term.NotationTerm;
import notasyn.model.term.TermBuilder;
import notasyn.trans.IOErrorIssue;
import notasyn.trans.WhileLoadingDeclaration;
import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Reads a JSON declaration file: the scopes, their keys and classes, and the custom entries it
 * declares first, then its notations in order, then its abbreviations. A null key takes the key
 * of a scope away.
 *
 * <pre>
 * {
 *   "scopes": ["nat_scope"],
 *   "delimiters": {"nat_scope": "nat"},
 *   "bind_scopes": {"nat_scope": ["nat"]},
 *   "custom_entries": ["expr"],
 *   "notations": [
 *     {"pattern": "x + y", "level": 50, "assoc": "left", "scope": "nat_scope",
 *      "interpretation": {"app": "plus", "args": ["x", "y"]}},
 *     {"infix": "*", "level": 40, "assoc": "left", "head": "mult",
 *      "deprecated": {"since": "2.1", "note": "use x * y instead"}}
 *   ],
 *   "abbreviations": [
 *     {"name": "double", "params": ["n"], "body": {"app": "plus", "args": ["n", "n"]}}
 *   ]
 * }
 * </pre>
 */
public class DeclarationParsingPass {

	private static final Logger logger = Logger.getLogger("notasyn.declarations");

	private DeclarationParsingPass() {}

	/**
	 * @return the commands of the file, or null after reporting an issue
	 */
	public static List<Command> perform(IssueContext ctx, File file) {
		String contents;
		try {
			contents = FileUtils.readFileToString(file, StandardCharsets.UTF_8);
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(e));
			return null;
		}
		return parse(ctx, file.getPath(), contents);
	}

	/**
	 * @param fileName the name declarations are reported under
	 * @return the commands, or null after reporting an issue
	 */
	public static List<Command> parse(IssueContext ctx, String fileName, String contents) {
		JSONObject root;
		try {
			root = new JSONObject(contents);
		} catch (JSONException e) {
			ctx.error(new DeclarationParsingIssue(fileName + ": parsing error: " + e.getMessage()));
			return null;
		}

		List<Command> commands = new ArrayList<>();
		try {
			if (root.has("scopes")) {
				JSONArray scopes = root.getJSONArray("scopes");
				for (int i = 0; i < scopes.length(); i++) {
					commands.add(new DeclareScopeCommand(scopes.getString(i), false));
				}
			}
			if (root.has("delimiters")) {
				JSONObject delimiters = root.getJSONObject("delimiters");
				for (String scope : delimiters.keySet()) {
					String key = delimiters.isNull(scope) ? null : delimiters.getString(scope);
					commands.add(new DelimitScopeCommand(scope, key, false));
				}
			}
			if (root.has("bind_scopes")) {
				JSONObject bindings = root.getJSONObject("bind_scopes");
				for (String scope : bindings.keySet()) {
					commands.add(new BindScopeCommand(scope, readStrings(bindings.getJSONArray(scope)), false));
				}
			}
			if (root.has("custom_entries")) {
				JSONArray entries = root.getJSONArray("custom_entries");
				for (int i = 0; i < entries.length(); i++) {
					commands.add(new DeclareCustomEntryCommand(entries.getString(i), false));
				}
			}
		} catch (JSONException e) {
			ctx.error(new DeclarationParsingIssue(e.getMessage()));
			return null;
		}

		JSONArray notations = root.optJSONArray("notations");
		if (notations != null) {
			for (int i = 0; i < notations.length(); i++) {
				IssueContext nested = ctx.withContext(new WhileLoadingDeclaration(fileName, i));
				try {
					commands.add(readNotation(notations.getJSONObject(i)));
				} catch (JSONException e) {
					nested.error(new DeclarationParsingIssue(e.getMessage()));
				}
			}
		}
		JSONArray abbreviations = root.optJSONArray("abbreviations");
		if (abbreviations != null) {
			for (int i = 0; i < abbreviations.length(); i++) {
				IssueContext nested = ctx.withContext(new WhileLoadingDeclaration(fileName, i));
				try {
					commands.add(readAbbreviation(abbreviations.getJSONObject(i)));
				} catch (JSONException e) {
					nested.error(new DeclarationParsingIssue(e.getMessage()));
				}
			}
		}
		if (ctx.hasErrors()) {
			return null;
		}
		logger.fine("Read " + commands.size() + " declaration(s) from " + fileName);
		return commands;
	}

	private static Command readNotation(JSONObject json) {
		NotationModifiers modifiers = readModifiers(json);
		String scope = json.has("scope") ? json.getString("scope") : null;
		boolean local = json.optBoolean("local", false);
		Deprecation deprecation = readDeprecation(json);

		if (json.has("infix")) {
			if (!json.has("head")) {
				throw new JSONException("an infix notation needs a \"head\"");
			}
			NotationTerm head = readTerm(json.get("head"), new HashSet<>());
			return new InfixCommand(json.getString("infix"), modifiers, head, scope, local, deprecation);
		}

		String pattern = json.getString("pattern");
		boolean reserved = json.optBoolean("reserved", false);
		NotationTerm interpretation = null;
		if (json.has("interpretation")) {
			if (reserved) {
				throw new JSONException("the reserved notation \"" + pattern + "\" cannot have an interpretation");
			}
			interpretation = readTerm(json.get("interpretation"), variablesOf(pattern));
		} else if (!reserved) {
			throw new JSONException("the notation \"" + pattern + "\" needs an \"interpretation\", or \"reserved\": true");
		}
		return new NotationCommand(new NotationDeclaration(pattern, modifiers, interpretation, scope, local, deprecation),
				json.optBoolean("interpretation_only", false));
	}

	private static Command readAbbreviation(JSONObject json) {
		String name = json.getString("name");
		if (!NotationTokens.isIdent(name)) {
			throw new JSONException("the abbreviation name \"" + name + "\" is not an identifier");
		}
		List<String> parameters = json.has("params") ? readStrings(json.getJSONArray("params")) : new ArrayList<>();
		NotationTerm body = readTerm(json.get("body"), new HashSet<>(parameters));
		return new AbbreviationCommand(name, parameters, body, json.optBoolean("only_parsing", false),
				readDeprecation(json), json.optBoolean("local", false));
	}

	private static Deprecation readDeprecation(JSONObject json) {
		if (!json.has("deprecated")) {
			return null;
		}
		JSONObject deprecated = json.getJSONObject("deprecated");
		return new Deprecation(deprecated.optString("since", null), deprecated.optString("note", null));
	}

	private static List<String> readStrings(JSONArray array) {
		List<String> strings = new ArrayList<>();
		for (int i = 0; i < array.length(); i++) {
			strings.add(array.getString(i));
		}
		return strings;
	}

	static NotationModifiers readModifiers(JSONObject json) {
		NotationModifiers modifiers = new NotationModifiers();
		if (json.has("level")) {
			modifiers.atLevel(json.getInt("level"));
		}
		if (json.has("assoc")) {
			modifiers.withAssociativity(readAssociativity(json.getString("assoc")));
		}
		if (json.has("custom")) {
			modifiers.inCustomEntry(json.getString("custom"));
		}
		if (json.has("entries")) {
			JSONObject entries = json.getJSONObject("entries");
			for (String variable : entries.keySet()) {
				modifiers.withEntryType(variable, readEntryType(entries.getString(variable)));
			}
		}
		if (json.has("levels")) {
			JSONObject levels = json.getJSONObject("levels");
			for (String variable : levels.keySet()) {
				Object level = levels.get(variable);
				if ("next".equals(level)) {
					modifiers.withVariableLevel(variable, ProductionLevel.next());
				} else {
					modifiers.withVariableLevel(variable, ProductionLevel.numeric(levels.getInt(variable)));
				}
			}
		}
		if (json.optBoolean("only_parsing", false)) {
			modifiers.onlyParsing();
		}
		if (json.optBoolean("only_printing", false)) {
			modifiers.onlyPrinting();
		}
		if (json.has("format")) {
			modifiers.withFormat(json.getString("format"));
		}
		if (json.has("extra")) {
			JSONObject extra = json.getJSONObject("extra");
			for (String key : extra.keySet()) {
				modifiers.withExtra(key, extra.getString(key));
			}
		}
		return modifiers;
	}

	private static Associativity readAssociativity(String text) {
		switch (text) {
			case "left":
				return Associativity.LEFT;
			case "right":
				return Associativity.RIGHT;
			case "none":
				return Associativity.NON;
			default:
				throw new JSONException("unknown associativity \"" + text + "\", expected left, right or none");
		}
	}

	/**
	 * Reads an entry type such as {@code ident}, {@code closed binder}, {@code strict pattern at level 1},
	 * {@code constr at next level} or {@code custom expr at level 3}.
	 */
	static EntryType readEntryType(String text) {
		String[] words = text.trim().split("\\s+");
		int i = 0;
		switch (words[i++]) {
			case "ident":
				return expectEnd(new IdentEntryType(), words, i, text);
			case "name":
				return expectEnd(new NameEntryType(), words, i, text);
			case "global":
				return expectEnd(new GlobalReferenceEntryType(), words, i, text);
			case "bigint":
				return expectEnd(new LiteralEntryType(), words, i, text);
			case "binder":
				return expectEnd(new BinderEntryType(true), words, i, text);
			case "closed":
				if (words.length == 2 && words[1].equals("binder")) {
					return new BinderEntryType(false);
				}
				break;
			case "strict":
				if (words.length >= 2 && words[1].equals("pattern")) {
					return new PatternEntryType(true, readPatternLevel(words, 2, text));
				}
				break;
			case "pattern":
				return new PatternEntryType(false, readPatternLevel(words, 1, text));
			case "constr":
				return new SubExpressionEntryType(NotationEntry.constr(), readLevel(words, 1, text),
						ProductionPosition.internal());
			case "custom":
				if (words.length >= 2) {
					return new SubExpressionEntryType(NotationEntry.custom(words[1]), readLevel(words, 2, text),
							ProductionPosition.internal());
				}
				break;
			default:
				break;
		}
		throw new JSONException("unknown entry type \"" + text + "\"");
	}

	private static EntryType expectEnd(EntryType type, String[] words, int i, String text) {
		if (i != words.length) {
			throw new JSONException("unexpected \"" + words[i] + "\" in entry type \"" + text + "\"");
		}
		return type;
	}

	private static Integer readPatternLevel(String[] words, int i, String text) {
		if (i == words.length) {
			return null;
		}
		ProductionLevel level = readLevel(words, i, text);
		if (level.getKind() != ProductionLevel.Kind.NUMERIC) {
			throw new JSONException("a pattern takes a numeric level in \"" + text + "\"");
		}
		return level.getLevel();
	}

	private static ProductionLevel readLevel(String[] words, int i, String text) {
		if (i == words.length) {
			return ProductionLevel.defaultLevel();
		}
		if (words.length == i + 3 && words[i].equals("at") && words[i + 1].equals("level")) {
			try {
				return ProductionLevel.numeric(Integer.parseInt(words[i + 2]));
			} catch (NumberFormatException e) {
				throw new JSONException("invalid level \"" + words[i + 2] + "\" in entry type \"" + text + "\"");
			}
		}
		if (words.length == i + 3 && words[i].equals("at") && words[i + 1].equals("next")
				&& words[i + 2].equals("level")) {
			return ProductionLevel.next();
		}
		throw new JSONException("invalid level in entry type \"" + text + "\"");
	}

	/**
	 * A bare string is a variable when the pattern has a variable of that name, and a reference otherwise.
	 */
	static NotationTerm readTerm(Object json, Set<String> variables) {
		if (json instanceof String) {
			String name = (String) json;
			return variables.contains(name) ? TermBuilder.var(name) : TermBuilder.ref(name);
		}
		if (!(json instanceof JSONObject)) {
			throw new JSONException("invalid term " + json);
		}
		JSONObject term = (JSONObject) json;
		if (term.has("var")) {
			return TermBuilder.var(term.getString("var"));
		}
		if (term.has("ref")) {
			return TermBuilder.ref(term.getString("ref"));
		}
		if (term.has("app")) {
			NotationTerm head = readTerm(term.get("app"), variables);
			return TermBuilder.app(head, readArguments(term, variables));
		}
		if (term.has("opaque")) {
			return TermBuilder.opaque(term.getString("opaque"), readArguments(term, variables));
		}
		if (term.optBoolean("hole", false)) {
			return TermBuilder.hole();
		}
		throw new JSONException("invalid term " + term);
	}

	private static NotationTerm[] readArguments(JSONObject term, Set<String> variables) {
		JSONArray args = term.optJSONArray("args");
		if (args == null) {
			return new NotationTerm[0];
		}
		NotationTerm[] arguments = new NotationTerm[args.length()];
		for (int i = 0; i < args.length(); i++) {
			arguments[i] = readTerm(args.get(i), variables);
		}
		return arguments;
	}

	private static Set<String> variablesOf(String pattern) {
		Set<String> variables = new HashSet<>();
		for (String token : pattern.trim().split("\\s+")) {
			if (NotationTokens.isIdent(token)) {
				variables.add(token);
			}
		}
		return variables;
	}
}
