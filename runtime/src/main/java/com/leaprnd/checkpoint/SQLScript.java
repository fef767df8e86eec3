package com.leaprnd.checkpoint;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static java.lang.Character.isLetterOrDigit;
import static java.lang.Character.isWhitespace;
import static java.lang.Character.toUpperCase;
import static java.util.Collections.unmodifiableList;

/**
 * A migration written as a plain SQL file with two sections:
 *
 * <pre>
 * -- migrate:up
 * CREATE TABLE users (id SERIAL PRIMARY KEY);
 *
 * -- migrate:down
 * DROP TABLE users;
 * </pre>
 *
 * Anything before the first marker is ignored. Each section is split into statements on semicolons that are not
 * inside a quoted string, a quoted identifier, a comment or a dollar-quoted body, and the statements are executed one
 * at a time in file order.
 *
 * <p>Quotes are always escaped by doubling them. A backslash also escapes the next character inside PostgreSQL
 * {@code E'...'} strings, and inside every string when {@code backslashEscapes} is set, as MySQL does by default.</p>
 */
public final class SQLScript implements Migration {

	public static final String UP_MARKER = "-- migrate:up";
	public static final String DOWN_MARKER = "-- migrate:down";

	private static final Pattern DOLLAR_QUOTE = Pattern.compile("\\$([A-Za-z_][A-Za-z0-9_]*)?\\$");

	public static SQLScript parse(String text) {
		return parse(text, false);
	}

	public static SQLScript parse(String text, boolean backslashEscapes) {
		final var up = new StringBuilder();
		final var down = new StringBuilder();
		StringBuilder section = null;
		var hasUpMarker = false;
		var hasDownMarker = false;
		for (final var line : text.split("\\R", -1)) {
			final var marker = line.strip();
			if (marker.equalsIgnoreCase(UP_MARKER)) {
				if (hasUpMarker) {
					throw new IllegalArgumentException("Found more than one \"" + UP_MARKER + "\" marker");
				}
				hasUpMarker = true;
				section = up;
			} else if (marker.equalsIgnoreCase(DOWN_MARKER)) {
				if (hasDownMarker) {
					throw new IllegalArgumentException("Found more than one \"" + DOWN_MARKER + "\" marker");
				}
				hasDownMarker = true;
				section = down;
			} else if (section != null) {
				section.append(line).append('\n');
			}
		}
		if (!hasUpMarker) {
			throw new IllegalArgumentException("Missing \"" + UP_MARKER + "\" marker");
		}
		return new SQLScript(split(up.toString(), backslashEscapes), split(down.toString(), backslashEscapes));
	}

	public static List<String> split(String sql) {
		return split(sql, false);
	}

	public static List<String> split(String sql, boolean backslashEscapes) {
		final var statements = new ArrayList<String>();
		final var current = new StringBuilder();
		final var length = sql.length();
		var hasContent = false;
		var index = 0;
		while (index < length) {
			final var character = sql.charAt(index);
			final var next = index + 1 < length ? sql.charAt(index + 1) : '\0';
			final int end;
			if (character == '-' && next == '-') {
				final var newline = sql.indexOf('\n', index);
				end = newline < 0 ? length : newline;
			} else if (character == '/' && next == '*') {
				end = findEndOfBlockComment(sql, index);
			} else if (character == '\'' || character == '"') {
				end = findEndOfQuote(sql, index, character, backslashEscapes || isEscapeString(sql, index));
				hasContent = true;
			} else if (character == '`') {
				end = findEndOfQuote(sql, index, character, false);
				hasContent = true;
			} else if (character == '$' && DOLLAR_QUOTE.matcher(sql).region(index, length).lookingAt()) {
				end = findEndOfDollarQuote(sql, index);
				hasContent = true;
			} else if (character == ';') {
				if (hasContent) {
					statements.add(current.toString().strip());
				}
				current.setLength(0);
				hasContent = false;
				index ++;
				continue;
			} else {
				if (!isWhitespace(character)) {
					hasContent = true;
				}
				end = index + 1;
			}
			current.append(sql, index, end);
			index = end;
		}
		if (hasContent) {
			statements.add(current.toString().strip());
		}
		return statements;
	}

	private static int findEndOfBlockComment(String sql, int start) {
		var depth = 0;
		var index = start;
		while (index < sql.length() - 1) {
			final var pair = sql.substring(index, index + 2);
			if (pair.equals("/*")) {
				depth ++;
				index += 2;
			} else if (pair.equals("*/")) {
				depth --;
				index += 2;
				if (depth == 0) {
					return index;
				}
			} else {
				index ++;
			}
		}
		return sql.length();
	}

	private static boolean isEscapeString(String sql, int quote) {
		if (sql.charAt(quote) != '\'' || quote == 0 || toUpperCase(sql.charAt(quote - 1)) != 'E') {
			return false;
		}
		return quote == 1 || !isIdentifierPart(sql.charAt(quote - 2));
	}

	private static boolean isIdentifierPart(char character) {
		return isLetterOrDigit(character) || character == '_' || character == '$';
	}

	private static int findEndOfQuote(String sql, int start, char quote, boolean backslashEscapes) {
		var index = start + 1;
		while (index < sql.length()) {
			final var character = sql.charAt(index);
			if (backslashEscapes && character == '\\') {
				index += 2;
				continue;
			}
			if (character == quote) {
				if (index + 1 < sql.length() && sql.charAt(index + 1) == quote) {
					index += 2;
					continue;
				}
				return index + 1;
			}
			index ++;
		}
		return sql.length();
	}

	private static int findEndOfDollarQuote(String sql, int start) {
		final var matcher = DOLLAR_QUOTE.matcher(sql).region(start, sql.length());
		if (!matcher.lookingAt()) {
			throw new IllegalStateException();
		}
		final var tag = matcher.group();
		final var closing = sql.indexOf(tag, matcher.end());
		return closing < 0 ? sql.length() : closing + tag.length();
	}

	private final List<String> upStatements;
	private final List<String> downStatements;

	public SQLScript(List<String> upStatements, List<String> downStatements) {
		this.upStatements = unmodifiableList(upStatements);
		this.downStatements = unmodifiableList(downStatements);
	}

	public List<String> getUpStatements() {
		return upStatements;
	}

	public List<String> getDownStatements() {
		return downStatements;
	}

	@Override
	public void up(Adapter adapter) {
		for (final var statement : upStatements) {
			adapter.execute(statement);
		}
	}

	@Override
	public void down(Adapter adapter) {
		for (final var statement : downStatements) {
			adapter.execute(statement);
		}
	}

}
