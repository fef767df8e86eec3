package com.leaprnd.checkpoint;

import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

public interface Migration {

	Pattern IDENTIFIER_PATTERN = Pattern.compile("^[0-9]{14}_[A-Za-z0-9_]+$");
	Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z0-9_]+$");

	String DEFAULT_GROUP = "default";

	static boolean isValidIdentifier(String identifier) {
		return identifier != null && IDENTIFIER_PATTERN.matcher(identifier).matches();
	}

	static boolean isValidName(String name) {
		return name != null && NAME_PATTERN.matcher(name).matches();
	}

	static String getManifestNameOf(String group) {
		return Migrate.MANIFEST_DIRECTORY + group + Migrate.MANIFEST_EXTENSION;
	}

	static Migration of(Operation up, Operation down) {
		requireNonNull(up);
		requireNonNull(down);
		return new Migration() {

			@Override
			public void up(Adapter adapter) {
				up.apply(adapter);
			}

			@Override
			public void down(Adapter adapter) {
				down.apply(adapter);
			}

		};
	}

	void up(Adapter adapter);
	void down(Adapter adapter);

	@FunctionalInterface
	interface Operation {
		void apply(Adapter adapter);
	}

}
