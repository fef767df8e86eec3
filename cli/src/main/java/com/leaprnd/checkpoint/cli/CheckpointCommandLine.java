package com.leaprnd.checkpoint.cli;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.leaprnd.checkpoint.CheckpointException;
import com.leaprnd.checkpoint.Configuration;
import com.leaprnd.checkpoint.ConfigurationLoader;
import com.leaprnd.checkpoint.Migrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import static com.leaprnd.checkpoint.ConfigurationLoader.DEFAULT_FILE_NAME;

public class CheckpointCommandLine {

	private static final Logger LOG = LoggerFactory.getLogger(CheckpointCommandLine.class);

	static final String PROGRAM_NAME = "checkpoint";

	static final String INIT = "init";
	static final String UP = "up";
	static final String DOWN = "down";
	static final String STATUS = "status";
	static final String CREATE = "create";

	@Parameters(separators = "=")
	static class Options {

		@Parameter(names = {"-c", "--config"}, description = "Configuration file to read")
		Path config = Path.of(DEFAULT_FILE_NAME);

		@Parameter(names = {"-h", "--help"}, help = true, description = "Show this message")
		boolean help;

	}

	@Parameters(commandNames = INIT, commandDescription = "Initialize checkpoint in the current directory")
	static class InitCommand {}

	@Parameters(commandNames = UP, commandDescription = "Run all pending migrations")
	static class UpCommand {}

	@Parameters(commandNames = DOWN, commandDescription = "Rollback the last migration")
	static class DownCommand {}

	@Parameters(commandNames = STATUS, commandDescription = "Show migration status (executed and pending)")
	static class StatusCommand {}

	@Parameters(commandNames = CREATE, commandDescription = "Create a new migration file")
	static class CreateCommand {

		@Parameter(description = "<name>")
		List<String> names = new ArrayList<>();

	}

	public static void main(String[] args) {
		System.exit(new CheckpointCommandLine(System.out, System.err).run(args));
	}

	private final PrintStream out;
	private final PrintStream err;
	private final ConfigurationLoader configurationLoader;
	private final Function<Configuration, Migrator> migratorFactory;

	public CheckpointCommandLine(PrintStream out, PrintStream err) {
		this(out, err, new ConfigurationLoader(), Migrator::new);
	}

	public CheckpointCommandLine(
		PrintStream out,
		PrintStream err,
		ConfigurationLoader configurationLoader,
		Function<Configuration, Migrator> migratorFactory
	) {
		this.out = out;
		this.err = err;
		this.configurationLoader = configurationLoader;
		this.migratorFactory = migratorFactory;
	}

	public int run(String... args) {
		final var options = new Options();
		final var createCommand = new CreateCommand();
		final var parser = JCommander
			.newBuilder()
			.programName(PROGRAM_NAME)
			.addObject(options)
			.addCommand(new InitCommand())
			.addCommand(new UpCommand())
			.addCommand(new DownCommand())
			.addCommand(new StatusCommand())
			.addCommand(createCommand)
			.build();
		try {
			parser.parse(args);
		} catch (ParameterException exception) {
			err.println(exception.getMessage());
			printUsage(parser, err);
			return 1;
		}
		final var command = parser.getParsedCommand();
		if (options.help || command == null) {
			printUsage(parser, out);
			return 0;
		}
		try {
			switch (command) {
				case INIT -> init(options.config);
				case UP -> up(options.config);
				case DOWN -> down(options.config);
				case STATUS -> status(options.config);
				case CREATE -> {
					if (createCommand.names.size() != 1) {
						err.println("Usage: checkpoint create <name>");
						return 1;
					}
					create(options.config, createCommand.names.get(0));
				}
				default -> throw new IllegalStateException(command);
			}
			return 0;
		} catch (CheckpointException exception) {
			LOG.debug("{} failed", command, exception);
			err.println("✗ Error: " + exception.getMessage());
			return 1;
		}
	}

	private void init(Path config) {
		if (configurationLoader.scaffold(config)) {
			out.println("✓ Created " + config);
		}
		openMigrator(config).init();
		out.println("✓ Checkpoint initialized");
	}

	private void up(Path config) {
		final var migrated = openMigrator(config).up(identifier -> out.println("✓ " + identifier));
		if (migrated.isEmpty()) {
			out.println("No pending migrations");
		}
	}

	private void down(Path config) {
		openMigrator(config).down().ifPresentOrElse(
			identifier -> out.println("✓ Rolled back " + identifier),
			() -> out.println("No migrations to rollback")
		);
	}

	private void status(Path config) {
		final var status = openMigrator(config).status();
		out.println();
		out.println("Executed:");
		for (final var identifier : status.executed()) {
			out.println("  ✓ " + identifier);
		}
		out.println();
		out.println("Pending:");
		for (final var identifier : status.pending()) {
			out.println("  ○ " + identifier);
		}
		if (!status.isConsistent()) {
			out.println();
			out.println("Missing (recorded but not found on disk):");
			for (final var identifier : status.missing()) {
				out.println("  ! " + identifier);
			}
		}
	}

	private void create(Path config, String name) {
		final var path = openMigrator(config).create(name);
		out.println("✓ Created " + path.getFileName());
	}

	private Migrator openMigrator(Path config) {
		return migratorFactory.apply(configurationLoader.load(config));
	}

	private static void printUsage(JCommander parser, PrintStream stream) {
		final var usage = new StringBuilder();
		parser.getUsageFormatter().usage(usage);
		stream.print(usage);
	}

}
