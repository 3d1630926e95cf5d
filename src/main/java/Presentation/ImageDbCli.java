package Presentation;

import Model.CompositeStrategy;
import Model.FingerprintSettings;
import Model.HashAlgorithm;
import Model.ImageIndex;
import Model.ImageIndexException;
import Model.IndexBackend;
import ch.qos.logback.classic.Level;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * {@code image-db}: scans images into a fingerprint index and queries it.
 *
 * <p>Global options go before the subcommand. Defaults for them may be set in
 * {@code ~/.image-db.properties}, keyed by option name without dashes
 * ({@code db}, {@code backend}, {@code hash}, ...).</p>
 */
@Command(
        name = "image-db",
        description = "Image fingerprint DB: find duplicate and similar images.",
        mixinStandardHelpOptions = true,
        version = "image-db 1.0.0",
        defaultValueProvider = PropertiesDefaultProvider.class,
        subcommands = {
                StatusCommand.class,
                ScanCommand.class,
                FindCommand.class,
                DupesCommand.class,
                ResetCommand.class,
                ReviewCommand.class
        }
)
public class ImageDbCli implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ImageDbCli.class);

    @Spec
    private CommandLine.Model.CommandSpec spec;

    @Option(names = "--db",
            description = "Path of the index (default: ~/.cache/image-db/index for h2, index.json for table)")
    private Path db;

    @Option(names = "--backend",
            description = "Storage backend: h2 or table (default: ${DEFAULT-VALUE})")
    private String backend = "h2";

    @Option(names = "--hash",
            description = "Hash algorithm: difference, vertical, wavelet or perceptive (default: ${DEFAULT-VALUE})")
    private String hash = HashAlgorithm.DIFFERENCE.key();

    @Option(names = "--strategy",
            description = "Composite strategy: rotated or crop_resistant (default: ${DEFAULT-VALUE})")
    private String strategy = CompositeStrategy.ROTATED.key();

    @Option(names = "--hash-size",
            description = "Hash side length; fingerprints have hash-size^2 bits (default: ${DEFAULT-VALUE})")
    private int hashSize = FingerprintSettings.DEFAULT_HASH_SIZE;

    @Option(names = "-v",
            description = "Increase logging verbosity (can be repeated)")
    private boolean[] verbose = new boolean[0];

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    static CommandLine newCommandLine() {
        ImageDbCli cli = new ImageDbCli();
        CommandLine cmd = new CommandLine(cli);
        cmd.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new RunLast().execute(parseResult);
        });
        cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
            if (ex instanceof ImageIndexException || ex instanceof IllegalArgumentException) {
                log.debug("Command failed", ex);
            } else {
                log.error("Command failed", ex);
            }
            commandLine.getErr().println(ex.getMessage());
            return 1;
        });
        return cmd;
    }

    private void configureLogging() {
        if (verbose.length == 0) return;
        Level level = verbose.length == 1 ? Level.DEBUG : Level.TRACE;
        ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME)).setLevel(level);
    }

    FingerprintSettings settings() {
        return FingerprintSettings.builder()
                .algorithm(HashAlgorithm.fromKey(hash))
                .strategy(CompositeStrategy.fromKey(strategy))
                .hashSize(hashSize)
                .build();
    }

    IndexBackend backend() {
        return IndexBackend.fromKey(backend);
    }

    Path location() {
        return db != null ? db : defaultLocation(backend());
    }

    ImageIndex openIndex() {
        return backend().open(location(), settings());
    }

    static Path defaultLocation(IndexBackend backend) {
        Path dir = Path.of(System.getProperty("user.home"), ".cache", "image-db");
        return backend == IndexBackend.H2 ? dir.resolve("index") : dir.resolve("index.json");
    }

    /** Named parameters understood by {@link MainFX#init()}. */
    List<String> reviewParameters() {
        List<String> params = new ArrayList<>();
        params.add("--backend=" + backend().name().toLowerCase(Locale.ROOT));
        params.add("--db=" + location().toAbsolutePath());
        params.add("--hash=" + hash);
        params.add("--strategy=" + strategy);
        params.add("--hash-size=" + hashSize);
        return params;
    }

    static String readableBytes(long bytes) {
        if (bytes < 1024) return bytes + " B";
        String units = "KMGTPE";
        double value = bytes;
        int unit = -1;
        while (value >= 1024 && unit < units.length() - 1) {
            value /= 1024;
            unit++;
        }
        return String.format(Locale.ROOT, "%.2f %siB", value, units.charAt(unit));
    }
}
