package de.bsommerfeld.tscache.migration;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.tscache.core.config.ApplicationMode;
import de.bsommerfeld.tscache.core.config.ConfigLoader;
import de.bsommerfeld.tscache.core.config.CoreModule;
import de.bsommerfeld.tscache.core.config.GlobalConfig;
import de.bsommerfeld.tscache.db.DatabaseModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Clock;

/**
 * Command line entry of the {@code retrieved_at} migration.
 *
 * <p>
 * Exit codes: {@code 0} success (including dry runs), {@code 1} usage error,
 * {@code 2} refusal or failure.
 */
public final class MigrationMain {

    private static final Logger LOG = LoggerFactory.getLogger(MigrationMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_FAILED = 2;

    private MigrationMain() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        MigrationArgs parsed;
        GlobalConfig config;
        MigrationOptions options;
        try {
            parsed = MigrationArgs.parse(args);
            if (parsed.help()) {
                out.println(MigrationArgs.USAGE);
                return EXIT_OK;
            }
            config = parsed.config() != null ? ConfigLoader.load(parsed.config()) : ConfigLoader.loadDefault();
            options = parsed.toOptions(config.getMigration().getWindowSeconds());
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println(MigrationArgs.USAGE);
            return EXIT_USAGE;
        }

        if (parsed.db() != null)
            config.getDatabase().setPath(parsed.db().toString());

        try {
            Injector injector = Guice.createInjector(
                    new CoreModule(config, Clock.systemUTC()),
                    new DatabaseModule(ApplicationMode.PROD));
            return execute(injector.getInstance(RetrievedAtMigration.class), options, out, err);
        } catch (RuntimeException e) {
            LOG.error("[Migration] Failed", e);
            err.println("Migration failed: " + e.getMessage());
            return EXIT_FAILED;
        }
    }

    static int execute(RetrievedAtMigration migration, MigrationOptions options, PrintStream out, PrintStream err) {
        out.println((options.commit() ? "COMMIT" : "DRY RUN") + " window=" + options.window().getSeconds() + "s");
        try {
            MigrationReport report = migration.run(options);
            ReportPrinter.print(report, out);
            return EXIT_OK;
        } catch (AmbiguousDuplicateException e) {
            err.println("REFUSED: " + e.getMessage() + ". No rows were modified.");
            for (CollisionGroup group : e.getGroups())
                group.describe().forEach(err::println);
            return EXIT_FAILED;
        } catch (MigrationRefusedException e) {
            err.println("REFUSED: " + e.getMessage() + ". No rows were modified.");
            return EXIT_FAILED;
        } catch (RuntimeException e) {
            LOG.error("[Migration] Failed", e);
            err.println("Migration failed: " + e.getMessage());
            return EXIT_FAILED;
        }
    }
}
