package testlab;

import testlab.master.config.Dependencies;
import testlab.master.config.MasterConfig;
import testlab.master.server.MasterNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * Lab master entry point.
 *
 * <pre>
 * java -jar testlab-master.jar [master.ini]
 * </pre>
 *
 * Without an INI file the configuration comes from LAB_* environment variables.
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws InterruptedException {
        MasterConfig config = loadConfig(args);
        Dependencies deps = Dependencies.create(config);
        MasterNettyServer server = new MasterNettyServer(config, deps.routerHandler());
        CountDownLatch stopped = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down lab master");
            server.stop();
            deps.close();
            stopped.countDown();
        }, "lab-shutdown"));

        try {
            deps.start();
            server.start();
        } catch (RuntimeException e) {
            log.error("Lab master failed to start", e);
            System.exit(1);
        }

        stopped.await();
    }

    private static MasterConfig loadConfig(String[] args) {
        if (args.length > 0) {
            Path ini = Path.of(args[0]);
            if (!Files.isRegularFile(ini)) {
                throw new IllegalArgumentException("Config file not found: " + ini);
            }
            return MasterConfig.fromIni(ini);
        }
        return MasterConfig.fromEnv();
    }
}
