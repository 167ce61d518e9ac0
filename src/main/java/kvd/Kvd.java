package kvd;

import kvd.commands.CommandEnvironment;
import kvd.commands.CommandRegistry;
import kvd.db.Store;
import kvd.network.CommandDispatcher;
import kvd.network.KvServer;
import kvd.utils.Log;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Process entry point and composition root: every shared object (store, registry,
 * dispatcher, server) is created here and handed to the parts that use it.
 *
 * <pre>
 * java -jar kvd.jar [config.yaml] [-p|--port N]
 * </pre>
 */
public class Kvd {

    public static void main(String[] args) throws Exception {
        String configFile = Config.DEFAULT_FILE;
        Integer portOverride = null;
        for (int i = 0; i < args.length; i++) {
            if ((args[i].equals("-p") || args[i].equals("--port")) && i + 1 < args.length) {
                portOverride = Integer.parseInt(args[++i]);
            } else {
                configFile = args[i];
            }
        }

        Config config = Config.load(configFile);
        if (portOverride != null) {
            config.port = portOverride;
            config.validate();
        }
        Log.setDebug(config.debug);

        BuildInfo buildInfo = BuildInfo.load();
        Log.info("--- " + buildInfo.getName() + " v" + buildInfo.getVersion() + " ---");

        Store store = new Store(config.fairStoreLock);
        CommandRegistry registry = CommandRegistry.fromServiceLoader(new CommandEnvironment(store, buildInfo));
        Log.info("Registered commands: " + registry.names());

        CommandDispatcher dispatcher = new CommandDispatcher(registry, config.requestTimeout(),
                config.requestRetries, config.commandThreads);
        ScheduledExecutorService janitor = startJanitor(store, config);
        KvServer server = new KvServer(config, dispatcher);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            Log.info("Shutting down...");
            server.close();
            dispatcher.close();
            janitor.shutdownNow();
        }, "kvd-shutdown"));

        server.start();
        server.awaitTermination();
    }

    static ScheduledExecutorService startJanitor(Store store, Config config) {
        ScheduledExecutorService janitor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Janitor");
            t.setDaemon(true);
            return t;
        });
        janitor.scheduleAtFixedRate(() -> {
            try {
                int removed = store.purgeExpired(config.expirySweepMaxKeys);
                if (removed > 0) {
                    Log.debug("[Janitor] Expired " + removed + " keys");
                }
            } catch (RuntimeException e) {
                Log.error("[Janitor] Error: " + e.getMessage(), e);
            }
        }, config.expirySweepIntervalMillis, config.expirySweepIntervalMillis, TimeUnit.MILLISECONDS);
        return janitor;
    }
}
