package mnemo;

import mnemo.db.MnemoDatabase;
import mnemo.server.MnemoServer;
import mnemo.utils.Log;

/**
 * Entry point: loads the config, creates the one database and starts the
 * listener.
 */
public class Mnemo {
    public static final String VERSION = "0.1.0";
    private static final String DEFAULT_CONFIG = "mnemo.yaml";

    public static void printBanner() {
        Log.info("\n" +
                "  __  __                              \n" +
                " |  \\/  |_ __   ___ _ __ ___   ___   \n" +
                " | |\\/| | '_ \\ / _ \\ '_ ` _ \\ / _ \\  \n" +
                " | |  | | | | |  __/ | | | | | (_) | \n" +
                " |_|  |_|_| |_|\\___|_| |_| |_|\\___/  \n" +
                "                                      \n" +
                " :: Mnemo ::        (v" + VERSION + ") \n" +
                " :: Engine ::       Java " + System.getProperty("java.version") + " \n");
    }

    public static void main(String[] args) throws Exception {
        String configPath = args.length > 0 ? args[0] : DEFAULT_CONFIG;
        Config config = Config.load(configPath).withEnvironment(System.getenv());
        Log.setLevel(config.logLevel);

        printBanner();

        MnemoDatabase db = new MnemoDatabase();
        MnemoServer server = new MnemoServer(config, db);
        server.start(config.port);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            Log.info("Shutting down...");
            server.stop();
        }, "mnemo-shutdown"));

        server.awaitTermination();
    }
}
