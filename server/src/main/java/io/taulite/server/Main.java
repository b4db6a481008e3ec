package io.taulite.server;

import io.taulite.server.catalog.TauCatalog;
import io.taulite.storage.DurableRecordStore;
import io.taulite.storage.InMemoryRecordStore;
import io.taulite.storage.RecordStore;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for a TauLite server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI (and an optional JSON file).
 *  - Wire the record store (in-memory or WAL + snapshots) and the catalog.
 *  - Start the HTTP server and stop everything on shutdown.
 */
public final class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        if (ServerConfig.wantsHelp(args)) {
            System.out.println(ServerConfig.usage());
            return;
        }

        ServerConfig cfg = parseOrExit(args);
        RecordStore store = openStore(cfg);
        var catalog = new TauCatalog(store, cfg.catalogCapacity());
        var web = new WebServer(cfg.port(), catalog, cfg.maxPayloadBytes());
        web.start();

        LOG.info(() -> String.format("TauLite listening on http://localhost:%d (backend=%s, data=%s)",
                cfg.port(), cfg.backend(), cfg.dataDir()));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
                catalog.close();
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Shutdown did not complete cleanly", e);
            }
        }));
    }

    private static ServerConfig parseOrExit(String[] args) {
        try {
            return ServerConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(ServerConfig.usage());
            System.exit(1);
            throw e;
        }
    }

    static RecordStore openStore(ServerConfig cfg) {
        return switch (cfg.backend()) {
            case MEMORY -> new InMemoryRecordStore();
            case DURABLE -> DurableRecordStore.open(cfg.dataDir(), cfg.snapshotEvery());
        };
    }
}
