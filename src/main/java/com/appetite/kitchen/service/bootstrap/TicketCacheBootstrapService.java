package com.appetite.kitchen.service.bootstrap;

import com.appetite.kitchen.client.TicketEventStream;
import com.appetite.kitchen.client.TicketEventStreamException;
import com.appetite.kitchen.config.KitchenProperties;
import com.appetite.kitchen.model.domain.Ticket;
import com.appetite.kitchen.repository.TicketRepository;
import com.appetite.kitchen.service.cache.TicketStateCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Warms the ticket cache on startup.
 *
 * The event log is preferred: its events are replayed in order and terminal tickets are
 * pruned afterwards. When no log is configured, or reading it fails, the cache is loaded
 * from a repository scan instead; a scanned load is never pruned. If both sources fail
 * the service still starts with an empty cache.
 */
@Slf4j
@Service
public class TicketCacheBootstrapService implements ApplicationRunner {

    private final TicketStateCache cache;
    private final ObjectProvider<TicketEventStream> eventStream;
    private final ObjectProvider<TicketRepository> repository;
    private final KitchenProperties properties;

    public TicketCacheBootstrapService(TicketStateCache cache,
                                       ObjectProvider<TicketEventStream> eventStream,
                                       ObjectProvider<TicketRepository> repository,
                                       KitchenProperties properties) {
        this.cache = cache;
        this.eventStream = eventStream;
        this.repository = repository;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCache().isWarmOnStartup()) {
            log.info("Ticket cache warm-up on startup is disabled");
            return;
        }
        warm();
    }

    /**
     * Replays the event log, falling back to a repository scan. Never throws.
     */
    public WarmResult warm() {
        log.info("🚀 Warming ticket cache...");
        Optional<WarmResult> replayed = tryReplay();
        WarmResult result = replayed.orElseGet(() -> tryRepositoryScan(false));
        log.info("✅ Ticket cache warm-up finished: source={} tickets={}", result.source(), result.tickets());
        return result;
    }

    /**
     * Replaces the cache contents with a repository scan, regardless of the event log.
     * When the scan fails the current contents are kept.
     */
    public WarmResult warmFromRepository() {
        log.info("🔄 Forced ticket cache reload from repository");
        return tryRepositoryScan(true);
    }

    private Optional<WarmResult> tryReplay() {
        TicketEventStream stream = eventStream.getIfAvailable();
        if (stream == null) {
            log.info("No ticket event log configured, skipping replay");
            return Optional.empty();
        }

        int batchSize = properties.getCache().getReplayBatchSize();
        List<byte[]> events;
        try {
            events = stream.fetch(batchSize);
        } catch (TicketEventStreamException e) {
            log.warn("Ticket event log unavailable, falling back to repository scan", e);
            return Optional.empty();
        } catch (RuntimeException e) {
            log.error("Unexpected failure reading ticket event log, falling back to repository scan", e);
            return Optional.empty();
        }

        log.info("Replaying {} ticket events (limit {})", events.size(), batchSize);
        int cached = cache.replay(events);
        int pruned = cache.pruneTerminal();
        log.info("Replay cached {} tickets, pruned {} terminal tickets", cached, pruned);
        return Optional.of(new WarmResult(WarmResult.Source.STREAM, cached - pruned));
    }

    private WarmResult tryRepositoryScan(boolean replace) {
        TicketRepository tickets = repository.getIfAvailable();
        if (tickets == null) {
            if (replace) {
                log.warn("No ticket repository available, keeping the current {} cached tickets", cache.count());
            } else {
                log.warn("No ticket repository available, starting with an empty cache");
            }
            return WarmResult.none();
        }

        try {
            List<Ticket> all = tickets.findAll();
            int cached = replace ? cache.replaceAll(all) : cache.load(all);
            log.info("Loaded {} tickets from repository scan", cached);
            return new WarmResult(WarmResult.Source.REPOSITORY, cached);
        } catch (RuntimeException e) {
            if (replace) {
                log.error("💥 Repository reload failed, keeping the current {} cached tickets", cache.count(), e);
            } else {
                log.error("💥 Repository scan failed, starting with an empty cache", e);
            }
            return WarmResult.none();
        }
    }
}
