package org.prover.verify;

import org.prover.formula.FormulaKey;
import org.prover.support.PropertyResult;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;
import java.util.logging.Logger;

/**
 * Cache dei verdetti indicizzata per chiave strutturale.
 *
 * Le voci scadono dopo il TTL (verificato alla lettura); superata la dimensione
 * massima viene rimossa la voce inserita per prima. L'ordine di inserimento è
 * tenuto in una coda concorrente di gettoni: un gettone la cui voce è stata
 * sostituita o è scaduta viene semplicemente scartato.
 */
public class VerdictCache {

    private static final Logger LOGGER = Logger.getLogger(VerdictCache.class.getName());

    private record Entry(PropertyResult verdict, long insertedAt) {}

    private record Token(FormulaKey key, Entry entry) {}

    private final Map<FormulaKey, Entry> entries = new ConcurrentHashMap<>();
    private final Queue<Token> insertionOrder = new ConcurrentLinkedQueue<>();
    private final AtomicInteger queuedTokens = new AtomicInteger();
    private final int maxSize;
    private final long ttlNanos;
    private final LongSupplier clock;

    public VerdictCache(int maxSize, Duration ttl) {
        this(maxSize, ttl, System::nanoTime);
    }

    /**
     * @param clock sorgente di tempo in nanosecondi
     */
    VerdictCache(int maxSize, Duration ttl, LongSupplier clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("Dimensione della cache deve essere positiva: " + maxSize);
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Durata della cache deve essere positiva");
        }
        this.maxSize = maxSize;
        this.ttlNanos = ttl.toNanos();
        this.clock = clock;
    }

    public Optional<PropertyResult> get(FormulaKey key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (clock.getAsLong() - entry.insertedAt() > ttlNanos) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.verdict());
    }

    public void put(FormulaKey key, PropertyResult verdict) {
        Entry entry = new Entry(verdict, clock.getAsLong());
        entries.put(key, entry);
        // il gettone segue la voce: chi lo estrae la trova già nella mappa
        insertionOrder.add(new Token(key, entry));
        if (queuedTokens.incrementAndGet() > 2 * maxSize) {
            discardStaleTokens();
        }
        while (entries.size() > maxSize) {
            if (!evictOldest()) {
                break;
            }
        }
    }

    /** Rimuove la voce del gettone più vecchio ancora valido; false se la coda è vuota */
    private boolean evictOldest() {
        Token token;
        while ((token = insertionOrder.poll()) != null) {
            queuedTokens.decrementAndGet();
            if (entries.remove(token.key(), token.entry())) {
                LOGGER.finest("Verdetto rimosso dalla cache: " + token.key().value());
                return true;
            }
        }
        return false;
    }

    private void discardStaleTokens() {
        insertionOrder.removeIf(token -> {
            boolean stale = !token.entry().equals(entries.get(token.key()));
            if (stale) {
                queuedTokens.decrementAndGet();
            }
            return stale;
        });
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
        insertionOrder.clear();
        queuedTokens.set(0);
    }
}
