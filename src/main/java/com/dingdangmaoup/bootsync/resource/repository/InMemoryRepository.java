package com.dingdangmaoup.bootsync.resource.repository;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Process-local record store; ids are assigned on first save.
 */
abstract class InMemoryRepository<T> {

    private final Map<Long, T> records = new ConcurrentSkipListMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Function<T, Long> idOf;
    private final BiConsumer<T, Long> assignId;

    InMemoryRepository(Function<T, Long> idOf, BiConsumer<T, Long> assignId) {
        this.idOf = idOf;
        this.assignId = assignId;
    }

    public Mono<T> findById(long id) {
        return Mono.justOrEmpty(records.get(id));
    }

    public Flux<T> findAll() {
        return Flux.fromIterable(records.values());
    }

    public Mono<T> save(T record) {
        return Mono.fromSupplier(() -> {
            Long id = idOf.apply(record);
            if (id == null) {
                id = sequence.incrementAndGet();
                assignId.accept(record, id);
            } else {
                sequence.accumulateAndGet(id, Math::max);
            }
            records.put(id, record);
            return record;
        });
    }

    public Mono<Void> deleteById(long id) {
        return Mono.fromRunnable(() -> records.remove(id));
    }

    Flux<T> findWhere(Predicate<T> predicate) {
        return findAll().filter(predicate);
    }

    Flux<T> findWhereDescending(Predicate<T> predicate) {
        return Flux.fromIterable(records.values())
                .filter(predicate)
                .sort(Comparator.comparing(idOf).reversed());
    }
}
