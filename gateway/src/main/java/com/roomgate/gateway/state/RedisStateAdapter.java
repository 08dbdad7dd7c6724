package com.roomgate.gateway.state;

import com.roomgate.core.redis.Keys;
import io.lettuce.core.Range;
import io.lettuce.core.RedisClient;
import io.lettuce.core.ZAddArgs;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.reactive.RedisReactiveCommands;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reactive Redis state adapter.
 * <p>
 * Room membership is a sorted set {@link Keys#roomMembers} whose scores are expiry timestamps,
 * so members written by a process that stops refreshing fall out of every read once their
 * score passes. Keys also carry a key-level expiry. The rooms of a connection are kept in a
 * plain set {@link Keys#connectionRooms}.
 * </p>
 * <p>
 * The adapter remembers which entries this process wrote; {@link #refresh()} re-stamps them
 * and {@link #clearProcessData()} removes them.
 * </p>
 */
public class RedisStateAdapter implements StateAdapter {
    private static final Logger log = LoggerFactory.getLogger(RedisStateAdapter.class);
    private static final ZAddArgs REFRESH_ONLY = ZAddArgs.Builder.xx();

    private final String redisUrl;
    private final Duration ttl;

    // room key -> connection ids written by this process
    private final Map<String, Set<String>> ownedMembers = new ConcurrentHashMap<>();
    private final Set<String> ownedConnectionKeys = ConcurrentHashMap.newKeySet();

    private RedisClient client;
    private StatefulRedisConnection<String, String> connection;
    private RedisReactiveCommands<String, String> commands;

    public RedisStateAdapter(String redisUrl, Duration ttl) {
        this.redisUrl = redisUrl;
        this.ttl = ttl;
    }

    RedisStateAdapter(RedisReactiveCommands<String, String> commands, Duration ttl) {
        this.redisUrl = null;
        this.ttl = ttl;
        this.commands = commands;
    }

    @Override
    public Mono<Void> connect() {
        return Mono.fromRunnable(() -> {
                client = RedisClient.create(redisUrl);
                connection = client.connect();
                commands = connection.reactive();
                log.info("Connected to Redis state store: {}", redisUrl);
            })
            .subscribeOn(Schedulers.boundedElastic())
            .then();
    }

    @Override
    public Mono<Void> addUserToRoom(String namespace, String room, String connectionId) {
        String roomKey = Keys.roomMembers(namespace, room);
        String connKey = Keys.connectionRooms(namespace, connectionId);
        return Mono.defer(() -> {
            ownedMembers.computeIfAbsent(roomKey, k -> ConcurrentHashMap.newKeySet()).add(connectionId);
            ownedConnectionKeys.add(connKey);
            return commands.zadd(roomKey, (double) expiryAt(), connectionId)
                .then(commands.pexpire(roomKey, ttl.toMillis()))
                .then(commands.sadd(connKey, room))
                .then(commands.pexpire(connKey, ttl.toMillis()))
                .then();
        }).doOnError(err -> log.error("Failed to add {} to room {}{}", connectionId, namespace, room, err));
    }

    @Override
    public Mono<Void> removeUserFromRoom(String namespace, String room, String connectionId) {
        String roomKey = Keys.roomMembers(namespace, room);
        String connKey = Keys.connectionRooms(namespace, connectionId);
        return Mono.defer(() -> {
            ownedMembers.computeIfPresent(roomKey, (k, members) -> {
                members.remove(connectionId);
                return members.isEmpty() ? null : members;
            });
            return commands.zrem(roomKey, connectionId)
                .then(commands.srem(connKey, room))
                .then(commands.zcount(roomKey, live()))
                .flatMap(remaining -> remaining == 0 ? commands.del(roomKey) : Mono.just(0L))
                .then(commands.scard(connKey))
                .flatMap(remaining -> {
                    if (remaining == 0) {
                        ownedConnectionKeys.remove(connKey);
                    }
                    return Mono.empty();
                })
                .then();
        }).doOnError(err -> log.error("Failed to remove {} from room {}{}", connectionId, namespace, room, err));
    }

    @Override
    public Mono<Set<String>> getUsersInRoom(String namespace, String room) {
        return Mono.defer(() -> commands.zrangebyscore(Keys.roomMembers(namespace, room), live())
                .collect(HashSet<String>::new, Set::add)
                .map(Set::copyOf))
            .doOnError(err -> log.error("Failed to read members of room {}{}", namespace, room, err));
    }

    @Override
    public Mono<Long> getCountInRoom(String namespace, String room) {
        return Mono.defer(() -> commands.zcount(Keys.roomMembers(namespace, room), live()))
            .doOnError(err -> log.error("Failed to count members of room {}{}", namespace, room, err));
    }

    @Override
    public Mono<Boolean> isMember(String namespace, String room, String connectionId) {
        return Mono.defer(() -> commands.zscore(Keys.roomMembers(namespace, room), connectionId)
            .map(score -> score >= System.currentTimeMillis())
            .defaultIfEmpty(false));
    }

    @Override
    public Mono<Set<String>> getConnectionRooms(String namespace, String connectionId) {
        return Mono.defer(() -> commands.smembers(Keys.connectionRooms(namespace, connectionId))
            .collect(HashSet<String>::new, Set::add)
            .map(Set::copyOf));
    }

    /**
     * Pushes the expiry of every entry this process owns forward by one TTL and purges
     * members of those rooms whose expiry has passed.
     * <p>
     * Members are re-checked just before their write, and the write is {@code ZADD XX}, so a
     * member removed while a refresh is running is not written back.
     * </p>
     */
    @Override
    public Mono<Void> refresh() {
        return Mono.defer(() -> {
            double expiry = expiryAt();
            long now = System.currentTimeMillis();

            Flux<Long> rooms = Flux.fromIterable(Map.copyOf(ownedMembers).entrySet())
                .flatMap(entry -> Flux.fromIterable(List.copyOf(entry.getValue()))
                    .filter(connectionId -> owns(entry.getKey(), connectionId))
                    .flatMap(connectionId -> commands.zadd(entry.getKey(), REFRESH_ONLY, expiry, connectionId))
                    .then(commands.pexpire(entry.getKey(), ttl.toMillis()))
                    .then(commands.zremrangebyscore(entry.getKey(), expiredBefore(now))));

            Flux<Boolean> connections = Flux.fromIterable(List.copyOf(ownedConnectionKeys))
                .flatMap(key -> commands.pexpire(key, ttl.toMillis()));

            return rooms.thenMany(connections).then();
        }).doOnSuccess(v -> log.debug("Refreshed {} room entries", ownedMembers.size()));
    }

    @Override
    public Mono<Void> clearProcessData() {
        return Mono.defer(() -> {
            Map<String, Set<String>> rooms = Map.copyOf(ownedMembers);
            List<String> connectionKeys = List.copyOf(ownedConnectionKeys);
            ownedMembers.clear();
            ownedConnectionKeys.clear();

            Flux<Long> roomCleanup = Flux.fromIterable(rooms.entrySet())
                .flatMap(entry -> commands.zrem(entry.getKey(), entry.getValue().toArray(new String[0])));
            Mono<Long> connectionCleanup = connectionKeys.isEmpty()
                ? Mono.just(0L)
                : commands.del(connectionKeys.toArray(new String[0]));

            return roomCleanup.then(connectionCleanup)
                .doOnSuccess(v -> log.info("Cleared {} room entries and {} connection entries of this process",
                    rooms.size(), connectionKeys.size()))
                .then();
        });
    }

    @Override
    public Mono<Void> close() {
        return Mono.fromRunnable(() -> {
                if (connection != null) {
                    connection.close();
                }
                if (client != null) {
                    client.shutdown();
                }
                log.info("Redis state connection closed");
            })
            .subscribeOn(Schedulers.boundedElastic())
            .then();
    }

    private boolean owns(String roomKey, String connectionId) {
        Set<String> members = ownedMembers.get(roomKey);
        return members != null && members.contains(connectionId);
    }

    private long expiryAt() {
        return System.currentTimeMillis() + ttl.toMillis();
    }

    private static Range<Long> live() {
        return Range.from(Range.Boundary.including(System.currentTimeMillis()), Range.Boundary.<Long>unbounded());
    }

    private static Range<Long> expiredBefore(long now) {
        return Range.from(Range.Boundary.<Long>unbounded(), Range.Boundary.excluding(now));
    }
}
