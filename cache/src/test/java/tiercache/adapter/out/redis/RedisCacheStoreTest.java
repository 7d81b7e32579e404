package tiercache.adapter.out.redis;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.redis.client.Redis;
import io.vertx.mutiny.redis.client.Request;
import io.vertx.mutiny.redis.client.Response;
import io.vertx.redis.client.Command;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import tiercache.adapter.out.redis.RedisTimeoutHelper.RedisTimeoutException;
import tiercache.core.exception.CacheConnectionException;
import tiercache.core.model.CacheKind;

@DisplayName("RedisCacheStore")
@ExtendWith(MockitoExtension.class)
class RedisCacheStoreTest {

    private static final RedisSettings SETTINGS =
            RedisSettings.of("localhost:6379", null).withTimeout(Duration.ofMillis(100));

    @Mock
    private Redis redis;

    private final Map<String, Supplier<Uni<Response>>> replies = new HashMap<>();
    private final List<String> sent = new CopyOnWriteArrayList<>();
    private final AtomicBoolean onCloseRan = new AtomicBoolean();

    @BeforeEach
    void setUp() {
        reply(Command.PING, () -> Uni.createFrom().item(mock(Response.class)));
        lenient().when(redis.send(any(Request.class))).thenAnswer(invocation -> {
            final Request request = invocation.getArgument(0);
            final var command = request.getDelegate().command().toString();
            sent.add(command);
            final var reply = replies.get(command);
            return reply != null ? reply.get() : Uni.createFrom().<Response>nullItem();
        });
    }

    private void reply(Command command, Supplier<Uni<Response>> reply) {
        replies.put(command.toString(), reply);
    }

    private RedisCacheStore store(RedisSettings settings, Duration ttl) {
        return new RedisCacheStore(CacheKind.REDIS, redis, settings, ttl, () -> onCloseRan.set(true));
    }

    @Nested
    @DisplayName("construction")
    class ConstructionTests {

        @Test
        @DisplayName("should ping the server once")
        void shouldPingServer() {
            final var store = store(SETTINGS, Duration.ofSeconds(5));

            assertEquals(List.of(Command.PING.toString()), sent);
            assertEquals(CacheKind.REDIS, store.kind());
            assertTrue(store.expiresNatively());
            assertTrue(store.keys().isEmpty());
        }

        @Test
        @DisplayName("should fail and release the client when the ping fails")
        void shouldFailWhenPingFails() {
            reply(Command.PING, () -> Uni.createFrom().failure(new IllegalStateException("Connection refused")));

            final var error = assertThrows(CacheConnectionException.class, () -> store(SETTINGS, Duration.ZERO));

            assertTrue(error.getMessage().contains("redis://localhost:6379"));
            verify(redis).close();
            assertTrue(onCloseRan.get());
        }

        @Test
        @DisplayName("should fail when the ping times out")
        void shouldFailWhenPingTimesOut() {
            reply(Command.PING, () -> Uni.createFrom().nothing());

            final var error = assertThrows(CacheConnectionException.class, () -> store(SETTINGS, Duration.ZERO));

            assertInstanceOf(RedisTimeoutException.class, error.getCause());
        }

        @Test
        @DisplayName("should reject local cache kinds")
        void shouldRejectLocalKinds() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> new RedisCacheStore(CacheKind.MEMORY, redis, SETTINGS, Duration.ZERO, null));
        }
    }

    @Nested
    @DisplayName("reads and writes")
    class ReadWriteTests {

        private RedisCacheStore store;

        @BeforeEach
        void setUp() {
            store = store(SETTINGS, Duration.ofSeconds(5));
            sent.clear();
        }

        @Test
        @DisplayName("should report a missing key as empty")
        void shouldReportMissingKey() {
            assertTrue(store.read("missing").isEmpty());
            assertEquals(List.of(Command.GET.toString()), sent);
        }

        @Test
        @DisplayName("should return the stored bytes without an expiry instant")
        void shouldReturnPayload() {
            final var response = mock(Response.class);
            when(response.toBuffer()).thenReturn(Buffer.buffer(new byte[] {'4', '2'}));
            reply(Command.GET, () -> Uni.createFrom().item(response));

            final var entry = store.read("k").orElseThrow();

            assertArrayEquals(new byte[] {'4', '2'}, entry.payload());
            assertNull(entry.expiresAt());
        }

        @Test
        @DisplayName("should probe with EXISTS")
        void shouldProbeWithExists() {
            final var zero = mock(Response.class);
            when(zero.toInteger()).thenReturn(0);
            reply(Command.EXISTS, () -> Uni.createFrom().item(zero));

            assertTrue(store.probe("k").isEmpty());
            assertEquals(List.of(Command.EXISTS.toString()), sent);
        }

        @Test
        @DisplayName("should surface write failures as connection errors carrying the key")
        void shouldFailOnWriteError() {
            reply(Command.SET, () -> Uni.createFrom().failure(new IllegalStateException("READONLY")));

            final var error = assertThrows(
                    CacheConnectionException.class, () -> store.write("k", new byte[] {1}, Instant.now()));

            assertEquals("k", error.getKey());
        }

        @Test
        @DisplayName("should surface read timeouts as connection errors")
        void shouldFailOnReadTimeout() {
            reply(Command.GET, () -> Uni.createFrom().nothing());

            assertThrows(CacheConnectionException.class, () -> store.read("k"));
        }
    }

    @Nested
    @DisplayName("best-effort removal")
    class RemovalTests {

        @Test
        @DisplayName("should ignore delete failures")
        void shouldIgnoreDeleteFailure() {
            final var store = store(SETTINGS, Duration.ZERO);
            reply(Command.DEL, () -> Uni.createFrom().failure(new IllegalStateException("down")));

            assertDoesNotThrow(() -> store.delete("k"));
        }

        @Test
        @DisplayName("should flush everything without a key prefix")
        void shouldFlushAll() {
            final var store = store(SETTINGS, Duration.ZERO);
            sent.clear();

            store.flush();

            assertEquals(List.of(Command.FLUSHALL.toString()), sent);
        }

        @Test
        @DisplayName("should delete only prefixed keys when a key prefix is set")
        void shouldScanPrefix() {
            final var store = store(SETTINGS.withKeyPrefix("app:"), Duration.ZERO);
            final var cursor = mock(Response.class);
            when(cursor.toString()).thenReturn("0");
            final var first = mock(Response.class);
            when(first.toString()).thenReturn("app:a");
            final var keys = mock(Response.class);
            when(keys.size()).thenReturn(1);
            when(keys.get(0)).thenReturn(first);
            final var page = mock(Response.class);
            when(page.get(0)).thenReturn(cursor);
            when(page.get(1)).thenReturn(keys);
            reply(Command.SCAN, () -> Uni.createFrom().item(page));
            sent.clear();

            store.flush();

            assertEquals(List.of(Command.SCAN.toString(), Command.DEL.toString()), sent);
        }

        @Test
        @DisplayName("should close the client and run the close hook")
        void shouldCloseClient() {
            final var store = store(SETTINGS, Duration.ZERO);

            store.close();

            verify(redis).close();
            assertTrue(onCloseRan.get());
        }
    }

    @Nested
    @DisplayName("expiry argument")
    class ExpiryArgumentTests {

        @Test
        @DisplayName("should keep whole milliseconds")
        void shouldKeepWholeMillis() {
            assertEquals(5000, RedisCacheStore.expiryMillis(Duration.ofSeconds(5)));
            assertEquals(0, RedisCacheStore.expiryMillis(Duration.ZERO));
        }

        @Test
        @DisplayName("should round sub-millisecond remainders up")
        void shouldRoundUp() {
            assertEquals(1, RedisCacheStore.expiryMillis(Duration.ofNanos(500_000)));
            assertEquals(6, RedisCacheStore.expiryMillis(Duration.ofNanos(5_000_001)));
        }

        @Test
        @DisplayName("should accept a positive TTL below one millisecond")
        void shouldWriteWithSubMillisecondTtl() {
            final var store = store(SETTINGS, Duration.ofNanos(500_000));

            assertDoesNotThrow(() -> store.write("k", new byte[] {1}, Instant.now()));
            assertEquals(Command.SET.toString(), sent.get(sent.size() - 1));
        }
    }

    @Nested
    @DisplayName("cluster flush with a key prefix")
    class ClusterFlushTests {

        private static final String CLUSTER_NODES = String.join(
                "\n",
                "a1 10.0.0.1:7000@17000 myself,master - 0 0 1 connected 0-5460",
                "b2 10.0.0.2:7001@17001,node-b master - 0 0 2 connected 5461-10922",
                "c3 10.0.0.3:7002@17002 master,fail - 0 0 3 disconnected",
                "d4 10.0.0.4:7003@17003 slave a1 0 0 1 connected",
                "e5 :0@0 master,noaddr - 0 0 4 disconnected",
                "");

        private final Map<String, FakeNode> nodes = new HashMap<>();

        private FakeNode node(String endpoint) {
            return nodes.computeIfAbsent(endpoint, e -> new FakeNode());
        }

        @Test
        @DisplayName("should list only reachable masters")
        void shouldParseMasters() {
            assertEquals(
                    List.of("redis://10.0.0.1:7000", "redis://10.0.0.2:7001"),
                    RedisCacheStore.masterEndpoints(CLUSTER_NODES));
        }

        @Test
        @DisplayName("should scan and delete on every master")
        void shouldScanEveryMaster() {
            final var settings = new RedisSettings(List.of("10.0.0.1:7000"), null, Duration.ofMillis(100), "app:");
            final var topology = mock(Response.class);
            when(topology.toString()).thenReturn(CLUSTER_NODES);
            node("redis://10.0.0.1:7000").reply(Command.CLUSTER, () -> Uni.createFrom().item(topology));
            final var first = page("app:a");
            final var second = page("app:b");
            node("redis://10.0.0.1:7000").reply(Command.SCAN, () -> Uni.createFrom().item(first));
            node("redis://10.0.0.2:7001").reply(Command.SCAN, () -> Uni.createFrom().item(second));
            final var store = new RedisCacheStore(
                    CacheKind.REDIS_CLUSTER, redis, settings, Duration.ZERO, null, endpoint -> node(endpoint).redis);
            sent.clear();

            store.flush();

            assertTrue(sent.isEmpty());
            assertEquals(
                    List.of(Command.CLUSTER.toString(), Command.SCAN.toString(), Command.DEL.toString()),
                    node("redis://10.0.0.1:7000").sent);
            assertEquals(
                    List.of(Command.SCAN.toString(), Command.DEL.toString()), node("redis://10.0.0.2:7001").sent);
            verify(node("redis://10.0.0.2:7001").redis).close();
        }

        @Test
        @DisplayName("should require node clients for a prefixed cluster")
        void shouldRequireNodeClients() {
            final var settings = new RedisSettings(List.of("10.0.0.1:7000"), null, null, "app:");

            assertThrows(
                    IllegalArgumentException.class,
                    () -> new RedisCacheStore(CacheKind.REDIS_CLUSTER, redis, settings, Duration.ZERO, null));
        }

        private Response page(String key) {
            final var cursor = mock(Response.class);
            when(cursor.toString()).thenReturn("0");
            final var found = mock(Response.class);
            when(found.toString()).thenReturn(key);
            final var keys = mock(Response.class);
            when(keys.size()).thenReturn(1);
            when(keys.get(0)).thenReturn(found);
            final var page = mock(Response.class);
            when(page.get(0)).thenReturn(cursor);
            when(page.get(1)).thenReturn(keys);
            return page;
        }
    }

    /**
     * A mocked single-node client answering per command.
     */
    private static final class FakeNode {

        private final Redis redis = mock(Redis.class);
        private final Map<String, Supplier<Uni<Response>>> replies = new HashMap<>();
        private final List<String> sent = new CopyOnWriteArrayList<>();

        FakeNode() {
            lenient().when(redis.send(any(Request.class))).thenAnswer(invocation -> {
                final Request request = invocation.getArgument(0);
                final var command = request.getDelegate().command().toString();
                sent.add(command);
                final var reply = replies.get(command);
                return reply != null ? reply.get() : Uni.createFrom().<Response>nullItem();
            });
        }

        void reply(Command command, Supplier<Uni<Response>> reply) {
            replies.put(command.toString(), reply);
        }
    }
}
