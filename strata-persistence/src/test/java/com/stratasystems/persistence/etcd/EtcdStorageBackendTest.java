package com.stratasystems.persistence.etcd;

import com.stratasystems.persistence.QueryFilter;
import com.stratasystems.persistence.QueryOptions;
import com.stratasystems.persistence.StorageException.BackendUnavailableException;
import com.stratasystems.persistence.StoredRecord;
import com.stratasystems.persistence.codec.RecordSerializer;
import com.stratasystems.test.AsyncAssertion;
import com.stratasystems.test.TestRecords;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.kv.DeleteResponse;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.PutResponse;
import io.etcd.jetcd.options.DeleteOption;
import io.etcd.jetcd.options.GetOption;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

import static com.stratasystems.test.TestRecords.object;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class EtcdStorageBackendTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    @Mock
    private Client client;

    @Mock
    private KV kv;

    @Mock
    private GetResponse emptyResponse;

    private EtcdStorageBackend backend;

    @BeforeEach
    void setUp() {
        when(client.getKVClient()).thenReturn(kv);
        when(emptyResponse.getKvs()).thenReturn(List.of());
        when(kv.get(any(ByteSequence.class), any(GetOption.class)))
            .thenReturn(CompletableFuture.completedFuture(emptyResponse));

        EtcdBackendConfig config = EtcdBackendConfig.builder()
            .endpoints("http://etcd-test:2379")
            .requestTimeout(Duration.ofMillis(200))
            .build();
        backend = new EtcdStorageBackend(config, () -> client);
        AsyncAssertion.await(backend.open(), TIMEOUT);
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    private static KeyValue keyValue(String key, StoredRecord record) {
        KeyValue entry = mock(KeyValue.class);
        when(entry.getKey()).thenReturn(ByteSequence.from(key, StandardCharsets.UTF_8));
        when(entry.getValue()).thenReturn(ByteSequence.from(RecordSerializer.toBytes(record)));
        return entry;
    }

    @Test
    void testOpenProbesCluster() {
        assertTrue(backend.isAvailable());
        assertEquals(true, backend.describe().get("healthy"));
    }

    @Test
    void testSaveWritesEnvelopeUnderPrefixedKey() throws Exception {
        when(kv.put(any(ByteSequence.class), any(ByteSequence.class)))
            .thenReturn(CompletableFuture.completedFuture(mock(PutResponse.class)));
        StoredRecord record = TestRecords.record("users", "alice", object("name", "Alice"));

        AsyncAssertion.await(backend.save("users", "alice", record), TIMEOUT);

        ArgumentCaptor<ByteSequence> key = ArgumentCaptor.forClass(ByteSequence.class);
        ArgumentCaptor<ByteSequence> value = ArgumentCaptor.forClass(ByteSequence.class);
        verify(kv).put(key.capture(), value.capture());
        assertEquals("/strata/users:alice", key.getValue().toString(StandardCharsets.UTF_8));
        assertEquals(record, RecordSerializer.fromBytes(value.getValue().getBytes(), "users:alice"));
    }

    @Test
    void testLoadParsesStoredValue() {
        StoredRecord record = TestRecords.record("users", "bob", object("name", "Bob"));
        GetResponse response = mock(GetResponse.class);
        when(response.getKvs()).thenReturn(List.of(keyValue("/strata/users:bob", record)));
        when(kv.get(any(ByteSequence.class))).thenReturn(CompletableFuture.completedFuture(response));

        Optional<StoredRecord> loaded = AsyncAssertion.await(backend.load("users", "bob"), TIMEOUT);

        assertEquals(Optional.of(record), loaded);
    }

    @Test
    void testLoadOfMissingKeyIsEmpty() {
        when(kv.get(any(ByteSequence.class))).thenReturn(CompletableFuture.completedFuture(emptyResponse));

        assertTrue(AsyncAssertion.await(backend.load("users", "nobody"), TIMEOUT).isEmpty());
        assertTrue(backend.isAvailable());
    }

    @Test
    void testCorruptedValueIsNotFound() {
        KeyValue entry = mock(KeyValue.class);
        when(entry.getValue()).thenReturn(ByteSequence.from("{broken", StandardCharsets.UTF_8));
        GetResponse response = mock(GetResponse.class);
        when(response.getKvs()).thenReturn(List.of(entry));
        when(kv.get(any(ByteSequence.class))).thenReturn(CompletableFuture.completedFuture(response));

        assertTrue(AsyncAssertion.await(backend.load("users", "x"), TIMEOUT).isEmpty());
        assertTrue(backend.isAvailable());
    }

    @Test
    void testTimeoutMarksBackendUnhealthyUntilProbeSucceeds() {
        when(kv.put(any(ByteSequence.class), any(ByteSequence.class))).thenReturn(new CompletableFuture<>());

        Throwable failure = AsyncAssertion.awaitFailure(
            backend.save("users", "slow", TestRecords.record("users", "slow", object("v", 1))), TIMEOUT);

        assertInstanceOf(BackendUnavailableException.class, failure);
        assertTrue(failure.getMessage().contains("timed out"));
        assertFalse(backend.isAvailable());
        assertInstanceOf(BackendUnavailableException.class,
            AsyncAssertion.awaitFailure(backend.load("users", "slow"), TIMEOUT));

        assertTrue(AsyncAssertion.await(backend.probe(), TIMEOUT));
        assertTrue(backend.isAvailable());
    }

    @Test
    void testOpenFailsWhenClusterUnreachable() {
        EtcdStorageBackend unreachable = new EtcdStorageBackend(
            EtcdBackendConfig.builder().requestTimeout(Duration.ofMillis(100)).build(), () -> client);
        when(kv.get(any(ByteSequence.class), any(GetOption.class)))
            .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("connection refused")));
        try {
            Throwable failure = AsyncAssertion.awaitFailure(unreachable.open(), TIMEOUT);

            assertInstanceOf(BackendUnavailableException.class, failure);
            assertFalse(unreachable.isAvailable());
            assertNotNull(unreachable.describe().get("lastError"));
        } finally {
            unreachable.close();
        }
    }

    @Test
    void testQueryFiltersAndLimitsInKeyOrder() {
        GetResponse response = mock(GetResponse.class);
        when(response.getKvs()).thenReturn(List.of(
            keyValue("/strata/tasks:c", TestRecords.record("tasks", "c", object("status", "open"))),
            keyValue("/strata/tasks:a", TestRecords.record("tasks", "a", object("status", "open"))),
            keyValue("/strata/tasks:b", TestRecords.record("tasks", "b", object("status", "done")))));
        when(kv.get(any(ByteSequence.class), any(GetOption.class)))
            .thenReturn(CompletableFuture.completedFuture(response));

        QueryFilter open = QueryFilter.where("status", "open");
        List<StoredRecord> all = AsyncAssertion.await(
            backend.query("tasks", r -> open.matches(r.getValue()), QueryOptions.DEFAULT), TIMEOUT);
        List<StoredRecord> limited = AsyncAssertion.await(
            backend.query("tasks", r -> true, QueryOptions.limit(1)), TIMEOUT);

        assertEquals(2, all.size());
        assertEquals("tasks:a", all.get(0).fullKey());
        assertEquals("tasks:c", all.get(1).fullKey());
        assertEquals(1, limited.size());
        assertEquals("tasks:a", limited.get(0).fullKey());
    }

    @Test
    void testClearDeletesCollectionPrefix() {
        DeleteResponse deleted = mock(DeleteResponse.class);
        when(deleted.getDeleted()).thenReturn(3L);
        when(kv.delete(any(ByteSequence.class), any(DeleteOption.class)))
            .thenReturn(CompletableFuture.completedFuture(deleted));

        AsyncAssertion.await(backend.clear("tasks"), TIMEOUT);

        ArgumentCaptor<ByteSequence> prefix = ArgumentCaptor.forClass(ByteSequence.class);
        verify(kv).delete(prefix.capture(), any(DeleteOption.class));
        assertEquals("/strata/tasks:", prefix.getValue().toString(StandardCharsets.UTF_8));
    }

    @Test
    void testCollectionWhoseNameExtendsAnotherStaysSeparate() {
        Map<String, KeyValue> stored = new TreeMap<>();
        stored.put(backend.etcdKey("users", "a"),
            keyValue(backend.etcdKey("users", "a"), TestRecords.record("users", "a", object("n", 1))));
        stored.put(backend.etcdKey("users/archive", "b"),
            keyValue(backend.etcdKey("users/archive", "b"), TestRecords.record("users/archive", "b", object("n", 2))));
        stored.put(backend.etcdKey("users_old", "c"),
            keyValue(backend.etcdKey("users_old", "c"), TestRecords.record("users_old", "c", object("n", 3))));
        when(kv.get(any(ByteSequence.class), any(GetOption.class))).thenAnswer(invocation -> {
            String prefix = invocation.<ByteSequence>getArgument(0).toString(StandardCharsets.UTF_8);
            List<KeyValue> matches = stored.entrySet().stream()
                .filter(entry -> entry.getKey().startsWith(prefix))
                .map(Map.Entry::getValue)
                .collect(Collectors.toList());
            return CompletableFuture.completedFuture(mock(GetResponse.class, call -> matches));
        });
        when(kv.delete(any(ByteSequence.class), any(DeleteOption.class)))
            .thenReturn(CompletableFuture.completedFuture(mock(DeleteResponse.class)));

        List<StoredRecord> users = AsyncAssertion.await(
            backend.query("users", r -> true, QueryOptions.DEFAULT), TIMEOUT);
        AsyncAssertion.await(backend.clear("users"), TIMEOUT);

        assertEquals(List.of("users:a"), users.stream().map(StoredRecord::fullKey).collect(Collectors.toList()));
        ArgumentCaptor<ByteSequence> prefix = ArgumentCaptor.forClass(ByteSequence.class);
        verify(kv).delete(prefix.capture(), any(DeleteOption.class));
        String cleared = prefix.getValue().toString(StandardCharsets.UTF_8);
        assertEquals(List.of(backend.etcdKey("users", "a")), stored.keySet().stream()
            .filter(key -> key.startsWith(cleared))
            .collect(Collectors.toList()));
    }

    @Test
    void testCloseReleasesClient() {
        backend.close();

        verify(client).close();
        assertFalse(backend.isAvailable());
        assertFalse(AsyncAssertion.await(backend.probe(), TIMEOUT));
    }
}
