package io.mcpmemory.core.store.qdrant;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.util.concurrent.ListenableFuture;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.mcpmemory.core.model.GlobalConfig;
import io.mcpmemory.core.model.Group;
import io.mcpmemory.core.model.Note;
import io.mcpmemory.core.namespace.Namespace;
import io.mcpmemory.core.store.ConnectionFailedException;
import io.mcpmemory.core.store.JsonValues;
import io.mcpmemory.core.store.ListOptions;
import io.mcpmemory.core.store.NotFoundException;
import io.mcpmemory.core.store.NotInitializedException;
import io.mcpmemory.core.store.NoteDefaults;
import io.mcpmemory.core.store.NoteOrdering;
import io.mcpmemory.core.store.SearchOptions;
import io.mcpmemory.core.store.SearchResult;
import io.mcpmemory.core.store.Store;
import io.mcpmemory.core.store.StoreException;
import io.mcpmemory.core.store.VectorMath;
import io.qdrant.client.QdrantClient;
import io.qdrant.client.QdrantGrpcClient;
import io.qdrant.client.grpc.Collections.Distance;
import io.qdrant.client.grpc.Collections.VectorParams;
import io.qdrant.client.grpc.JsonWithInt.Value;
import io.qdrant.client.grpc.Points.Filter;
import io.qdrant.client.grpc.Points.PointId;
import io.qdrant.client.grpc.Points.PointStruct;
import io.qdrant.client.grpc.Points.QueryPoints;
import io.qdrant.client.grpc.Points.RetrievedPoint;
import io.qdrant.client.grpc.Points.ScoredPoint;
import io.qdrant.client.grpc.Points.ScrollPoints;
import io.qdrant.client.grpc.Points.ScrollResponse;
import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.qdrant.client.QueryFactory.nearest;
import static io.qdrant.client.VectorsFactory.vectors;
import static io.qdrant.client.WithPayloadSelectorFactory.enable;

/**
 * Store backed by a Qdrant server. Notes live in one collection per namespace, sized to
 * the namespace dimension; global settings and groups live in two auxiliary collections
 * holding a single-element placeholder vector and are only ever read by id or filter.
 *
 * <p>No data is cached client-side. The only local state is the namespace binding, which
 * is guarded so that initialize and close can race with ordinary calls.
 */
public final class QdrantStore implements Store {
    private static final Logger LOG = LoggerFactory.getLogger(QdrantStore.class);

    static final String GLOBAL_CONFIGS_SUFFIX = "_global_configs";
    static final String GROUPS_SUFFIX = "_groups";
    static final int REST_PORT = 6333;
    static final int GRPC_PORT = 6334;
    static final int SCROLL_PAGE_SIZE = 256;
    static final long HEALTH_CHECK_TIMEOUT_SECONDS = 5;

    private static final List<Float> PLACEHOLDER_VECTOR = List.of(1.0f);

    private final QdrantClient client;
    private final Clock clock;
    private final PayloadCodec codec = new PayloadCodec(new JsonValues());
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private Binding binding;

    public QdrantStore(QdrantClient client, Clock clock) {
        this.client = client;
        this.clock = clock;
    }

    /**
     * Connects to the server behind {@code url} and checks that it answers. The REST port
     * 6333 in the url is translated to the gRPC port 6334.
     *
     * @throws ConnectionFailedException when the server cannot be reached
     */
    public static QdrantStore connect(String url, String apiKey) throws IOException {
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid Qdrant url " + url, e);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("Qdrant url has no host: " + url);
        }
        int port = uri.getPort() < 0 || uri.getPort() == REST_PORT ? GRPC_PORT : uri.getPort();
        boolean tls = "https".equalsIgnoreCase(uri.getScheme());

        QdrantGrpcClient.Builder builder = QdrantGrpcClient.newBuilder(uri.getHost(), port, tls);
        if (apiKey != null && !apiKey.isBlank()) {
            builder.withApiKey(apiKey);
        }
        QdrantClient client = new QdrantClient(builder.build());
        try {
            client.healthCheckAsync().get(HEALTH_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            client.close();
            Thread.currentThread().interrupt();
            throw new ConnectionFailedException("Interrupted while connecting to Qdrant at " + url, e);
        } catch (ExecutionException | TimeoutException e) {
            client.close();
            throw new ConnectionFailedException("Qdrant not reachable at " + uri.getHost() + ":" + port, e);
        }
        LOG.info("Connected to Qdrant at {}:{}", uri.getHost(), port);
        return new QdrantStore(client, Clock.systemUTC());
    }

    @Override
    public void initialize(String namespace) throws IOException {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be empty");
        }
        Namespace parsed = Namespace.parse(namespace);
        if (!parsed.dimensionKnown()) {
            throw new IllegalArgumentException("Qdrant collections need a known dimension, namespace " + namespace);
        }
        String collection = Namespace.collectionName(namespace);

        lock.writeLock().lock();
        try {
            if (binding != null && !binding.namespace().equals(namespace)) {
                throw new IllegalStateException(
                    "store already bound to namespace " + binding.namespace() + ", refusing " + namespace
                );
            }
            ensureCollection(collection, parsed.dimension());
            ensureCollection(collection + GLOBAL_CONFIGS_SUFFIX, PLACEHOLDER_VECTOR.size());
            ensureCollection(collection + GROUPS_SUFFIX, PLACEHOLDER_VECTOR.size());
            binding = new Binding(namespace, collection, parsed.dimension());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            binding = null;
            client.close();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Note addNote(Note note, float[] embedding) throws IOException {
        Note prepared = NoteDefaults.prepare(note, clock);
        NoteDefaults.requireEmbedding(embedding);
        Binding bound = binding();
        upsertNote(bound, prepared, embedding);
        return prepared;
    }

    @Override
    public Note get(String id) throws IOException {
        Binding bound = binding();
        return findNote(bound, id).orElseThrow(() -> new NotFoundException("note not found: " + id));
    }

    @Override
    public Note update(Note note, float[] embedding) throws IOException {
        Note prepared = NoteDefaults.prepare(note, clock);
        NoteDefaults.requireEmbedding(embedding);
        Binding bound = binding();
        if (findNote(bound, prepared.id()).isEmpty()) {
            throw new NotFoundException("note not found: " + prepared.id());
        }
        upsertNote(bound, prepared, embedding);
        return prepared;
    }

    @Override
    public void delete(String id) throws IOException {
        Binding bound = binding();
        if (findNote(bound, id).isEmpty()) {
            throw new NotFoundException("note not found: " + id);
        }
        await(client.deleteAsync(bound.notes(), List.of(PointIds.pointId(id))), "delete note " + id);
    }

    @Override
    public List<SearchResult> search(float[] query, SearchOptions options) throws IOException {
        Binding bound = binding();
        Filter filter = QdrantFilters.forSearch(options);

        // Qdrant rejects queries of the wrong width and cannot rank a zero vector; every
        // candidate then scores as maximally distant.
        if (query == null || query.length != bound.dimension() || VectorMath.hasZeroNorm(query)) {
            List<SearchResult> unranked = new ArrayList<>();
            for (RetrievedPoint point : scrollAll(bound.notes(), filter)) {
                unranked.add(new SearchResult(codec.decodeNote(point.getPayloadMap()), 0.0));
            }
            return NoteOrdering.topK(unranked, options.topK());
        }

        QueryPoints request = QueryPoints.newBuilder()
            .setCollectionName(bound.notes())
            .setQuery(nearest(toList(query)))
            .setFilter(filter)
            .setLimit(options.topK())
            .setWithPayload(enable(true))
            .build();
        List<ScoredPoint> points = await(client.queryAsync(request), "search " + bound.notes());
        List<SearchResult> results = new ArrayList<>(points.size());
        for (ScoredPoint point : points) {
            Note decoded = codec.decodeNote(point.getPayloadMap());
            results.add(new SearchResult(decoded, VectorMath.scoreFromSimilarity(point.getScore())));
        }
        return NoteOrdering.topK(results, options.topK());
    }

    @Override
    public List<Note> listRecent(ListOptions options) throws IOException {
        Binding bound = binding();
        List<Note> notes = new ArrayList<>();
        for (RetrievedPoint point : scrollAll(bound.notes(), QdrantFilters.forList(options))) {
            notes.add(codec.decodeNote(point.getPayloadMap()));
        }
        return NoteOrdering.mostRecent(notes, options.limit());
    }

    @Override
    public GlobalConfig upsertGlobal(GlobalConfig config) throws IOException {
        GlobalConfig prepared = NoteDefaults.prepare(config, clock);
        Binding bound = binding();
        Map<String, Value> payload;
        try {
            payload = codec.encodeGlobal(prepared);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to encode global config " + prepared.id(), e);
        }
        upsertPlaceholder(bound.globalConfigs(), prepared.id(), payload, "upsert global config " + prepared.id());
        return prepared;
    }

    @Override
    public Optional<GlobalConfig> getGlobal(String projectId, String key) throws IOException {
        Binding bound = binding();
        return findGlobal(bound, GlobalConfig.deriveId(projectId, key));
    }

    @Override
    public GlobalConfig getGlobalById(String id) throws IOException {
        Binding bound = binding();
        return findGlobal(bound, id).orElseThrow(() -> new NotFoundException("global config not found: " + id));
    }

    @Override
    public void deleteGlobalById(String id) throws IOException {
        Binding bound = binding();
        if (findGlobal(bound, id).isEmpty()) {
            throw new NotFoundException("global config not found: " + id);
        }
        await(client.deleteAsync(bound.globalConfigs(), List.of(PointIds.pointId(id))), "delete global config " + id);
    }

    @Override
    public Group addGroup(Group group) throws IOException {
        group.validate();
        Binding bound = binding();
        requireUniqueGroupKey(bound, group);
        upsertPlaceholder(bound.groups(), group.id(), codec.encodeGroup(group), "add group " + group.groupKey());
        return group;
    }

    @Override
    public Group getGroup(String id) throws IOException {
        Binding bound = binding();
        return findGroup(bound, id).orElseThrow(() -> new NotFoundException("group not found: " + id));
    }

    @Override
    public Group getGroupByKey(String projectId, String groupKey) throws IOException {
        Binding bound = binding();
        List<RetrievedPoint> points = scrollAll(bound.groups(), QdrantFilters.forGroupKey(projectId, groupKey));
        if (points.isEmpty()) {
            throw new NotFoundException("group not found: " + projectId + "/" + groupKey);
        }
        return codec.decodeGroup(points.get(0).getPayloadMap());
    }

    @Override
    public Group updateGroup(Group group) throws IOException {
        group.validate();
        Binding bound = binding();
        if (findGroup(bound, group.id()).isEmpty()) {
            throw new NotFoundException("group not found: " + group.id());
        }
        requireUniqueGroupKey(bound, group);
        upsertPlaceholder(bound.groups(), group.id(), codec.encodeGroup(group), "update group " + group.id());
        return group;
    }

    @Override
    public void deleteGroup(String id) throws IOException {
        Binding bound = binding();
        if (findGroup(bound, id).isEmpty()) {
            throw new NotFoundException("group not found: " + id);
        }
        await(client.deleteAsync(bound.groups(), List.of(PointIds.pointId(id))), "delete group " + id);
    }

    @Override
    public List<Group> listGroups(String projectId) throws IOException {
        Binding bound = binding();
        List<Group> groups = new ArrayList<>();
        for (RetrievedPoint point : scrollAll(bound.groups(), QdrantFilters.forProject(projectId))) {
            groups.add(codec.decodeGroup(point.getPayloadMap()));
        }
        groups.sort(Comparator.comparing(Group::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Group::id));
        return groups;
    }

    private Binding binding() throws NotInitializedException {
        lock.readLock().lock();
        try {
            if (binding == null) {
                throw new NotInitializedException();
            }
            return binding;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void ensureCollection(String name, int size) throws StoreException {
        boolean exists;
        try {
            exists = await(client.collectionExistsAsync(name), "check collection " + name);
        } catch (StoreException e) {
            if (hasStatus(e, Status.Code.UNAVAILABLE)) {
                throw new ConnectionFailedException("Qdrant unavailable while checking collection " + name, e.getCause());
            }
            throw e;
        }
        if (exists) {
            return;
        }
        VectorParams params = VectorParams.newBuilder()
            .setSize(size)
            .setDistance(Distance.Cosine)
            .build();
        try {
            await(client.createCollectionAsync(name, params), "create collection " + name);
            LOG.info("Created Qdrant collection '{}' with size={} distance=COSINE", name, size);
        } catch (StoreException e) {
            if (!hasStatus(e, Status.Code.ALREADY_EXISTS)) {
                throw e;
            }
            LOG.info("Qdrant collection '{}' was created concurrently", name);
        }
    }

    private void upsertNote(Binding bound, Note note, float[] embedding) throws StoreException {
        if (embedding.length != bound.dimension()) {
            throw new StoreException(
                "embedding has " + embedding.length + " dimensions, collection " + bound.notes() + " expects " + bound.dimension()
            );
        }
        Map<String, Value> payload;
        try {
            payload = codec.encodeNote(note);
        } catch (JsonProcessingException e) {
            throw new StoreException("Failed to encode note " + note.id(), e);
        }
        PointStruct point = PointStruct.newBuilder()
            .setId(PointIds.pointId(note.id()))
            .setVectors(vectors(toList(embedding)))
            .putAllPayload(payload)
            .build();
        await(client.upsertAsync(bound.notes(), List.of(point)), "upsert note " + note.id());
    }

    private void upsertPlaceholder(String collection, String id, Map<String, Value> payload, String operation)
        throws StoreException {
        PointStruct point = PointStruct.newBuilder()
            .setId(PointIds.pointId(id))
            .setVectors(vectors(PLACEHOLDER_VECTOR))
            .putAllPayload(payload)
            .build();
        await(client.upsertAsync(collection, List.of(point)), operation);
    }

    private Optional<Note> findNote(Binding bound, String id) throws StoreException {
        return retrieve(bound.notes(), id).map(point -> codec.decodeNote(point.getPayloadMap()));
    }

    private Optional<GlobalConfig> findGlobal(Binding bound, String id) throws StoreException {
        return retrieve(bound.globalConfigs(), id).map(point -> codec.decodeGlobal(point.getPayloadMap()));
    }

    private void requireUniqueGroupKey(Binding bound, Group group) throws StoreException {
        for (RetrievedPoint point : scrollAll(bound.groups(), QdrantFilters.forGroupKey(group.projectId(), group.groupKey()))) {
            if (!group.id().equals(PayloadCodec.stringOrNull(point.getPayloadMap(), PayloadCodec.ID))) {
                throw new StoreException("group key already exists: " + group.groupKey());
            }
        }
    }

    private Optional<Group> findGroup(Binding bound, String id) throws StoreException {
        return retrieve(bound.groups(), id).map(point -> codec.decodeGroup(point.getPayloadMap()));
    }

    /**
     * Looks a point up by the hash of {@code id} and accepts it only when the stored
     * payload id is {@code id} itself.
     */
    private Optional<RetrievedPoint> retrieve(String collection, String id) throws StoreException {
        if (id == null) {
            return Optional.empty();
        }
        List<PointId> ids = List.of(PointIds.pointId(id));
        List<RetrievedPoint> points = await(client.retrieveAsync(collection, ids, true, false, null), "retrieve " + id);
        for (RetrievedPoint point : points) {
            if (id.equals(PayloadCodec.stringOrNull(point.getPayloadMap(), PayloadCodec.ID))) {
                return Optional.of(point);
            }
        }
        return Optional.empty();
    }

    private List<RetrievedPoint> scrollAll(String collection, Filter filter) throws StoreException {
        List<RetrievedPoint> points = new ArrayList<>();
        PointId offset = null;
        do {
            ScrollPoints.Builder request = ScrollPoints.newBuilder()
                .setCollectionName(collection)
                .setFilter(filter)
                .setLimit(SCROLL_PAGE_SIZE)
                .setWithPayload(enable(true));
            if (offset != null) {
                request.setOffset(offset);
            }
            ScrollResponse response = await(client.scrollAsync(request.build()), "scroll " + collection);
            points.addAll(response.getResultList());
            offset = response.hasNextPageOffset() ? response.getNextPageOffset() : null;
        } while (offset != null);
        return points;
    }

    /**
     * Blocks on a client call. Interrupting the waiting thread cancels the remote call.
     */
    private static <T> T await(ListenableFuture<T> future, String operation) throws StoreException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StoreException("Interrupted during " + operation, e);
        } catch (ExecutionException e) {
            throw new StoreException("Failed to " + operation, e.getCause());
        }
    }

    private static boolean hasStatus(StoreException e, Status.Code code) {
        Throwable cause = e.getCause();
        while (cause != null) {
            if (cause instanceof StatusRuntimeException status && status.getStatus().getCode() == code) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static List<Float> toList(float[] vector) {
        List<Float> values = new ArrayList<>(vector.length);
        for (float v : vector) {
            values.add(v);
        }
        return values;
    }

    private record Binding(String namespace, String notes, int dimension) {
        String globalConfigs() {
            return notes + GLOBAL_CONFIGS_SUFFIX;
        }

        String groups() {
            return notes + GROUPS_SUFFIX;
        }
    }
}
