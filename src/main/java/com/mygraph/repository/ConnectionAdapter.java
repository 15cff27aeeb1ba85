package com.mygraph.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 管理并缓存图存储连接。
 * 客户端在第一次使用时才创建（只创建一次），配置错误在那时暴露；
 * 同时缓存每个类型的类别锚点节点。
 */
public class ConnectionAdapter implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ConnectionAdapter.class);

    public static final String CATEGORY_INDEX = "Category";
    static final String CATEGORY_KEY = "category";

    private static volatile ConnectionAdapter shared;

    private final Supplier<? extends GraphStoreClient> clientFactory;
    private final Map<String, StoreNode> categoryCache = new ConcurrentHashMap<>();
    private final Map<String, IndexHandle> indexCache = new ConcurrentHashMap<>();
    private volatile GraphStoreClient client;

    public ConnectionAdapter(Supplier<? extends GraphStoreClient> clientFactory) {
        this.clientFactory = Objects.requireNonNull(clientFactory, "clientFactory");
    }

    /**
     * 进程级共享实例，按环境变量（NEO4J_URI 等）配置。
     * 与 {@link #closeShared()} 配对使用。
     */
    public static ConnectionAdapter shared() {
        ConnectionAdapter adapter = shared;
        if (adapter == null) {
            synchronized (ConnectionAdapter.class) {
                adapter = shared;
                if (adapter == null) {
                    adapter = new ConnectionAdapter(Neo4jClientFactory.fromEnvironment());
                    shared = adapter;
                }
            }
        }
        return adapter;
    }

    /**
     * 关闭并丢弃共享实例，下一次 shared() 会重新创建
     */
    public static void closeShared() {
        ConnectionAdapter adapter;
        synchronized (ConnectionAdapter.class) {
            adapter = shared;
            shared = null;
        }
        if (adapter != null) {
            adapter.close();
        }
    }

    public GraphStoreClient getClient() {
        GraphStoreClient current = client;
        if (current == null) {
            synchronized (this) {
                current = client;
                if (current == null) {
                    current = clientFactory.get();
                    if (current == null) {
                        throw new IllegalStateException("graph store client factory returned null");
                    }
                    client = current;
                    logger.info("Graph store client initialized: {}", current.getClass().getSimpleName());
                }
            }
        }
        return current;
    }

    public boolean isInitialized() {
        return client != null;
    }

    /**
     * 当前客户端上的命名索引。句柄绑定在创建它的客户端上，close() 后重新获取。
     */
    public IndexHandle index(String name) throws IOException {
        IndexHandle cached = indexCache.get(name);
        if (cached != null) {
            return cached;
        }
        IndexHandle handle = getClient().getOrCreateIndex(name);
        IndexHandle previous = indexCache.putIfAbsent(name, handle);
        return previous != null ? previous : handle;
    }

    /**
     * 按类型名取类别锚点，不存在时通过 Category 索引的 get-or-create 创建
     */
    public StoreNode category(String typeName) throws IOException {
        StoreNode cached = categoryCache.get(typeName);
        if (cached != null) {
            return cached;
        }
        IndexHandle categoryIndex = index(CATEGORY_INDEX);
        StoreNode category = categoryIndex.getOrCreate(CATEGORY_KEY, typeName, Map.of(CATEGORY_KEY, typeName));
        StoreNode previous = categoryCache.putIfAbsent(typeName, category);
        if (previous == null) {
            logger.debug("Cached category node {} for type {}", category.getId(), typeName);
        }
        return previous != null ? previous : category;
    }

    @Override
    public void close() {
        GraphStoreClient current;
        synchronized (this) {
            current = client;
            client = null;
        }
        categoryCache.clear();
        indexCache.clear();
        if (current != null) {
            current.close();
        }
    }
}
