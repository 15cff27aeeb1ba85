package com.mygraph.model;

import com.mygraph.repository.Direction;
import com.mygraph.repository.IndexQuery;
import com.mygraph.repository.StoreNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 类型化的索引查询：把等值条件翻译成存储端索引查询，并把结果重建为该类型的对象
 */
public class NodeIndex {
    private static final Logger logger = LoggerFactory.getLogger(NodeIndex.class);

    private final NodeType type;

    NodeIndex(NodeType type) {
        this.type = type;
    }

    public List<MappedNode> search(Map<String, Object> constraints) throws IOException, OgmException {
        return search(IndexQuery.fromMap(constraints));
    }

    public List<MappedNode> search(String key, Object value) throws IOException, OgmException {
        return search(IndexQuery.where(key, value));
    }

    /**
     * 每个条件必须引用已声明、已索引的属性，值必须通过校验
     */
    public List<MappedNode> search(IndexQuery query) throws IOException, OgmException {
        if (query == null || query.isEmpty()) {
            throw new IllegalArgumentException("at least one constraint is required to search " + type.getName());
        }
        for (IndexQuery.Term term : query.getTerms()) {
            PropertyDescriptor descriptor = type.getProperty(term.getKey());
            if (!descriptor.isIndexed()) {
                throw new PropertyNotIndexedException(type.getName(), term.getKey());
            }
            descriptor.validate(term.getValue());
        }

        List<StoreNode> result = type.getIndexHandle().query(query);
        List<MappedNode> nodes = new ArrayList<>(result.size());
        for (StoreNode storeNode : result) {
            nodes.add(type.rehydrate(storeNode));
        }
        logger.debug("Search on {} [{}] returned {} nodes", type.getName(), query, nodes.size());
        return nodes;
    }

    public MappedNode get(Map<String, Object> constraints) throws IOException, OgmException {
        return get(IndexQuery.fromMap(constraints));
    }

    public MappedNode get(String key, Object value) throws IOException, OgmException {
        return get(IndexQuery.where(key, value));
    }

    /**
     * 恰好一个结果，否则抛出 NotFoundException / MultipleResultsException
     */
    public MappedNode get(IndexQuery query) throws IOException, OgmException {
        List<MappedNode> nodes = search(query);
        if (nodes.size() == 1) {
            return nodes.get(0);
        }
        if (nodes.size() > 1) {
            throw new MultipleResultsException("Multiple " + type.getName() + " nodes returned from query ["
                + query + "], expected one");
        }
        throw new NotFoundException("No " + type.getName() + " nodes found for [" + query + "]");
    }

    /**
     * 通过类别锚点列出该类型的全部已保存实例
     */
    public List<MappedNode> all() throws IOException, OgmException {
        StoreNode category = type.category();
        List<StoreNode> result = type.getClient().getRelatedNodes(category,
            Direction.OUTGOING, type.getCategoryRelationType());
        List<MappedNode> nodes = new ArrayList<>(result.size());
        for (StoreNode storeNode : result) {
            nodes.add(type.rehydrate(storeNode));
        }
        return nodes;
    }
}
