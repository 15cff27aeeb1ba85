package com.mygraph.repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 索引查询表达式：若干 (key = value) 等值条件的 AND 组合。
 * 不可变，每次 and() 返回新实例。
 */
public final class IndexQuery {
    private final List<Term> terms;

    private IndexQuery(List<Term> terms) {
        this.terms = Collections.unmodifiableList(terms);
    }

    public static IndexQuery where(String key, Object value) {
        List<Term> terms = new ArrayList<>();
        terms.add(new Term(key, value));
        return new IndexQuery(terms);
    }

    public static IndexQuery fromMap(Map<String, Object> constraints) {
        List<Term> terms = new ArrayList<>();
        if (constraints != null) {
            for (Map.Entry<String, Object> entry : constraints.entrySet()) {
                terms.add(new Term(entry.getKey(), entry.getValue()));
            }
        }
        return new IndexQuery(terms);
    }

    public IndexQuery and(String key, Object value) {
        List<Term> next = new ArrayList<>(terms);
        next.add(new Term(key, value));
        return new IndexQuery(next);
    }

    public IndexQuery and(IndexQuery other) {
        List<Term> next = new ArrayList<>(terms);
        next.addAll(other.terms);
        return new IndexQuery(next);
    }

    public List<Term> getTerms() {
        return terms;
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Term term : terms) {
            if (sb.length() > 0) {
                sb.append(" AND ");
            }
            sb.append(term);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof IndexQuery && terms.equals(((IndexQuery) o).terms);
    }

    @Override
    public int hashCode() {
        return terms.hashCode();
    }

    /**
     * 单个等值条件
     */
    public static final class Term {
        private final String key;
        private final Object value;

        public Term(String key, Object value) {
            this.key = Objects.requireNonNull(key, "key");
            this.value = value;
        }

        public String getKey() {
            return key;
        }

        public Object getValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Term)) {
                return false;
            }
            Term other = (Term) o;
            return key.equals(other.key) && Objects.equals(value, other.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(key, value);
        }

        @Override
        public String toString() {
            return key + ":" + value;
        }
    }
}
