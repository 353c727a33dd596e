package com.gpu.specharvester.service;

import com.gpu.specharvester.dto.ProductNameRow;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps product display names, and their vendor-stripped forms, to stored product ids.
 * Built once per run and consulted before any network fetch.
 */
@Slf4j
public class ProductNameCache {

    private final Map<String, Long> ids = new ConcurrentHashMap<>();

    public static ProductNameCache of(Collection<ProductNameRow> rows) {
        ProductNameCache cache = new ProductNameCache();
        rows.forEach(row -> cache.register(row.name(), row.id()));
        log.info("Built product name cache: {} products, {} names", rows.size(), cache.size());
        return cache;
    }

    /**
     * Register the full name and the name without its leading vendor token
     */
    public void register(String name, Long id) {
        if (name == null || id == null) {
            return;
        }
        ids.put(name, id);
        String simplified = simplify(name);
        if (simplified != null) {
            ids.putIfAbsent(simplified, id);
        }
    }

    public Optional<Long> lookup(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(ids.get(name));
    }

    public boolean contains(String name) {
        return lookup(name).isPresent();
    }

    public int size() {
        return ids.size();
    }

    static String simplify(String name) {
        int space = name.indexOf(' ');
        if (space < 0 || space == name.length() - 1) {
            return null;
        }
        return name.substring(space + 1);
    }
}
