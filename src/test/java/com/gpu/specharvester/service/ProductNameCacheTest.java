package com.gpu.specharvester.service;

import com.gpu.specharvester.dto.ProductNameRow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProductNameCacheTest {

    @Test
    void testFullAndSimplifiedNames() {
        ProductNameCache cache = ProductNameCache.of(List.of(
                new ProductNameRow(7L, "NVIDIA GeForce RTX 4090"),
                new ProductNameRow(8L, "AMD Radeon RX 7900 XTX")));

        assertEquals(7L, cache.lookup("NVIDIA GeForce RTX 4090").orElseThrow());
        assertEquals(7L, cache.lookup("GeForce RTX 4090").orElseThrow());
        assertEquals(8L, cache.lookup("Radeon RX 7900 XTX").orElseThrow());
        assertFalse(cache.contains("RTX 4090"));
        assertTrue(cache.lookup(null).isEmpty());
    }

    @Test
    void testSimplifiedNameNeverShadowsFullName() {
        ProductNameCache cache = new ProductNameCache();
        cache.register("Acme X1", 1L);
        cache.register("Turbo Acme X1", 2L);

        assertEquals(1L, cache.lookup("Acme X1").orElseThrow());
        assertEquals(2L, cache.lookup("Turbo Acme X1").orElseThrow());
    }

    @Test
    void testSimplify() {
        assertEquals("GeForce RTX 4090", ProductNameCache.simplify("NVIDIA GeForce RTX 4090"));
        assertNull(ProductNameCache.simplify("Voodoo3"));
        assertNull(ProductNameCache.simplify("Trailing "));
    }
}
