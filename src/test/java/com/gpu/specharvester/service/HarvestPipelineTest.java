package com.gpu.specharvester.service;

import com.gpu.specharvester.entity.Product;
import com.gpu.specharvester.entity.Review;
import com.gpu.specharvester.entity.Spec;
import com.gpu.specharvester.repository.ProductRepository;
import com.gpu.specharvester.repository.ReviewRepository;
import com.gpu.specharvester.repository.SpecRepository;
import com.gpu.specharvester.support.DatabaseCleaner;
import com.gpu.specharvester.support.HarvesterTestConfig;
import com.gpu.specharvester.support.StubPageClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Import(HarvesterTestConfig.class)
class HarvestPipelineTest {

    private static final String BASE = "http://catalog.test";

    @Autowired
    private HarvestPipeline pipeline;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private SpecRepository specRepository;

    @Autowired
    private ReviewRepository reviewRepository;

    @Autowired
    private StubPageClient pageClient;

    @Autowired
    private DatabaseCleaner databaseCleaner;

    @BeforeEach
    void setUp() {
        databaseCleaner.clean();
        pageClient.reset();
        pageClient.serveFixture(BASE + "/gpu-specs/", "listing.html")
                .serveFixture(BASE + "/gpu-specs/acme-x1.c1", "gpu-acme-x1.html")
                .serveFixture(BASE + "/gpu-specs/acme-x1-turbo.b1", "board-acme-x1-turbo.html")
                .serveFixture(BASE + "/review/acme-x1-turbo/", "review-main.html")
                .serveFixture(BASE + "/review/acme-x1/5.html", "review-temperatures.html")
                .serveFixture(BASE + "/review/acme-x1/6.html", "review-overclocking.html");
    }

    @Test
    void testDefaultRunStoresProductsBoardsAndReviews() throws Exception {
        RunStatistics stats = new RunStatistics();

        pipeline.run(stats, null);

        assertEquals(1, stats.getProducts());
        assertEquals(2, stats.getBoards());
        assertEquals(2, stats.getReviews());
        assertEquals(1, stats.getErrors());
        assertEquals(100, stats.getProgress());
        assertEquals(3, productRepository.count());

        Product gpu = productRepository.findByName("Acme X1").orElseThrow();
        assertEquals("Acme", gpu.getVendor());

        Product turbo = productRepository.findByName("Acme X1 Turbo").orElseThrow();
        assertEquals("Factory overclocked Acme X1 with a triple-fan cooler.", turbo.getDescription());
        Map<String, String> turboSpecs = specValues(turbo.getId());
        assertEquals(String.valueOf(gpu.getId()), turboSpecs.get("Parent GPU ID"));
        assertEquals("336 mm", turboSpecs.get("Length"));
        assertEquals("1250 RPM", turboSpecs.get("Fan Speed"));

        Product mini = productRepository.findByName("Acme X1 Mini").orElseThrow();
        assertEquals(Map.of("GPU Clock", "1700 MHz", "Memory Clock", "2250 MHz",
                "Parent GPU ID", String.valueOf(gpu.getId())), specValues(mini.getId()));

        Set<String> reviewTypes = reviewRepository.findByMasterProductId(turbo.getId()).stream()
                .map(Review::getType)
                .collect(Collectors.toSet());
        assertEquals(Set.of("Temperatures & Fan Noise", "Overclocking & Power Limits"), reviewTypes);
        assertTrue(reviewRepository.findByMasterProductId(mini.getId()).isEmpty());
    }

    @Test
    void testExhaustedUrlIsSkipped() throws Exception {
        RunStatistics stats = new RunStatistics();

        pipeline.run(stats, null);

        // one attempt plus one retry from the single-entry test retry table
        assertEquals(2, pageClient.requestCount(BASE + "/gpu-specs/acme-x2.c2"));
        assertTrue(productRepository.findByName("Acme X2").isEmpty());
    }

    @Test
    void testKnownProductsSkippedOnSecondRun() throws Exception {
        pipeline.run(new RunStatistics(), null);
        pageClient.requests().clear();

        RunStatistics second = new RunStatistics();
        pipeline.run(second, null);

        assertEquals(0, second.getProducts());
        assertEquals(3, productRepository.count());
        assertEquals(0, pageClient.requestCount(BASE + "/gpu-specs/acme-x1.c1"));
    }

    @Test
    void testNameFilterSelectsOneGpu() throws Exception {
        RunStatistics stats = new RunStatistics();

        pipeline.run(stats, "ACME X1");

        assertEquals(1, stats.getProducts());
        assertEquals(0, stats.getErrors());
        assertEquals(0, pageClient.requestCount(BASE + "/gpu-specs/acme-x2.c2"));
    }

    @Test
    void testUnknownNameFilterStoresNothing() throws Exception {
        RunStatistics stats = new RunStatistics();

        pipeline.run(stats, "Acme Z9");

        assertEquals(0, productRepository.count());
        assertEquals(100, stats.getProgress());
        assertEquals(1, pageClient.requests().size());
    }

    @Test
    void testMissingListingFailsRun() {
        pageClient.reset();

        assertThrows(IllegalStateException.class, () -> pipeline.run(new RunStatistics(), null));
    }

    private Map<String, String> specValues(Long productId) {
        return specRepository.findByProductId(productId).stream()
                .collect(Collectors.toMap(Spec::getName, Spec::getValue));
    }
}
