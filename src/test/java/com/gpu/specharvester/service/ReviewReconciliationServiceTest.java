package com.gpu.specharvester.service;

import com.gpu.specharvester.dto.ProductAttributes;
import com.gpu.specharvester.dto.ProductRef;
import com.gpu.specharvester.dto.ReviewRef;
import com.gpu.specharvester.dto.SpecItem;
import com.gpu.specharvester.entity.Product;
import com.gpu.specharvester.entity.Review;
import com.gpu.specharvester.repository.ProductRepository;
import com.gpu.specharvester.repository.ReviewDatumRepository;
import com.gpu.specharvester.repository.SpecRepository;
import com.gpu.specharvester.support.DatabaseCleaner;
import com.gpu.specharvester.support.HarvesterTestConfig;
import com.gpu.specharvester.support.MutableClock;
import com.gpu.specharvester.support.StubPageClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Import(HarvesterTestConfig.class)
class ReviewReconciliationServiceTest {

    private static final String BASE = "http://catalog.test";
    private static final String MAIN_URL = BASE + "/review/acme-x1/";
    private static final String PAGE_URL = BASE + "/review/acme-x1/5.html";
    private static final LocalDateTime RUN_TIME = LocalDateTime.of(2024, 1, 10, 3, 0);

    @Autowired
    private ReviewReconciliationService reconciliation;

    @Autowired
    private StorageReconciler storage;

    @Autowired
    private ProductRepository productRepository;

    @Autowired
    private SpecRepository specRepository;

    @Autowired
    private ReviewDatumRepository reviewDatumRepository;

    @Autowired
    private StubPageClient pageClient;

    @Autowired
    private MutableClock clock;

    @Autowired
    private DatabaseCleaner databaseCleaner;

    @BeforeEach
    void setUp() {
        databaseCleaner.clean();
        pageClient.reset();
        pageClient.serveFixture(BASE + "/gpu-specs/", "listing.html")
                .serveFixture(BASE + "/gpu-specs/acme-x1.c1", "gpu-acme-x1-reference.html")
                .serveFixture(MAIN_URL, "review-main.html")
                .serveFixture(PAGE_URL, "review-temperatures.html")
                .serveFixture(BASE + "/review/acme-x1/6.html", "review-overclocking.html");
    }

    @Test
    void testFullUpdateReplacesSpecsInPlace() throws Exception {
        Seeded seeded = seed(LocalDateTime.of(2024, 1, 1, 10, 0));
        clock.set(RUN_TIME);
        RunStatistics stats = new RunStatistics();

        int written = reconciliation.fullUpdate(stats);

        assertEquals(1, written);
        assertEquals(1, stats.getUpdatedReviews());
        assertEquals(100, stats.getProgress());

        Product product = productRepository.findByName("Acme X1").orElseThrow();
        assertEquals(seeded.productId(), product.getId());
        assertEquals(1, productRepository.count());
        assertEquals(5, specRepository.countByProductId(product.getId()));
        assertEquals(RUN_TIME, product.getUpdatedAt());

        Review review = storage.findReview(seeded.reviewId()).orElseThrow();
        assertEquals(MAIN_URL, review.getMainUrl());
        assertEquals(PAGE_URL, review.getPageUrl());
        assertTrue(review.getBody().contains("65 degrees"));
        assertEquals(RUN_TIME, review.getUpdatedAt());
        assertEquals(4, reviewDatumRepository.findByReviewIdOrderByIdAsc(seeded.reviewId()).size());
    }

    @Test
    void testFullUpdateIgnoresPostedDate() throws Exception {
        Seeded seeded = seed(LocalDateTime.of(2024, 2, 1, 10, 0));
        clock.set(LocalDateTime.of(2024, 2, 2, 10, 0));

        assertEquals(1, reconciliation.fullUpdate(new RunStatistics()));
        assertTrue(storage.findReview(seeded.reviewId()).orElseThrow().getBody().contains("65 degrees"));
    }

    @Test
    void testIncrementalUpdateRewritesStaleReview() throws Exception {
        Seeded seeded = seed(LocalDateTime.of(2024, 1, 1, 10, 0));
        clock.set(RUN_TIME);

        int written = reconciliation.incrementalUpdate(new RunStatistics());

        assertEquals(1, written);
        Review review = storage.findReview(seeded.reviewId()).orElseThrow();
        assertTrue(review.getBody().contains("65 degrees"));
        assertEquals(RUN_TIME, review.getUpdatedAt());
        assertEquals(1, pageClient.requestCount(MAIN_URL));
        assertEquals(1, pageClient.requestCount(PAGE_URL));
    }

    @Test
    void testDiscoveryOnlyVisitsStoredProducts() throws Exception {
        seed(LocalDateTime.of(2024, 1, 1, 10, 0));
        clock.set(RUN_TIME);
        RunStatistics stats = new RunStatistics();

        reconciliation.incrementalUpdate(stats);

        assertEquals(0, pageClient.requestCount(BASE + "/gpu-specs/acme-x2.c2"));
        assertEquals(1, pageClient.requestCount(BASE + "/gpu-specs/acme-x1.c1"));
        assertEquals(0, stats.getErrors());
    }

    @Test
    void testIncrementalUpdateSkipsFreshReview() throws Exception {
        LocalDateTime seededAt = LocalDateTime.of(2024, 1, 6, 10, 0);
        Seeded seeded = seed(seededAt);
        clock.set(RUN_TIME);

        int written = reconciliation.incrementalUpdate(new RunStatistics());

        assertEquals(0, written);
        Review review = storage.findReview(seeded.reviewId()).orElseThrow();
        assertEquals("Old body", review.getBody());
        assertEquals(seededAt, review.getUpdatedAt());
        assertEquals(MAIN_URL, review.getMainUrl());
        assertEquals(3, specRepository.countByProductId(seeded.productId()));
    }

    @Test
    void testIncrementalUpdateSkipsReviewWithoutPostedDate() throws Exception {
        pageClient.serve(MAIN_URL, "<html><body><select id=\"pagesel\">"
                + "<option value=\"/review/acme-x1/5.html\">5- Temperatures &amp; Fan Noise</option>"
                + "</select></body></html>");
        Seeded seeded = seed(LocalDateTime.of(2024, 1, 1, 10, 0));
        clock.set(RUN_TIME);

        assertEquals(0, reconciliation.incrementalUpdate(new RunStatistics()));
        assertEquals("Old body", storage.findReview(seeded.reviewId()).orElseThrow().getBody());
        assertEquals(PAGE_URL, storage.findReview(seeded.reviewId()).orElseThrow().getPageUrl());
    }

    @Test
    void testReviewsWithoutMainUrlAreNotTouched() throws Exception {
        pageClient.serve(BASE + "/gpu-specs/acme-x1.c1", "<html><body><h1>Acme X1</h1></body></html>");
        Seeded seeded = seed(LocalDateTime.of(2024, 1, 1, 10, 0));
        clock.set(RUN_TIME);

        assertEquals(0, reconciliation.fullUpdate(new RunStatistics()));
        assertNull(storage.findReview(seeded.reviewId()).orElseThrow().getMainUrl());
    }

    private Seeded seed(LocalDateTime at) {
        clock.set(at);
        ProductRef product = storage.upsertProductWithSpecs(
                ProductAttributes.builder().name("Acme X1").vendor("Acme").build(),
                List.of(new SpecItem("Performance", "Idle Temperature", "35 °C"),
                        new SpecItem("Performance", "Gaming Temperature", "70 °C"),
                        new SpecItem("Performance", "Fan Speed", "1400 RPM")));
        ReviewRef review = storage.storeReview(product.id(), "Temperatures & Fan Noise", "Old title", "Old body",
                List.of());
        return new Seeded(product.id(), review.id());
    }

    private record Seeded(Long productId, Long reviewId) {
    }
}
