package com.gpu.specharvester.service;

import com.gpu.specharvester.config.HarvesterProperties;
import com.gpu.specharvester.dto.CategoryRef;
import com.gpu.specharvester.dto.ProductAttributes;
import com.gpu.specharvester.dto.ProductNameRow;
import com.gpu.specharvester.dto.ProductRef;
import com.gpu.specharvester.dto.ReviewDataItem;
import com.gpu.specharvester.dto.ReviewRef;
import com.gpu.specharvester.dto.ReviewTarget;
import com.gpu.specharvester.dto.SpecItem;
import com.gpu.specharvester.entity.Product;
import com.gpu.specharvester.entity.Review;
import com.gpu.specharvester.entity.ReviewDatum;
import com.gpu.specharvester.entity.Spec;
import com.gpu.specharvester.repository.ProductRepository;
import com.gpu.specharvester.repository.ReviewDatumRepository;
import com.gpu.specharvester.repository.ReviewRepository;
import com.gpu.specharvester.repository.SpecRepository;
import jakarta.persistence.PersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Idempotent create-or-update discipline for products, specs, reviews and review data.
 * <p>
 * Every public write runs in its own transaction on the calling thread's pooled connection.
 * Any failure rolls that transaction back and surfaces as a {@link StorageException} naming the unit.
 */
@Service
@Slf4j
public class StorageReconciler {

    private final ProductRepository productRepository;
    private final SpecRepository specRepository;
    private final ReviewRepository reviewRepository;
    private final ReviewDatumRepository reviewDatumRepository;
    private final SpecCategoryRegistry categoryRegistry;
    private final HarvesterProperties properties;
    private final Clock clock;
    private final TransactionTemplate transactionTemplate;

    public StorageReconciler(ProductRepository productRepository,
                             SpecRepository specRepository,
                             ReviewRepository reviewRepository,
                             ReviewDatumRepository reviewDatumRepository,
                             SpecCategoryRegistry categoryRegistry,
                             HarvesterProperties properties,
                             Clock clock,
                             PlatformTransactionManager transactionManager) {
        this.productRepository = productRepository;
        this.specRepository = specRepository;
        this.reviewRepository = reviewRepository;
        this.reviewDatumRepository = reviewDatumRepository;
        this.categoryRegistry = categoryRegistry;
        this.properties = properties;
        this.clock = clock;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    // ---- products and specs ----

    /**
     * Insert the product if its name is new, otherwise update the supplied attributes.
     * createdAt is never rewritten, updatedAt always moves to now.
     */
    public ProductRef upsertProduct(ProductAttributes attributes) {
        return inTransaction("product " + attributes.getName(), () -> doUpsertProduct(attributes));
    }

    /**
     * Upsert the product and supersede its whole spec set in one transaction
     */
    public ProductRef upsertProductWithSpecs(ProductAttributes attributes, List<SpecItem> specs) {
        requireName(attributes);
        Map<String, Integer> codes = resolveCategories(specs);
        return inTransaction("product " + attributes.getName(), () -> doUpsertWithSpecs(attributes, specs, codes));
    }

    /**
     * Store a board variant as its own product, linked back to its GPU through a relation spec
     */
    public ProductRef storeBoard(Long parentId, ProductAttributes attributes, List<SpecItem> specs) {
        List<SpecItem> withRelation = new ArrayList<>(specs);
        withRelation.add(new SpecItem(properties.getRelationCategory(), properties.getParentSpecName(),
                String.valueOf(parentId)));
        requireName(attributes);
        Map<String, Integer> codes = resolveCategories(withRelation);
        return inTransaction("board " + attributes.getName(),
                () -> doUpsertWithSpecs(attributes, withRelation, codes));
    }

    /**
     * Replace only the categories the new specs mention and touch the product's updatedAt.
     *
     * @return number of spec rows inserted
     */
    public int replaceSpecCategories(Long productId, List<SpecItem> specs) {
        if (specs.isEmpty()) {
            return 0;
        }
        Map<String, Integer> codes = resolveCategories(specs);
        return inTransaction("specs of product " + productId, () -> {
            Product product = productRepository.findById(productId)
                    .orElseThrow(() -> new StorageException("product " + productId, "not found"));
            LocalDateTime now = LocalDateTime.now(clock);
            int removed = specRepository.deleteByProductIdAndCategoryCodes(productId, codes.values());
            insertSpecs(productId, specs, codes, now);
            product.setUpdatedAt(now);
            productRepository.save(product);
            log.info("Replaced {} spec(s) with {} in {} categories of product {}",
                    removed, specs.size(), codes.size(), productId);
            return specs.size();
        });
    }

    public CategoryRef getOrCreateCategory(String name) {
        return categoryRegistry.getOrCreate(name);
    }

    // ---- reviews ----

    public ReviewRef upsertReview(Long boardId, String type, String title, String body) {
        return inTransaction("review " + type + " of product " + boardId,
                () -> doUpsertReview(boardId, type, title, body));
    }

    /**
     * Supersede a review's structured data. A rewrite advances the review's updatedAt.
     *
     * @return true when the stored data differed and was rewritten
     */
    public boolean replaceReviewData(Long reviewId, List<ReviewDataItem> items) {
        return inTransaction("data of review " + reviewId, () -> {
            if (!reviewRepository.existsById(reviewId)) {
                throw new StorageException("review " + reviewId, "not found");
            }
            boolean changed = doReplaceReviewData(reviewId, items);
            if (changed) {
                touchReview(reviewId);
            }
            return changed;
        });
    }

    /**
     * Review upsert plus data replacement in one transaction
     */
    public ReviewRef storeReview(Long boardId, String type, String title, String body, List<ReviewDataItem> items) {
        return inTransaction("review " + type + " of product " + boardId, () -> {
            ReviewRef ref = doUpsertReview(boardId, type, title, body);
            boolean dataChanged = doReplaceReviewData(ref.id(), items);
            if (dataChanged && !ref.changed()) {
                touchReview(ref.id());
            }
            return new ReviewRef(ref.id(), ref.created(), ref.changed() || dataChanged);
        });
    }

    /**
     * Rewrite body and data of an existing review. updatedAt only advances on an actual change.
     *
     * @return true when anything changed
     */
    public boolean replaceReviewContent(Long reviewId, String body, List<ReviewDataItem> items) {
        return inTransaction("review " + reviewId, () -> {
            Review review = reviewRepository.findById(reviewId)
                    .orElseThrow(() -> new StorageException("review " + reviewId, "not found"));
            boolean bodyChanged = !Objects.equals(review.getBody(), body);
            boolean dataChanged = doReplaceReviewData(reviewId, items);
            if (bodyChanged || dataChanged) {
                review.setBody(body);
                review.setUpdatedAt(LocalDateTime.now(clock));
                reviewRepository.save(review);
            }
            return bodyChanged || dataChanged;
        });
    }

    /**
     * Record the review main URL on every review of the board whose stored name contains {@code boardName}.
     * URL bookkeeping does not count as a content change.
     *
     * @return number of reviews whose URL was written
     */
    public int assignMainUrl(String boardName, String mainUrl) {
        return inTransaction("review URL of board " + boardName, () -> {
            Optional<Product> board = productRepository.findFirstByNameContainingOrderByIdAsc(boardName);
            if (board.isEmpty()) {
                log.warn("No stored board matches name '{}'", boardName);
                return 0;
            }
            List<Review> reviews = reviewRepository.findByMasterProductId(board.get().getId());
            if (reviews.isEmpty()) {
                log.warn("Board {} (ID: {}) has no stored reviews", boardName, board.get().getId());
                return 0;
            }
            int written = 0;
            for (Review review : reviews) {
                if (!mainUrl.equals(review.getMainUrl())) {
                    review.setMainUrl(mainUrl);
                    reviewRepository.save(review);
                    written++;
                }
            }
            if (written > 0) {
                log.info("Recorded review URL {} on {} review(s) of board {}", mainUrl, written, boardName);
            }
            return written;
        });
    }

    public void assignPageUrl(Long reviewId, String pageUrl) {
        inTransaction("page URL of review " + reviewId, () -> {
            Review review = reviewRepository.findById(reviewId)
                    .orElseThrow(() -> new StorageException("review " + reviewId, "not found"));
            if (!pageUrl.equals(review.getPageUrl())) {
                review.setPageUrl(pageUrl);
                reviewRepository.save(review);
            }
            return null;
        });
    }

    // ---- read models ----

    public List<ProductNameRow> loadProductNames() {
        return inTransaction("product names", productRepository::findAllNames);
    }

    public List<ReviewTarget> findReviewTargets() {
        return inTransaction("review targets", reviewRepository::findReviewTargets);
    }

    public Optional<Review> findReview(Long reviewId) {
        return inTransaction("review " + reviewId, () -> reviewRepository.findById(reviewId));
    }

    // ---- internals ----

    private ProductRef doUpsertProduct(ProductAttributes attributes) {
        requireName(attributes);
        String name = attributes.getName();
        LocalDateTime now = LocalDateTime.now(clock);
        Optional<Product> existing = productRepository.findByName(name);

        if (existing.isPresent()) {
            Product product = existing.get();
            if (attributes.getVendor() != null) {
                product.setVendor(attributes.getVendor());
            }
            if (attributes.getDescription() != null) {
                product.setDescription(attributes.getDescription());
            }
            if (attributes.getImageUrl() != null) {
                product.setImageUrl(attributes.getImageUrl());
            }
            product.setUpdatedAt(now);
            productRepository.save(product);
            log.debug("Updated product: {} (ID: {})", name, product.getId());
            return new ProductRef(product.getId(), name, false);
        }

        Product created = productRepository.saveAndFlush(Product.builder()
                .name(name)
                .vendor(attributes.getVendor())
                .description(attributes.getDescription())
                .imageUrl(attributes.getImageUrl())
                .createdAt(now)
                .updatedAt(now)
                .build());
        log.info("Created product: {} (ID: {})", name, created.getId());
        return new ProductRef(created.getId(), name, true);
    }

    private ProductRef doUpsertWithSpecs(ProductAttributes attributes, List<SpecItem> specs,
                                         Map<String, Integer> codes) {
        ProductRef ref = doUpsertProduct(attributes);
        if (!ref.created()) {
            int removed = specRepository.deleteByProductId(ref.id());
            log.debug("Removed {} previous spec(s) of product {}", removed, ref.id());
        }
        insertSpecs(ref.id(), specs, codes, LocalDateTime.now(clock));
        return ref;
    }

    private static void requireName(ProductAttributes attributes) {
        if (attributes.getName() == null || attributes.getName().isBlank()) {
            throw new IllegalArgumentException("Product name is required");
        }
    }

    /**
     * Category creation commits on its own connection, so codes are resolved before the caller's
     * transaction borrows one.
     */
    private Map<String, Integer> resolveCategories(List<SpecItem> specs) {
        Map<String, Integer> codes = new LinkedHashMap<>();
        for (SpecItem spec : specs) {
            codes.computeIfAbsent(spec.category(), name -> categoryRegistry.getOrCreate(name).code());
        }
        return codes;
    }

    private void insertSpecs(Long productId, List<SpecItem> specs, Map<String, Integer> codes, LocalDateTime now) {
        List<Spec> rows = new ArrayList<>(specs.size());
        for (SpecItem item : specs) {
            rows.add(Spec.builder()
                    .productId(productId)
                    .categoryCode(codes.get(item.category()))
                    .name(item.name())
                    .value(item.value())
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
        }
        specRepository.saveAll(rows);
    }

    private ReviewRef doUpsertReview(Long boardId, String type, String rawTitle, String body) {
        String title = rawTitle == null ? "" : rawTitle;
        LocalDateTime now = LocalDateTime.now(clock);
        Optional<Review> existing = reviewRepository.findByMasterProductIdAndTypeAndTitle(boardId, type, title);

        if (existing.isPresent()) {
            Review review = existing.get();
            if (Objects.equals(review.getBody(), body)) {
                return new ReviewRef(review.getId(), false, false);
            }
            review.setBody(body);
            review.setUpdatedAt(now);
            reviewRepository.save(review);
            log.info("Updated review {} ({}) of product {}", review.getId(), type, boardId);
            return new ReviewRef(review.getId(), false, true);
        }

        Review created = reviewRepository.saveAndFlush(Review.builder()
                .masterProductId(boardId)
                .type(type)
                .title(title)
                .body(body)
                .createdAt(now)
                .updatedAt(now)
                .build());
        log.info("Created review {} ({}) of product {}", created.getId(), type, boardId);
        return new ReviewRef(created.getId(), true, true);
    }

    private boolean doReplaceReviewData(Long reviewId, List<ReviewDataItem> items) {
        List<ReviewDataItem> current = reviewDatumRepository.findByReviewIdOrderByIdAsc(reviewId).stream()
                .map(d -> new ReviewDataItem(d.getDataType(), d.getKey(), d.getValue(), d.getUnit(), d.getProductName()))
                .toList();
        if (current.equals(items)) {
            return false;
        }
        reviewDatumRepository.deleteByReviewId(reviewId);
        List<ReviewDatum> rows = items.stream()
                .map(item -> ReviewDatum.builder()
                        .reviewId(reviewId)
                        .dataType(item.dataType())
                        .key(item.key())
                        .value(item.value())
                        .unit(item.unit())
                        .productName(item.productName())
                        .build())
                .toList();
        reviewDatumRepository.saveAll(rows);
        return true;
    }

    private void touchReview(Long reviewId) {
        reviewRepository.findById(reviewId).ifPresent(review -> {
            review.setUpdatedAt(LocalDateTime.now(clock));
            reviewRepository.save(review);
        });
    }

    private <R> R inTransaction(String unit, Supplier<R> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (StorageException e) {
            log.error("Rolled back {}: {}", unit, e.getMessage());
            throw e;
        } catch (DataAccessException | PersistenceException | TransactionException e) {
            log.error("Rolled back {}: {}", unit, e.getMessage());
            throw new StorageException(unit, e);
        }
    }
}
