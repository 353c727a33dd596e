package com.gpu.specharvester.service;

import com.gpu.specharvester.config.HarvesterProperties;
import com.gpu.specharvester.dto.BoardListing;
import com.gpu.specharvester.dto.ListingEntry;
import com.gpu.specharvester.dto.ProductAttributes;
import com.gpu.specharvester.dto.ProductDetail;
import com.gpu.specharvester.dto.ProductRef;
import com.gpu.specharvester.dto.ReviewContent;
import com.gpu.specharvester.dto.ReviewOption;
import com.gpu.specharvester.dto.ReviewRef;
import com.gpu.specharvester.dto.SpecItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Default harvest: catalog listing, product and board detail pages, then reviews.
 * <p>
 * Two queues feed two worker pools. Review tasks are only discovered while product tasks run,
 * so the review queue is joined strictly after the product queue has drained.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HarvestPipeline {

    private final PoliteFetcherFactory fetcherFactory;
    private final GpuPageParser parser;
    private final StorageReconciler storage;
    private final HarvesterProperties properties;

    record ReviewTask(Long boardId, String boardName, String reviewUrl) {
    }

    /**
     * Crawl the catalog, or only the GPU whose name equals {@code nameFilter} ignoring case
     */
    public void run(RunStatistics stats, String nameFilter) throws InterruptedException {
        PoliteFetcher fetcher = fetcherFactory.openSession();

        stats.phase("listing", 5);
        FetchResult listing = fetcher.fetch(properties.getListingPath(), FetchMode.SITE_RELATIVE);
        if (!listing.isSuccess()) {
            throw new IllegalStateException("Catalog listing unavailable: " + listing);
        }
        List<ListingEntry> entries = parser.parseProductList(listing.body().orElse(""));

        if (nameFilter != null && !nameFilter.isBlank()) {
            entries = selectByName(entries, nameFilter.trim());
            if (entries.isEmpty()) {
                stats.phase("done", 100);
                return;
            }
        }

        ProductNameCache nameCache = ProductNameCache.of(storage.loadProductNames());

        TaskQueue<ListingEntry> productQueue = new TaskQueue<>("products");
        TaskQueue<ReviewTask> reviewQueue = new TaskQueue<>("reviews");
        entries.forEach(productQueue::put);
        log.info("Queued {} product task(s)", entries.size());

        QueueWorkerPool<ListingEntry> productWorkers = new QueueWorkerPool<>(productQueue,
                properties.getProductWorkers(),
                entry -> processProduct(fetcher, nameCache, reviewQueue, stats, entry));
        QueueWorkerPool<ReviewTask> reviewWorkers = new QueueWorkerPool<>(reviewQueue,
                properties.getReviewWorkers(),
                task -> processReview(fetcher, stats, task));

        stats.phase("products", 10);
        productWorkers.start();
        reviewWorkers.start();
        try {
            productQueue.join();
            log.info("Product queue drained, {} review task(s) outstanding", reviewQueue.unfinished());
            stats.phase("reviews", 60);
            reviewQueue.join();
            log.info("Review queue drained");
        } finally {
            productWorkers.cancel();
            reviewWorkers.cancel();
        }

        stats.phase("done", 100);
        log.info("Harvest finished: {} products, {} boards, {} specs, {} reviews, {} errors, {} URLs fetched",
                stats.getProducts(), stats.getBoards(), stats.getSpecs(), stats.getReviews(), stats.getErrors(),
                fetcher.processedCount());
    }

    private List<ListingEntry> selectByName(List<ListingEntry> entries, String nameFilter) {
        List<ListingEntry> selected = entries.stream()
                .filter(entry -> entry.name().equalsIgnoreCase(nameFilter))
                .toList();
        if (selected.isEmpty()) {
            String needle = nameFilter.toLowerCase(Locale.ROOT);
            List<String> similar = entries.stream()
                    .map(ListingEntry::name)
                    .filter(name -> name.toLowerCase(Locale.ROOT).contains(needle))
                    .limit(10)
                    .toList();
            log.warn("GPU '{}' not found in listing. Similar names: {}", nameFilter, similar);
        } else {
            log.info("Selected {} listing entr(ies) for GPU '{}'", selected.size(), nameFilter);
        }
        return selected;
    }

    void processProduct(PoliteFetcher fetcher, ProductNameCache nameCache, TaskQueue<ReviewTask> reviewQueue,
                        RunStatistics stats, ListingEntry entry) {
        if (nameCache.contains(entry.name())) {
            log.info("Skipping known product: {}", entry.name());
            return;
        }

        Optional<String> page = fetchBody(fetcher, entry.url(), stats);
        if (page.isEmpty()) {
            return;
        }
        Optional<ProductDetail> detail = parser.parseProductDetail(page.get(), entry.url());
        if (detail.isEmpty()) {
            log.warn("No product data extracted from {}", entry.url());
            stats.error();
            return;
        }

        ProductRef product;
        try {
            product = storage.upsertProductWithSpecs(detail.get().attributes(), detail.get().specs());
        } catch (StorageException e) {
            log.error("Could not store product {}: {}", entry.name(), e.getMessage());
            stats.error();
            return;
        }
        nameCache.register(product.name(), product.id());
        stats.productStored(detail.get().specs().size());

        for (BoardListing board : parser.parseBoards(page.get())) {
            try {
                ProductRef boardRef = storeBoard(fetcher, product, board, stats);
                nameCache.register(boardRef.name(), boardRef.id());
                if (board.hasReview()) {
                    reviewQueue.put(new ReviewTask(boardRef.id(), boardRef.name(), board.reviewUrl()));
                }
            } catch (StorageException e) {
                log.error("Could not store board {} of {}: {}", board.name(), product.name(), e.getMessage());
                stats.error();
            }
        }
    }

    private ProductRef storeBoard(PoliteFetcher fetcher, ProductRef parent, BoardListing board, RunStatistics stats) {
        ProductAttributes attributes = ProductAttributes.builder()
                .name(board.name())
                .vendor(parser.extractVendor(board.name()))
                .build();
        List<SpecItem> specs = List.of();

        if (board.hasDetailPage()) {
            Optional<ProductDetail> detail = fetchBody(fetcher, board.url(), stats)
                    .flatMap(html -> parser.parseProductDetail(html, board.url()));
            if (detail.isPresent()) {
                ProductAttributes found = detail.get().attributes();
                attributes.setDescription(found.getDescription());
                attributes.setImageUrl(found.getImageUrl());
                specs = detail.get().specs();
            }
        }
        if (specs.isEmpty()) {
            specs = columnSpecs(board);
        }

        ProductRef ref = storage.storeBoard(parent.id(), attributes, specs);
        stats.boardStored(specs.size() + 1);
        log.info("Stored board {} (ID: {}) under {} (ID: {})", ref.name(), ref.id(), parent.name(), parent.id());
        return ref;
    }

    private List<SpecItem> columnSpecs(BoardListing board) {
        List<SpecItem> specs = new ArrayList<>();
        for (Map.Entry<String, String> column : board.columns().entrySet()) {
            if (!column.getKey().equalsIgnoreCase("Name")) {
                specs.add(new SpecItem(properties.getBoardCategory(), column.getKey(), column.getValue()));
            }
        }
        return specs;
    }

    void processReview(PoliteFetcher fetcher, RunStatistics stats, ReviewTask task) {
        Optional<String> mainPage = fetchBody(fetcher, task.reviewUrl(), stats);
        if (mainPage.isEmpty()) {
            return;
        }
        List<ReviewOption> options = parser.parseReviewOptions(mainPage.get());
        if (options.isEmpty()) {
            log.info("No review pages of interest for {} at {}", task.boardName(), task.reviewUrl());
            return;
        }

        for (ReviewOption option : options) {
            Optional<ReviewContent> content = fetchBody(fetcher, option.value(), stats)
                    .flatMap(html -> parser.parseReviewContent(html, option.text()));
            if (content.isEmpty()) {
                log.warn("No review content for '{}' of {}", option.text(), task.boardName());
                continue;
            }
            try {
                ReviewContent review = content.get();
                ReviewRef ref = storage.storeReview(task.boardId(), option.text(), review.title(), review.body(),
                        review.data());
                int specCount = storage.replaceSpecCategories(task.boardId(), review.specs());
                stats.reviewStored(specCount);
                log.info("Stored review '{}' (ID: {}, changed: {}, specs: {}) of {}",
                        option.text(), ref.id(), ref.changed(), specCount, task.boardName());
            } catch (StorageException e) {
                log.error("Could not store review '{}' of {}: {}", option.text(), task.boardName(), e.getMessage());
                stats.error();
            }
        }
    }

    /**
     * Fetch with dedup. Duplicates are skipped silently, exhausted URLs count as errors.
     */
    private Optional<String> fetchBody(PoliteFetcher fetcher, String url, RunStatistics stats) {
        FetchResult result = fetcher.fetch(url, FetchMode.SITE_RELATIVE);
        if (result.status() == FetchResult.Status.EXHAUSTED) {
            log.error("Giving up on {} after {} attempt(s)", result.url(), result.attempts());
            stats.error();
        }
        return result.body();
    }
}
