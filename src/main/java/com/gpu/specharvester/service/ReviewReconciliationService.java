package com.gpu.specharvester.service;

import com.gpu.specharvester.config.HarvesterProperties;
import com.gpu.specharvester.dto.BoardListing;
import com.gpu.specharvester.dto.ListingEntry;
import com.gpu.specharvester.dto.ReviewContent;
import com.gpu.specharvester.dto.ReviewOption;
import com.gpu.specharvester.dto.ReviewTarget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Re-fetches stored reviews and rewrites their content.
 * <p>
 * Both modes walk the same phases: discovery of review main URLs from the catalog, resolution of each
 * review's sub-page through the main page's option list, then evaluation and update. A full update
 * rewrites every review it can resolve; an incremental update only rewrites reviews whose page was
 * posted on a later day than their last update.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReviewReconciliationService {

    private final PoliteFetcherFactory fetcherFactory;
    private final GpuPageParser parser;
    private final StorageReconciler storage;
    private final ReviewTypeMatcher typeMatcher;
    private final ReviewFreshnessPolicy freshnessPolicy;
    private final HarvesterProperties properties;

    /**
     * @return number of reviews written
     */
    public int fullUpdate(RunStatistics stats) throws InterruptedException {
        return reconcile(stats, true);
    }

    /**
     * @return number of reviews written
     */
    public int incrementalUpdate(RunStatistics stats) throws InterruptedException {
        return reconcile(stats, false);
    }

    private int reconcile(RunStatistics stats, boolean full) throws InterruptedException {
        String mode = full ? "full" : "incremental";
        PoliteFetcher fetcher = fetcherFactory.openSession();
        PageCache pages = new PageCache(fetcher);

        stats.phase(mode + " update: discovering review URLs", 10);
        int assigned = discoverReviewUrls(fetcher, stats);
        log.info("Discovery recorded {} review URL(s)", assigned);

        stats.phase(mode + " update: resolving review pages", 20);
        resolveSubPages(fetcher, pages, stats);

        List<ReviewTarget> targets = storage.findReviewTargets();
        stats.phase(mode + " update: updating reviews", 30);
        log.info("Evaluating {} review(s) in {} mode", targets.size(), mode);

        int written = 0;
        int skipped = 0;
        for (int i = 0; i < targets.size(); i++) {
            checkInterrupted();
            ReviewTarget target = targets.get(i);

            if (!full && !isStale(target, pages)) {
                skipped++;
            } else if (updateReview(target, pages, stats)) {
                written++;
            }
            stats.phase(mode + " update: updating reviews", 30 + (55 * (i + 1)) / targets.size());
        }

        stats.phase(mode + " update: done", 100);
        log.info("{} update finished: {} review(s) written, {} up to date, {} page(s) cached",
                mode, written, skipped, pages.size());
        return written;
    }

    /**
     * Walk the listing and the pages of already stored products, recording each board's review link on its
     * stored reviews
     */
    int discoverReviewUrls(PoliteFetcher fetcher, RunStatistics stats) throws InterruptedException {
        Optional<String> listing = fetcher.fetch(properties.getListingPath(), FetchMode.REFRESH).body();
        if (listing.isEmpty()) {
            throw new IllegalStateException("Catalog listing unavailable for review discovery");
        }

        ProductNameCache known = ProductNameCache.of(storage.loadProductNames());
        int assigned = 0;
        for (ListingEntry entry : parser.parseProductList(listing.get())) {
            checkInterrupted();
            if (!known.contains(entry.name())) {
                log.debug("Skipping review discovery for unknown product {}", entry.name());
                continue;
            }
            FetchResult detail = fetcher.fetch(entry.url(), FetchMode.REFRESH);
            if (!detail.isSuccess()) {
                log.warn("Skipping review discovery for {}: {}", entry.name(), detail);
                stats.error();
                continue;
            }
            for (BoardListing board : parser.parseBoards(detail.body().orElse(""))) {
                if (!board.hasReview()) {
                    continue;
                }
                try {
                    assigned += storage.assignMainUrl(board.name(), fetcher.resolve(board.reviewUrl()));
                } catch (StorageException e) {
                    log.error("Could not record review URL of {}: {}", board.name(), e.getMessage());
                    stats.error();
                }
            }
        }
        return assigned;
    }

    /**
     * Fetch each distinct main URL once, match its options against the review types stored for it,
     * record the matching sub-page URL and cache that page for the update phase
     */
    void resolveSubPages(PoliteFetcher fetcher, PageCache pages, RunStatistics stats) throws InterruptedException {
        Map<String, List<ReviewTarget>> byMainUrl = new LinkedHashMap<>();
        for (ReviewTarget target : storage.findReviewTargets()) {
            byMainUrl.computeIfAbsent(target.mainUrl(), url -> new ArrayList<>()).add(target);
        }
        log.info("Resolving sub-pages of {} review main page(s)", byMainUrl.size());

        for (Map.Entry<String, List<ReviewTarget>> group : byMainUrl.entrySet()) {
            checkInterrupted();
            Optional<String> mainPage = pages.get(group.getKey());
            if (mainPage.isEmpty()) {
                stats.error();
                continue;
            }
            List<ReviewOption> options = parser.parseReviewOptions(mainPage.get());

            for (ReviewTarget target : group.getValue()) {
                Optional<ReviewOption> match = options.stream()
                        .filter(option -> typeMatcher.matches(target.type(), option.text()))
                        .findFirst();
                if (match.isEmpty()) {
                    log.debug("No sub-page matches review {} ({})", target.reviewId(), target.type());
                    continue;
                }
                String pageUrl = fetcher.resolve(match.get().value());
                try {
                    storage.assignPageUrl(target.reviewId(), pageUrl);
                } catch (StorageException e) {
                    log.error("Could not record page URL of review {}: {}", target.reviewId(), e.getMessage());
                    stats.error();
                    continue;
                }
                pages.prefetch(pageUrl);
            }
        }
    }

    private boolean isStale(ReviewTarget target, PageCache pages) {
        if (target.updatedAt() == null) {
            return true;
        }
        Optional<LocalDate> posted = pages.get(target.mainUrl()).flatMap(parser::parsePostedDate);
        if (posted.isEmpty()) {
            log.info("No posted date on {}, keeping review {}", target.mainUrl(), target.reviewId());
            return false;
        }
        boolean stale = freshnessPolicy.needsUpdate(target.updatedAt(), posted.get());
        log.debug("Review {} updated {}, posted {}: {}", target.reviewId(), target.updatedAt(), posted.get(),
                stale ? "update" : "skip");
        return stale;
    }

    private boolean updateReview(ReviewTarget target, PageCache pages, RunStatistics stats) {
        String url = target.pageUrl() != null && !target.pageUrl().isBlank() ? target.pageUrl() : target.mainUrl();
        Optional<ReviewContent> content = pages.get(url)
                .flatMap(html -> parser.parseReviewContent(html, target.type()));
        if (content.isEmpty()) {
            log.warn("No review content for review {} ({}) at {}", target.reviewId(), target.type(), url);
            stats.error();
            return false;
        }

        try {
            boolean changed = storage.replaceReviewContent(target.reviewId(), content.get().body(),
                    content.get().data());
            int specCount = storage.replaceSpecCategories(target.productId(), content.get().specs());
            stats.reviewUpdated(specCount);
            log.info("Rewrote review {} ({}) of {}: content changed {}, {} spec(s)",
                    target.reviewId(), target.type(), target.productName(), changed, specCount);
            return true;
        } catch (StorageException e) {
            log.error("Could not update review {} of {}: {}", target.reviewId(), target.productName(), e.getMessage());
            stats.error();
            return false;
        }
    }

    private static void checkInterrupted() throws InterruptedException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedException("Review reconciliation cancelled");
        }
    }
}
