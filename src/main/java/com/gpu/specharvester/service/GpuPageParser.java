package com.gpu.specharvester.service;

import com.gpu.specharvester.dto.BoardListing;
import com.gpu.specharvester.dto.ListingEntry;
import com.gpu.specharvester.dto.ProductDetail;
import com.gpu.specharvester.dto.ReviewContent;
import com.gpu.specharvester.dto.ReviewOption;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Turns catalog page markup into structured records. An empty result means the page held nothing
 * usable; callers skip that unit of work.
 */
public interface GpuPageParser {

    List<ListingEntry> parseProductList(String html);

    Optional<ProductDetail> parseProductDetail(String html, String url);

    List<BoardListing> parseBoards(String html);

    List<ReviewOption> parseReviewOptions(String html);

    Optional<ReviewContent> parseReviewContent(String html, String reviewType);

    Optional<LocalDate> parsePostedDate(String html);

    String extractVendor(String productName);
}
