package com.gpu.specharvester.repository;

import com.gpu.specharvester.dto.ReviewTarget;
import com.gpu.specharvester.entity.Review;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ReviewRepository extends JpaRepository<Review, Long> {

    Optional<Review> findByMasterProductIdAndTypeAndTitle(Long masterProductId, String type, String title);

    List<Review> findByMasterProductId(Long masterProductId);

    /**
     * Reviews that already carry a main URL, with the name of their product
     */
    @Query("SELECT new com.gpu.specharvester.dto.ReviewTarget(r.id, r.type, r.mainUrl, r.pageUrl, p.id, p.name, r.updatedAt) "
            + "FROM Review r, Product p WHERE r.masterProductId = p.id "
            + "AND r.mainUrl IS NOT NULL AND r.mainUrl <> '' ORDER BY r.id")
    List<ReviewTarget> findReviewTargets();
}
