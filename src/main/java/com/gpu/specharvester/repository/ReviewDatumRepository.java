package com.gpu.specharvester.repository;

import com.gpu.specharvester.entity.ReviewDatum;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ReviewDatumRepository extends JpaRepository<ReviewDatum, Long> {

    List<ReviewDatum> findByReviewIdOrderByIdAsc(Long reviewId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM ReviewDatum d WHERE d.reviewId = :reviewId")
    int deleteByReviewId(@Param("reviewId") Long reviewId);
}
