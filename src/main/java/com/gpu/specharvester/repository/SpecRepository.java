package com.gpu.specharvester.repository;

import com.gpu.specharvester.entity.Spec;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface SpecRepository extends JpaRepository<Spec, Long> {

    List<Spec> findByProductId(Long productId);

    long countByProductId(Long productId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM Spec s WHERE s.productId = :productId")
    int deleteByProductId(@Param("productId") Long productId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM Spec s WHERE s.productId = :productId AND s.categoryCode IN :codes")
    int deleteByProductIdAndCategoryCodes(@Param("productId") Long productId,
                                          @Param("codes") Collection<Integer> codes);
}
