package com.gpu.specharvester.repository;

import com.gpu.specharvester.entity.SpecCategory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface SpecCategoryRepository extends JpaRepository<SpecCategory, Long> {

    Optional<SpecCategory> findByDomainTagAndName(String domainTag, String name);

    @Query("SELECT MAX(c.code) FROM SpecCategory c WHERE c.domainTag = :domainTag")
    Optional<Integer> findMaxCode(@Param("domainTag") String domainTag);

    long countByDomainTagAndName(String domainTag, String name);
}
