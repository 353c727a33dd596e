package com.gpu.specharvester.repository;

import com.gpu.specharvester.dto.ProductNameRow;
import com.gpu.specharvester.entity.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ProductRepository extends JpaRepository<Product, Long> {

    Optional<Product> findByName(String name);

    /**
     * Loose board lookup: first product whose name contains the given fragment
     */
    Optional<Product> findFirstByNameContainingOrderByIdAsc(String fragment);

    @Query("SELECT new com.gpu.specharvester.dto.ProductNameRow(p.id, p.name) FROM Product p")
    List<ProductNameRow> findAllNames();
}
