package com.flagship.stream_ledger.registry;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CategoryIndexRepository extends JpaRepository<CategoryIndexEntity, UUID> {

    long countByCategory(String category);

    List<CategoryIndexEntity> findByCategoryOrderByEntryOrderAsc(String category);

    @Query("SELECT DISTINCT c.category FROM CategoryIndexEntity c ORDER BY c.category")
    List<String> findAllCategories();
}
