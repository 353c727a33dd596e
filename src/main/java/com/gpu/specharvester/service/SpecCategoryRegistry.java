package com.gpu.specharvester.service;

import com.gpu.specharvester.config.HarvesterProperties;
import com.gpu.specharvester.dto.CategoryRef;
import com.gpu.specharvester.entity.SpecCategory;
import com.gpu.specharvester.repository.SpecCategoryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Get-or-create for spec categories.
 * <p>
 * New codes are {@code max(code) + 1} within the domain tag. Creation is serialized by a
 * process-wide lock and committed in its own transaction before the lock is released, so a second
 * writer always sees the first writer's row. Unique constraints on (domain tag, name) and
 * (domain tag, code) catch writers from other processes; a conflict is retried by re-reading.
 */
@Component
@Slf4j
public class SpecCategoryRegistry {

    private static final int MAX_ATTEMPTS = 3;

    private final SpecCategoryRepository categoryRepository;
    private final HarvesterProperties properties;
    private final Clock clock;
    private final TransactionTemplate requiresNew;
    private final ReentrantLock createLock = new ReentrantLock();
    private final Map<String, CategoryRef> cache = new ConcurrentHashMap<>();

    public SpecCategoryRegistry(SpecCategoryRepository categoryRepository,
                                HarvesterProperties properties,
                                Clock clock,
                                PlatformTransactionManager transactionManager) {
        this.categoryRepository = categoryRepository;
        this.properties = properties;
        this.clock = clock;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public CategoryRef getOrCreate(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Category name is required");
        }
        CategoryRef cached = cache.get(name);
        if (cached != null) {
            return cached;
        }

        createLock.lock();
        try {
            cached = cache.get(name);
            if (cached != null) {
                return cached;
            }
            for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
                try {
                    CategoryRef ref = requiresNew.execute(status -> findOrInsert(name));
                    cache.put(name, ref);
                    return ref;
                } catch (DataIntegrityViolationException e) {
                    log.warn("Category '{}' conflicted with a concurrent writer (attempt {}/{}), re-reading",
                            name, attempt, MAX_ATTEMPTS);
                } catch (DataAccessException | TransactionException e) {
                    throw new StorageException("category " + name, e);
                }
            }
            throw new StorageException("category " + name, "code assignment kept conflicting");
        } finally {
            createLock.unlock();
        }
    }

    /**
     * Forget cached codes, used when a run starts
     */
    public void reset() {
        cache.clear();
    }

    private CategoryRef findOrInsert(String name) {
        String domainTag = properties.getSpecDomainTag();
        return categoryRepository.findByDomainTagAndName(domainTag, name)
                .map(this::toRef)
                .orElseGet(() -> {
                    int next = categoryRepository.findMaxCode(domainTag).orElse(0) + 1;
                    SpecCategory created = categoryRepository.saveAndFlush(SpecCategory.builder()
                            .domainTag(domainTag)
                            .code(next)
                            .name(name)
                            .createdAt(LocalDateTime.now(clock))
                            .build());
                    log.info("Created spec category: {} (code: {})", name, next);
                    return toRef(created);
                });
    }

    private CategoryRef toRef(SpecCategory category) {
        return new CategoryRef(category.getId(), category.getCode(), category.getName());
    }
}
