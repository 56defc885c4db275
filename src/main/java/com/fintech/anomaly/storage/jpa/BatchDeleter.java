package com.fintech.anomaly.storage.jpa;

import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Deletes rows in bounded batches, one short transaction per batch, so a large
 * eviction never holds row locks across the whole sweep.
 */
final class BatchDeleter {

    private final TransactionTemplate transactionTemplate;
    private final int batchSize;

    BatchDeleter(TransactionTemplate transactionTemplate, int batchSize) {
        this.transactionTemplate = transactionTemplate;
        this.batchSize = batchSize;
    }

    /**
     * Repeatedly selects the first page of ids and deletes it until the selector returns nothing.
     * The selector must stop matching rows once they are deleted.
     */
    long deleteAll(Function<Pageable, List<String>> idSelector, Consumer<List<String>> deleter) {
        return deleteUpTo(Long.MAX_VALUE, idSelector, deleter);
    }

    /**
     * Same as {@link #deleteAll} but stops after {@code maxRows} deletions.
     */
    long deleteUpTo(long maxRows, Function<Pageable, List<String>> idSelector, Consumer<List<String>> deleter) {
        long total = 0;
        while (total < maxRows) {
            int size = (int) Math.min(batchSize, maxRows - total);
            Integer deleted = transactionTemplate.execute(status -> {
                List<String> ids = idSelector.apply(PageRequest.of(0, size));
                if (ids.isEmpty()) {
                    return 0;
                }
                deleter.accept(ids);
                return ids.size();
            });
            if (deleted == null || deleted == 0) {
                break;
            }
            total += deleted;
            if (deleted < size) {
                break;
            }
        }
        return total;
    }
}
