package com.williamcallahan.steam_analytics.service;

import com.williamcallahan.steam_analytics.dto.LoadStats;
import com.williamcallahan.steam_analytics.dto.RecordFailure;
import com.williamcallahan.steam_analytics.dto.TableLoadStats;
import com.williamcallahan.steam_analytics.model.FactRow;
import com.williamcallahan.steam_analytics.model.GameTagLink;
import com.williamcallahan.steam_analytics.model.MergedEntitySet;
import com.williamcallahan.steam_analytics.repository.DestinationStore;
import com.williamcallahan.steam_analytics.service.source.CancellationToken;
import com.williamcallahan.steam_analytics.service.source.PipelineCancelledException;
import com.williamcallahan.steam_analytics.types.LoadTable;
import com.williamcallahan.steam_analytics.types.WriteOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Writes a merged entity set in dependency order: genres and tags, then games, then facts,
 * then game-tag bridges. Each table group finishes before the next one starts.
 * <p>
 * The whole load shares one transaction and every record runs in its own savepoint, so a
 * constraint violation is recorded against that record while the rest of the group continues.
 * A cancellation rolls the whole load back.
 */
@Slf4j
@Service
public class StarSchemaLoader {

    private final DestinationStore store;
    private final TransactionOperations loadTransaction;
    private final TransactionOperations recordTransaction;

    public StarSchemaLoader(DestinationStore store,
                            @Qualifier("loadTransactionTemplate") TransactionOperations loadTransaction,
                            @Qualifier("recordTransactionTemplate") TransactionOperations recordTransaction) {
        this.store = store;
        this.loadTransaction = loadTransaction;
        this.recordTransaction = recordTransaction;
    }

    /**
     * @throws PipelineCancelledException when the token fires mid-load; nothing is committed
     */
    public LoadStats load(MergedEntitySet merged, CancellationToken token) {
        LoadStats stats = loadTransaction.execute(status -> {
            Map<LoadTable, TableLoadStats> tables = new EnumMap<>(LoadTable.class);
            tables.put(LoadTable.GENRE, writeGroup(LoadTable.GENRE, merged.genres(), name -> name, store::upsertGenre, token));
            tables.put(LoadTable.TAG, writeGroup(LoadTable.TAG, merged.tags(), name -> name, store::upsertTag, token));
            tables.put(LoadTable.GAME, writeGroup(LoadTable.GAME, merged.games(), game -> Long.toString(game.appId()), store::upsertGame, token));
            tables.put(LoadTable.FACT, writeGroup(LoadTable.FACT, merged.facts(), FactRow::naturalKey, store::upsertFact, token));
            tables.put(LoadTable.BRIDGE, writeGroup(LoadTable.BRIDGE, merged.bridges(), GameTagLink::naturalKey, store::upsertBridge, token));
            return new LoadStats(tables);
        });
        return stats == null ? LoadStats.NONE : stats;
    }

    private <T> TableLoadStats writeGroup(LoadTable table,
                                          List<T> records,
                                          Function<T, String> naturalKey,
                                          Function<T, WriteOutcome> writer,
                                          CancellationToken token) {
        token.throwIfCancelled();
        int inserted = 0;
        int updated = 0;
        int unchanged = 0;
        List<RecordFailure> failures = new ArrayList<>();

        for (T record : records) {
            token.throwIfCancelled();
            try {
                WriteOutcome outcome = recordTransaction.execute(status -> writer.apply(record));
                if (outcome == WriteOutcome.INSERTED) {
                    inserted++;
                } else if (outcome == WriteOutcome.UPDATED) {
                    updated++;
                } else {
                    unchanged++;
                }
            } catch (DataAccessException e) {
                String key = naturalKey.apply(record);
                String reason = NestedExceptionUtils.getMostSpecificCause(e).getMessage();
                log.warn("Failed to write {} row {}: {}", table.getTableName(), key, reason);
                failures.add(new RecordFailure(key, reason));
            }
        }

        TableLoadStats stats = new TableLoadStats(table, inserted, updated, unchanged, failures.size(), failures);
        log.info("Loaded {}: inserted={} updated={} unchanged={} failed={}",
            table.getTableName(), inserted, updated, unchanged, failures.size());
        return stats;
    }
}
