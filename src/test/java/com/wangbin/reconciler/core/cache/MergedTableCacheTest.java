package com.wangbin.reconciler.core.cache;

import com.wangbin.reconciler.common.exception.ReconcileException;
import com.wangbin.reconciler.core.config.ReconcilerProperties.CacheConfig;
import com.wangbin.reconciler.core.merge.MergeScope;
import com.wangbin.reconciler.core.table.RowSet;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static com.wangbin.reconciler.core.table.TestRows.row;
import static com.wangbin.reconciler.core.table.TestRows.table;
import static org.junit.jupiter.api.Assertions.*;

class MergedTableCacheTest {

    @TempDir
    Path dir;

    private RowSet merged() {
        return table(
                row("RTU", "AREC", "Sub", "AREC", "NumControls", 2L, "Percent", 50.0, "Ignore", false, "Note", null),
                row("RTU", "ANDE3", "Sub", "ANDE", "NumControls", 0L, "Percent", null, "Ignore", true, "Note", ""));
    }

    @Test
    void fileRoundTripKeepsTypes() {
        Path file = dir.resolve("cache/merged.json");
        new MergedTableCache(file, new CacheConfig()).put(MergeScope.all(), merged());

        Optional<RowSet> restored = new MergedTableCache(file, new CacheConfig()).get(MergeScope.all());

        assertTrue(restored.isPresent());
        assertEquals(merged(), restored.get());
        assertEquals(2L, restored.get().row(0).get("NumControls"));
        assertNull(restored.get().row(0).get("Note"));
        assertEquals("", restored.get().row(1).get("Note"));
    }

    @Test
    void fullTableServesNarrowerScopes() {
        Path file = dir.resolve("merged.json");
        new MergedTableCache(file, new CacheConfig()).put(MergeScope.all(), merged());
        MergedTableCache cache = new MergedTableCache(file, new CacheConfig());

        assertEquals(1, cache.get(MergeScope.rtu("AREC")).orElseThrow().size());
        assertEquals("ANDE3", cache.get(MergeScope.substation("ANDE")).orElseThrow().row(0).get("RTU"));
    }

    @Test
    void narrowTableCannotServeOtherScopes() {
        Path file = dir.resolve("merged.json");
        RowSet arec = merged().filter(MergeScope.rtu("AREC")::matches);
        new MergedTableCache(file, new CacheConfig()).put(MergeScope.rtu("AREC"), arec);
        MergedTableCache cache = new MergedTableCache(file, new CacheConfig());

        assertTrue(cache.get(MergeScope.rtu("AREC")).isPresent());
        assertTrue(cache.get(MergeScope.rtu("ANDE3")).isEmpty());
        assertTrue(cache.get(MergeScope.all()).isEmpty());
    }

    @Test
    void corruptFileIsAMiss() throws IOException {
        Path file = dir.resolve("merged.json");
        Files.writeString(file, "{not json");

        assertTrue(new MergedTableCache(file, new CacheConfig()).get(MergeScope.all()).isEmpty());
    }

    @Test
    void invalidateRemovesFile() {
        Path file = dir.resolve("merged.json");
        MergedTableCache cache = new MergedTableCache(file, new CacheConfig());
        cache.put(MergeScope.all(), merged());

        cache.invalidate();

        assertFalse(Files.exists(file));
        assertTrue(cache.get(MergeScope.all()).isEmpty());
    }

    @Test
    void unwritableLocationIsFatal() throws IOException {
        Path blocker = dir.resolve("blocker");
        Files.writeString(blocker, "x");
        MergedTableCache cache = new MergedTableCache(blocker.resolve("merged.json"), new CacheConfig());

        assertThrows(ReconcileException.class, () -> cache.put(MergeScope.all(), table(row("a", 1L))));
    }

    @Test
    void localHitsAreCounted() {
        MergedTableCache cache = new MergedTableCache(dir.resolve("merged.json"), new CacheConfig());
        cache.put(MergeScope.all(), merged());

        cache.get(MergeScope.all());
        cache.get(MergeScope.rtu("AREC"));

        assertTrue(cache.getStatsSummary().contains("hitCount=1"));
        assertTrue(cache.getStatsSummary().contains("missCount=1"));
    }
}
