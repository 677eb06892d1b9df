package com.di.bugsummary.summary.store;

import com.di.bugsummary.config.BugSummaryProperties;
import com.di.bugsummary.exception.SummaryCorruptionException;
import com.di.bugsummary.sql.SqlQueriesProperties;
import com.di.bugsummary.summary.SummaryFixture;
import com.di.bugsummary.summary.access.JdbcAccessViewerSet;
import com.di.bugsummary.summary.counter.BugSummaryCounter;
import com.di.bugsummary.summary.fanout.BugSummaryFanOut;
import com.di.bugsummary.summary.journal.JdbcBugSummaryJournal;
import com.di.bugsummary.summary.journal.JournalEntry;
import com.di.bugsummary.summary.model.BugSummaryDelta;
import com.di.bugsummary.summary.model.BugSummaryDimension;
import com.di.bugsummary.summary.model.BugSummaryKey;
import com.di.bugsummary.summary.model.BugTarget;
import com.di.bugsummary.summary.model.BugTaskFact;
import com.di.bugsummary.summary.model.BugTaskImportance;
import com.di.bugsummary.summary.model.BugTaskStatus;
import com.di.bugsummary.summary.model.Viewer;
import com.di.bugsummary.summary.rollup.BugSummaryRollup;
import com.di.bugsummary.summary.rollup.RollupResult;
import com.di.bugsummary.summary.view.BugSummaryContexts;
import com.di.bugsummary.summary.view.BugSummaryCount;
import com.di.bugsummary.summary.view.BugSummaryFilter;
import com.di.bugsummary.summary.view.BugSummaryQueryService;
import com.di.bugsummary.summary.view.CombinedSummaryRow;
import com.di.bugsummary.summary.view.JdbcCombinedBugSummaryView;
import com.di.bugsummary.summary.view.TagCount;
import com.di.bugsummary.util.BugSummaryMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.env.StandardEnvironment;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.util.List;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JDBC stores, journal, combined view and rollup against H2 in PostgreSQL mode, using the
 * production schema and sql-queries.yml.
 */
@DisplayName("JDBC Bug Summary Store Tests")
class JdbcBugSummaryStoreTest {

    private JdbcTemplate jdbc;
    private SqlQueriesProperties sql;
    private TransactionTemplate requiredTx;
    private TransactionTemplate nestedTx;
    private SimpleMeterRegistry registry;
    private BugSummaryMetrics metrics;
    private JdbcBugSummaryStore store;
    private JdbcBugSummaryJournal journal;

    @BeforeEach
    void setUp() throws IOException {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:bugsummary-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1", "sa", "");
        new ResourceDatabasePopulator(new ClassPathResource("schema/bugsummary-schema.sql")).execute(dataSource);

        jdbc = new JdbcTemplate(dataSource);
        sql = loadSqlQueries();
        DataSourceTransactionManager tm = new DataSourceTransactionManager(dataSource);
        requiredTx = new TransactionTemplate(tm);
        nestedTx = new TransactionTemplate(tm);
        nestedTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);

        registry = new SimpleMeterRegistry();
        metrics = new BugSummaryMetrics(registry);
        store = new JdbcBugSummaryStore(jdbc, sql, nestedTx);
        journal = new JdbcBugSummaryJournal(jdbc, sql);
    }

    private static SqlQueriesProperties loadSqlQueries() throws IOException {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                .load("sql-queries", new ClassPathResource("sql-queries.yml"));
        StandardEnvironment environment = new StandardEnvironment();
        sources.forEach(environment.getPropertySources()::addFirst);
        return Binder.get(environment).bind("bugsummary.sql", SqlQueriesProperties.class).get();
    }

    private static BugSummaryKey key(String tag) {
        return BugSummaryKey.builder()
                .target(BugTarget.sourcePackage(3, 50))
                .tag(tag)
                .status(BugTaskStatus.NEW)
                .importance(BugTaskImportance.MEDIUM)
                .build();
    }

    private BugSummaryRollup rollup(BugSummaryStore s) {
        BugSummaryCounter counter = new BugSummaryCounter(s, metrics, new BugSummaryProperties());
        return new BugSummaryRollup(journal, s, counter, metrics, requiredTx, nestedTx);
    }

    // ============================================================================
    // Aggregate rows
    // ============================================================================

    @Test
    @DisplayName("Should update no row before the bucket exists and one row after")
    void testIncrementAndInsert() {
        assertEquals(0, store.increment(key("ui"), 1));
        store.insert(key("ui"), 1);
        assertEquals(1, store.increment(key("ui"), 2));
        assertEquals(OptionalInt.of(3), store.findCount(key("ui")));
    }

    @Test
    @DisplayName("Should match NULL dimensions to NULL columns only")
    void testNullAwareKeys() {
        store.insert(key(null), 4);
        store.insert(key("ui"), 1);
        store.insert(key(null).withViewer(Viewer.policy(9)), 2);

        assertEquals(OptionalInt.of(4), store.findCount(key(null)));
        assertEquals(OptionalInt.of(1), store.findCount(key("ui")));
        assertEquals(OptionalInt.of(2), store.findCount(key(null).withViewer(Viewer.policy(9))));
        assertEquals(1, store.increment(key(null), 1));
        assertEquals(OptionalInt.of(2), store.findCount(key(null).withViewer(Viewer.policy(9))));
    }

    @Test
    @DisplayName("Should refuse a second row for the same key, NULL dimensions included")
    void testInsert_Duplicate() {
        store.insert(key(null), 1);
        assertThrows(DuplicateKeyException.class, () -> store.insert(key(null), 1));
        assertEquals(OptionalInt.of(1), store.findCount(key(null)));
    }

    @Test
    @DisplayName("Should delete a row only when its count is zero")
    void testDeleteIfZero() {
        store.insert(key("ui"), 1);
        assertEquals(0, store.deleteIfZero(key("ui")));
        store.increment(key("ui"), -1);
        assertEquals(1, store.deleteIfZero(key("ui")));
        assertTrue(store.findCount(key("ui")).isEmpty());
    }

    @Test
    @DisplayName("Should bind and read back package type and channel")
    void testPackageAxes() {
        BugSummaryKey typed = key("ui").withTarget(BugTarget.sourcePackage(3, 50).withPackage(1, null));
        BugSummaryKey stable = key("ui").withTarget(BugTarget.sourcePackage(3, 50).withPackage(1, "[\"stable\"]"));
        store.insert(key("ui"), 1);
        store.insert(typed, 2);
        store.insert(stable, 3);
        journal.append(List.of(BugSummaryDelta.plus(stable)));

        assertEquals(OptionalInt.of(1), store.findCount(key("ui")));
        assertEquals(OptionalInt.of(2), store.findCount(typed));
        assertEquals(OptionalInt.of(3), store.findCount(stable));
        assertEquals(Set.of(key("ui"), typed, stable),
                Set.copyOf(store.findAll(BugSummaryFilter.ALL).stream().map(BugSummaryRow::key).toList()));
        assertEquals(stable, journal.findAll(BugSummaryFilter.ALL).get(0).key());
    }

    @Test
    @DisplayName("Should turn an integer overflow into a corruption failure")
    void testIncrement_Overflow() {
        store.insert(key("ui"), Integer.MAX_VALUE);
        assertThrows(SummaryCorruptionException.class, () -> store.increment(key("ui"), 1));
        assertEquals(OptionalInt.of(Integer.MAX_VALUE), store.findCount(key("ui")));
    }

    @Test
    @DisplayName("Should read rows back with their full key and list non-positive ones")
    void testFindAllAndNonPositive() {
        BugSummaryKey full = key("ui").toBuilder().milestone(8L).hasPatch(true)
                .viewedBy(500L).build();
        store.insert(full, 2);
        store.insert(key("crash"), -1);

        List<BugSummaryRow> rows = store.findAll(BugSummaryFilter.builder().visibleTo(500).build());
        assertEquals(2, rows.size());
        assertEquals(full, rows.get(0).key());
        assertEquals(2, rows.get(0).count());

        List<BugSummaryRow> bad = store.findNonPositive();
        assertEquals(1, bad.size());
        assertEquals(key("crash"), bad.get(0).key());
    }

    @Test
    @DisplayName("Should take the rollup lock inside a transaction")
    void testLockForRollup() {
        assertDoesNotThrow(() -> requiredTx.executeWithoutResult(status -> store.lockForRollup()));
    }

    // ============================================================================
    // Journal
    // ============================================================================

    @Test
    @DisplayName("Should append netted entries and bound the high-water mark by batch size")
    void testJournal() {
        assertTrue(journal.highWaterMark(null).isEmpty());
        assertEquals(2, journal.append(List.of(
                BugSummaryDelta.plus(key("a")), BugSummaryDelta.plus(key("b")),
                BugSummaryDelta.plus(key("c")), BugSummaryDelta.minus(key("c")))));
        journal.append(List.of(new BugSummaryDelta(key("a"), -3)));
        assertEquals(3, journal.size());

        OptionalLong all = journal.highWaterMark(null);
        OptionalLong two = journal.highWaterMark(2);
        assertTrue(two.getAsLong() < all.getAsLong());

        List<JournalEntry> firstTwo = journal.readUpTo(two.getAsLong());
        assertEquals(2, firstTwo.size());
        assertEquals(key("a"), firstTwo.get(0).key());
        assertEquals(1, firstTwo.get(0).delta());

        assertEquals(2, journal.delete(firstTwo.stream().map(JournalEntry::id).toList()));
        assertEquals(1, journal.size());
        assertEquals(-3, journal.findAll(BugSummaryFilter.ALL).get(0).delta());
    }

    // ============================================================================
    // Combined view and reads
    // ============================================================================

    @Test
    @DisplayName("Should union aggregate rows and journal entries with negated journal ids")
    void testCombinedView() {
        store.insert(key("ui"), 2);
        journal.append(List.of(BugSummaryDelta.plus(key("ui"))));

        List<CombinedSummaryRow> rows = new JdbcCombinedBugSummaryView(jdbc, sql)
                .query(BugSummaryFilter.builder().whereNotNull(BugSummaryDimension.TAG).build()).toList();

        assertEquals(2, rows.size());
        assertEquals(1, rows.stream().filter(CombinedSummaryRow::fromJournal).count());
        assertTrue(rows.stream().allMatch(r -> r.key().equals(key("ui"))));
    }

    @Test
    @DisplayName("Should compute tag counts and reader visibility in SQL")
    void testQueryService() {
        jdbc.update("INSERT INTO accesspolicygrant (policy, grantee) VALUES (?, ?)", 9L, 500L);
        JdbcAccessViewerSet access = new JdbcAccessViewerSet(jdbc, sql);
        BugSummaryQueryService queries = new BugSummaryQueryService(new JdbcCombinedBugSummaryView(jdbc, sql), access);

        store.insert(key("ui"), 2);
        store.insert(key("secret").withViewer(Viewer.grantee(500)), 1);
        store.insert(key("secret").withViewer(Viewer.policy(9)), 1);
        journal.append(List.of(BugSummaryDelta.plus(key("crash")),
                BugSummaryDelta.plus(key("done").toBuilder().status(BugTaskStatus.FIXRELEASED).build())));
        BugSummaryFilter context = BugSummaryContexts.forTarget(BugTarget.sourcePackage(3, 50));

        assertEquals(List.of(new TagCount("ui", 2), new TagCount("crash", 1)),
                queries.tagOpenCounts(context, null, 10, null));
        assertEquals(List.of(new TagCount("ui", 2), new TagCount("crash", 1), new TagCount("secret", 1)),
                queries.tagOpenCounts(context, 500L, 10, null));
        assertEquals(5, queries.queryAggregates(queries.forReader(context, 500L, true))
                .mapToLong(BugSummaryCount::count).sum());
        assertEquals(Set.of(500L), access.viewersOf(9));
        assertEquals(Set.of(9L), access.policiesGrantedTo(500));
    }

    // ============================================================================
    // Rollup
    // ============================================================================

    @Test
    @DisplayName("Should fold the journal into aggregate rows in one transaction")
    void testRollup() {
        journal.append(List.of(BugSummaryDelta.plus(key("ui")), BugSummaryDelta.plus(key(null))));
        journal.append(List.of(BugSummaryDelta.plus(key("ui"))));
        journal.append(List.of(BugSummaryDelta.plus(key("gone"))));
        journal.append(List.of(BugSummaryDelta.minus(key("gone"))));

        RollupResult result = rollup(store).compact(null);

        assertEquals(5, result.entriesRead());
        assertEquals(2, result.bucketsApplied());
        assertEquals(1, result.bucketsCancelled());
        assertEquals(0, journal.size());
        assertEquals(OptionalInt.of(2), store.findCount(key("ui")));
        assertEquals(OptionalInt.of(1), store.findCount(key(null)));
        assertTrue(store.findCount(key("gone")).isEmpty());
    }

    @Test
    @DisplayName("Should journal, fold and remove both rows of a source package task")
    void testRollup_PackageTaskEndToEnd() {
        BugSummaryFanOut fanOut = new BugSummaryFanOut(new JdbcAccessViewerSet(jdbc, sql));
        BugSummaryRollup rollup = rollup(store);
        BugTaskFact task = SummaryFixture.fact(1, 100, BugTarget.sourcePackage(3, 50)).build();
        Set<BugTarget> targets = Set.of(BugTarget.sourcePackage(3, 50), BugTarget.distribution(3));

        assertEquals(2, journal.append(fanOut.forInsert(task)));
        List<JournalEntry> added = journal.findAll(BugSummaryFilter.ALL);
        assertEquals(targets, Set.copyOf(added.stream().map(e -> e.key().getTarget()).toList()));
        assertTrue(added.stream().allMatch(e -> e.delta() == 1));

        rollup.compact(null);
        List<BugSummaryRow> rows = store.findAll(BugSummaryFilter.ALL);
        assertEquals(2, rows.size());
        assertTrue(rows.stream().allMatch(r -> r.count() == 1));
        assertEquals(0, journal.size());

        assertEquals(2, journal.append(fanOut.forDelete(task)));
        List<JournalEntry> removed = journal.findAll(BugSummaryFilter.ALL);
        assertEquals(targets, Set.copyOf(removed.stream().map(e -> e.key().getTarget()).toList()));
        assertTrue(removed.stream().allMatch(e -> e.delta() == -1));

        rollup.compact(null);
        assertTrue(store.findAll(BugSummaryFilter.ALL).isEmpty());
        assertEquals(0, journal.size());
    }

    @Test
    @DisplayName("Should roll back only the failing bucket and re-journal its delta")
    void testRollup_DeferredBucketSavepoint() {
        store.insert(key("full"), Integer.MAX_VALUE);
        journal.append(List.of(BugSummaryDelta.plus(key("full")), BugSummaryDelta.plus(key("ok"))));

        RollupResult result = rollup(store).compact(null);

        assertEquals(1, result.bucketsApplied());
        assertEquals(1, result.bucketsDeferred());
        assertEquals(OptionalInt.of(1), store.findCount(key("ok")));
        assertEquals(OptionalInt.of(Integer.MAX_VALUE), store.findCount(key("full")));
        List<JournalEntry> left = journal.findAll(BugSummaryFilter.ALL);
        assertEquals(1, left.size());
        assertEquals(key("full"), left.get(0).key());
    }

    @Test
    @DisplayName("Should recover from losing the insert race inside a transaction")
    void testCounter_InsertRaceWithinTransaction() {
        AtomicBoolean raced = new AtomicBoolean();
        JdbcBugSummaryStore racing = new JdbcBugSummaryStore(jdbc, sql, nestedTx) {
            @Override
            public int increment(BugSummaryKey key, int delta) {
                int updated = super.increment(key, delta);
                if (updated == 0 && raced.compareAndSet(false, true)) {
                    // another writer creates the row between our update and insert
                    super.insert(key, 5);
                }
                return updated;
            }
        };
        BugSummaryCounter counter = new BugSummaryCounter(racing, metrics, new BugSummaryProperties());

        requiredTx.executeWithoutResult(status -> counter.apply(key("ui"), 2));

        assertEquals(OptionalInt.of(7), store.findCount(key("ui")));
        assertEquals(1.0, registry.get("bugsummary.upsert.conflicts").counter().count());
    }
}
