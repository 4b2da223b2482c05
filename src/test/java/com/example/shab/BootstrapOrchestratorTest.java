package com.example.shab;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class BootstrapOrchestratorTest {

    @TempDir
    Path tempDir;

    private FakeShabClient client;
    private DatabaseManager db;
    private IngestionService service;

    @BeforeEach
    public void setUp() {
        client = new FakeShabClient()
                .withPublication(Fixtures.BLEIN_ID, Fixtures.BLEIN_ID + ".xml")
                .withPublication(Fixtures.COMPANY_ID, "company-foreign.xml")
                .withPublication(Fixtures.HR02_ID, "commercial-register-hr02.xml");
        db = new DatabaseManager(tempDir.resolve("auctions.db").toString(), 5000, AppContext.createObjectMapper());
        service = new IngestionService(client, new PublicationClassifier(), new ShabParser(), db, true);
    }

    @Test
    public void oneFetchFailureDoesNotBlockTheRest() throws Exception {
        List<String> ids = Arrays.asList(Fixtures.BLEIN_ID, "missing", Fixtures.COMPANY_ID, Fixtures.HR02_ID);
        BootstrapOrchestrator orchestrator = new BootstrapOrchestrator(service, 1, Duration.ZERO);

        BatchStatistics stats = orchestrator.run(ids, 2, Duration.ofMillis(10));

        assertEquals(4, stats.getTotal());
        assertEquals(1, stats.getErrored());
        assertEquals(3, stats.getInserted() + stats.getSkippedDuplicate() + stats.getSkippedNonAuction());
        assertEquals(2, stats.getInserted());
        assertEquals(1, stats.getSkippedNonAuction());
        assertEquals(0, stats.getNotProcessed());
        assertTrue(db.exists(Fixtures.COMPANY_ID));

        List<String> order = new ArrayList<>();
        for (IngestionResult r : stats.getResults()) {
            order.add(r.getPublicationId());
        }
        assertEquals(ids, order);
        assertEquals(IngestionResult.ErrorKind.FETCH, stats.getResults().get(1).getErrorKind());
    }

    @Test
    public void duplicateIdInOneBatchHasOneWinner() throws Exception {
        BootstrapOrchestrator orchestrator = new BootstrapOrchestrator(service, 1, Duration.ZERO);

        BatchStatistics stats = orchestrator.run(
                Arrays.asList(Fixtures.BLEIN_ID, Fixtures.BLEIN_ID), 5, Duration.ZERO);

        assertEquals(1, stats.getInserted());
        assertEquals(1, stats.getSkippedDuplicate());
        assertEquals(0, stats.getErrored());
        assertEquals(1, db.countRows("publications"));
        assertEquals(1, db.countRows("auctions"));
    }

    @Test
    public void duplicateIdAcrossBatchesIsSkipped() throws Exception {
        BootstrapOrchestrator orchestrator = new BootstrapOrchestrator(service, 1, Duration.ZERO);

        BatchStatistics stats = orchestrator.run(
                Arrays.asList(Fixtures.BLEIN_ID, Fixtures.BLEIN_ID), 1, Duration.ZERO);

        assertEquals(1, stats.getInserted());
        assertEquals(1, stats.getSkippedDuplicate());
        assertEquals(1, client.xmlCalls(Fixtures.BLEIN_ID));
    }

    @Test
    public void transientFetchFailureIsRetried() throws Exception {
        client.failing(Fixtures.BLEIN_ID, 1);
        BootstrapOrchestrator orchestrator = new BootstrapOrchestrator(service, 2, Duration.ofMillis(1));

        BatchStatistics stats = orchestrator.run(List.of(Fixtures.BLEIN_ID), 5, Duration.ZERO);

        assertEquals(1, stats.getInserted());
        assertEquals(2, stats.getResults().get(0).getAttempts());
        assertEquals(2, client.xmlCalls(Fixtures.BLEIN_ID));
    }

    @Test
    public void parseFailureIsNotRetried() {
        client.withPublication("broken", "malformed.xml");
        BootstrapOrchestrator orchestrator = new BootstrapOrchestrator(service, 3, Duration.ofMillis(1));

        BatchStatistics stats = orchestrator.run(List.of("broken"), 5, Duration.ZERO);

        assertEquals(1, stats.getErrored());
        assertEquals(1, stats.getResults().get(0).getAttempts());
        assertEquals(1, client.xmlCalls("broken"));
    }

    @Test
    public void blankIdentifiersAreIgnored() {
        BootstrapOrchestrator orchestrator = new BootstrapOrchestrator(service, 1, Duration.ZERO);

        BatchStatistics stats = orchestrator.run(Arrays.asList("", "  ", "@" + Fixtures.BLEIN_ID), 5, Duration.ZERO);

        assertEquals(1, stats.getTotal());
        assertEquals(1, stats.getInserted());
    }

    @Test
    public void stopRequestSkipsRemainingBatches() {
        BootstrapOrchestrator orchestrator = new BootstrapOrchestrator(service, 1, Duration.ZERO);
        orchestrator.requestStop();

        BatchStatistics stats = orchestrator.run(List.of(Fixtures.BLEIN_ID, Fixtures.COMPANY_ID), 1, Duration.ZERO);

        assertEquals(2, stats.getTotal());
        assertEquals(0, stats.getProcessed());
        assertEquals(2, stats.getNotProcessed());
        assertEquals(0, client.xmlCalls(Fixtures.BLEIN_ID));
    }

    @Test
    public void rejectsInvalidBatchSize() {
        BootstrapOrchestrator orchestrator = new BootstrapOrchestrator(service, 1, Duration.ZERO);
        assertThrows(IllegalArgumentException.class, () -> orchestrator.run(List.of(Fixtures.BLEIN_ID), 0, Duration.ZERO));
    }

    @Test
    public void readsIdentifierFile() throws Exception {
        Path file = tempDir.resolve("ids.txt");
        Files.write(file, Arrays.asList("# exported 2025-09-05", "", "@" + Fixtures.BLEIN_ID, "  " + Fixtures.HR02_ID + "  "),
                StandardCharsets.UTF_8);

        assertEquals(List.of("@" + Fixtures.BLEIN_ID, Fixtures.HR02_ID), BootstrapOrchestrator.readIdentifiers(file));
    }
}
