package com.nana.contacts.importer;

import com.nana.contacts.domain.CandidateRecord;
import com.nana.contacts.domain.Contact;
import com.nana.contacts.repository.ContactRepository;
import com.nana.contacts.repository.ContactRepository.RepositoryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link ImportExecutor} against a mocked {@link ContactRepository}.
 */
@ExtendWith(MockitoExtension.class)
class ImportExecutorTest {

    @Mock
    private ContactRepository mockRepository;

    private ImportExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new ImportExecutor(mockRepository);
    }

    private static CandidateRecord candidate(int row, String name, String email) {
        return CandidateRecord.builder(row).fullName(name).email(email).build();
    }

    private static List<CandidateRecord> threeCandidates() {
        return List.of(
                candidate(1, "Ada Lovelace", "ada@example.com"),
                candidate(2, "Grace Hopper", "grace@example.com"),
                candidate(3, "Alan Turing", "alan@example.com"));
    }

    // ======================================================================
    // NESTED TEST CLASS 1: batch outcome
    // ======================================================================

    @Nested
    @DisplayName("Batch outcome")
    class BatchOutcomeTests {

        @Test
        @DisplayName("all SKIP writes nothing and commits an empty batch")
        void execute_allSkip_noWrites() {
            ImportOutcome outcome = executor.execute(threeCandidates(), List.of(
                    ImportDecision.skip(1), ImportDecision.skip(2), ImportDecision.skip(3)));

            assertEquals(0, outcome.getCreated());
            assertEquals(0, outcome.getUpdated());
            assertEquals(3, outcome.getSkipped());
            assertTrue(outcome.isSuccess());
            assertTrue(outcome.isCommitted());
            verify(mockRepository, never()).create(any());
            verify(mockRepository, never()).update(any());
            verify(mockRepository).commit();
        }

        @Test
        @DisplayName("rows without a decision are skipped")
        void execute_noDecisions_allSkipped() {
            ImportOutcome outcome = executor.execute(threeCandidates(), null);

            assertEquals(3, outcome.getSkipped());
            verify(mockRepository, never()).create(any());
        }

        @Test
        @DisplayName("[create, create, update-with-bad-id] rolls back and never commits")
        void execute_oneBadUpdate_rollsBackEverything() {
            when(mockRepository.findById(99L)).thenReturn(Optional.empty());

            ImportOutcome outcome = executor.execute(threeCandidates(), List.of(
                    ImportDecision.create(1),
                    ImportDecision.create(2),
                    ImportDecision.update(3, 99L)));

            assertFalse(outcome.isSuccess());
            assertFalse(outcome.isCommitted());
            assertEquals(2, outcome.getCreated());
            assertEquals(1, outcome.getFailures().size());
            assertEquals(3, outcome.getFailures().get(0).getRowNumber());
            assertEquals("No existing contact with id 99",
                    outcome.getFailures().get(0).getMessage());

            verify(mockRepository, times(2)).create(any());
            verify(mockRepository).rollback();
            verify(mockRepository, never()).commit();
        }

        @Test
        @DisplayName("a store error on one row is recorded and later rows still run")
        void execute_storeErrorOnRow_continues() {
            doThrow(new RepositoryException("UNIQUE constraint failed"))
                    .doNothing()
                    .when(mockRepository).create(any());

            ImportOutcome outcome = executor.execute(
                    List.of(candidate(1, "Ada", null), candidate(2, "Grace", null)),
                    List.of(ImportDecision.create(1), ImportDecision.create(2)));

            assertEquals(1, outcome.getCreated());
            assertEquals(1, outcome.getFailures().size());
            assertEquals("UNIQUE constraint failed", outcome.getFailures().get(0).getMessage());
            verify(mockRepository, times(2)).create(any());
            verify(mockRepository).rollback();
        }

        @Test
        @DisplayName("begin, writes and commit happen in that order")
        void execute_create_ordersTransactionCalls() {
            executor.execute(List.of(candidate(1, "Ada", null)),
                    List.of(ImportDecision.create(1)));

            InOrder order = inOrder(mockRepository);
            order.verify(mockRepository).beginTransaction();
            order.verify(mockRepository).create(any());
            order.verify(mockRepository).commit();
        }

        @Test
        @DisplayName("a later decision for the same row replaces an earlier one")
        void execute_duplicateDecision_laterWins() {
            ImportOutcome outcome = executor.execute(List.of(candidate(1, "Ada", null)),
                    List.of(ImportDecision.skip(1), ImportDecision.create(1)));

            assertEquals(1, outcome.getCreated());
            assertEquals(0, outcome.getSkipped());
        }
    }

    // ======================================================================
    // NESTED TEST CLASS 2: row application
    // ======================================================================

    @Nested
    @DisplayName("Row application")
    class RowApplicationTests {

        @Test
        @DisplayName("CREATE stores a new contact with a fresh vCard")
        void execute_create_storesSerializedContact() {
            executor.execute(List.of(candidate(1, "Ada Lovelace", "ada@example.com")),
                    List.of(ImportDecision.create(1)));

            ArgumentCaptor<Contact> captor = ArgumentCaptor.forClass(Contact.class);
            verify(mockRepository).create(captor.capture());
            Contact created = captor.getValue();

            assertEquals("Ada Lovelace", created.getFullName());
            assertNotNull(created.getVcardId());
            assertTrue(created.getVcardData().startsWith("BEGIN:VCARD"));
            assertTrue(created.getVcardData().contains("UID:" + created.getVcardId()));
        }

        @Test
        @DisplayName("UPDATE merges present values and keeps the stored UID")
        void execute_update_mergesIntoExisting() {
            Contact existing = new Contact();
            existing.setId(7);
            existing.setVcardId("uid-7");
            existing.setFullName("Ada Lovelace");
            existing.setEmail("old@example.com");
            existing.setPhone("555-123-4567");
            when(mockRepository.findById(7L)).thenReturn(Optional.of(existing));

            ImportOutcome outcome = executor.execute(
                    List.of(candidate(1, "Ada Lovelace", "new@example.com")),
                    List.of(ImportDecision.update(1, 7L)));

            assertEquals(1, outcome.getUpdated());
            ArgumentCaptor<Contact> captor = ArgumentCaptor.forClass(Contact.class);
            verify(mockRepository).update(captor.capture());
            Contact merged = captor.getValue();

            assertEquals(7, merged.getId());
            assertEquals("new@example.com", merged.getEmail());
            assertEquals("555-123-4567", merged.getPhone());
            assertEquals("uid-7", merged.getVcardId());
            assertTrue(merged.getVcardData().contains("UID:uid-7"));
            assertTrue(merged.getVcardData().contains("EMAIL;TYPE=INTERNET:new@example.com"));
            assertEquals("old@example.com", existing.getEmail());
        }

        @Test
        @DisplayName("UPDATE without an existing id is a row failure")
        void execute_updateWithoutId_fails() {
            ImportOutcome outcome = executor.execute(List.of(candidate(1, "Ada", null)),
                    List.of(new ImportDecision(1, ImportAction.UPDATE, null)));

            assertEquals(ImportExecutor.MSG_UPDATE_REQUIRES_ID,
                    outcome.getFailures().get(0).getMessage());
            verify(mockRepository, never()).findById(anyLong());
            verify(mockRepository).rollback();
        }
    }

    // ======================================================================
    // NESTED TEST CLASS 3: infrastructure failures
    // ======================================================================

    @Nested
    @DisplayName("Infrastructure failures")
    class InfrastructureTests {

        @Test
        @DisplayName("a failed begin throws and writes nothing")
        void execute_beginFails_throws() {
            doThrow(new RepositoryException("database is locked"))
                    .when(mockRepository).beginTransaction();

            ImportExecutionException ex = assertThrows(ImportExecutionException.class,
                    () -> executor.execute(threeCandidates(),
                            List.of(ImportDecision.create(1))));

            assertInstanceOf(RepositoryException.class, ex.getCause());
            verify(mockRepository, never()).create(any());
            verify(mockRepository, never()).commit();
        }

        @Test
        @DisplayName("a failed commit rolls back and throws")
        void execute_commitFails_rollsBackAndThrows() {
            doThrow(new RepositoryException("disk I/O error"))
                    .when(mockRepository).commit();

            assertThrows(ImportExecutionException.class,
                    () -> executor.execute(List.of(candidate(1, "Ada", null)),
                            List.of(ImportDecision.create(1))));

            verify(mockRepository).rollback();
        }

        @Test
        @DisplayName("a failed rollback is attached as suppressed")
        void execute_commitAndRollbackFail_suppressed() {
            doThrow(new RepositoryException("disk I/O error"))
                    .when(mockRepository).commit();
            doThrow(new RepositoryException("rollback failed"))
                    .when(mockRepository).rollback();

            ImportExecutionException ex = assertThrows(ImportExecutionException.class,
                    () -> executor.execute(List.of(candidate(1, "Ada", null)),
                            List.of(ImportDecision.create(1))));

            assertEquals(1, ex.getCause().getSuppressed().length);
        }

        @Test
        @DisplayName("constructor rejects a null repository")
        void constructor_nullRepository_throws() {
            assertThrows(IllegalArgumentException.class, () -> new ImportExecutor(null));
        }
    }
}
