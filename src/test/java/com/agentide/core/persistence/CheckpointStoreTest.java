package com.agentide.core.persistence;

import com.agentide.core.model.ArtifactOperation;
import com.agentide.core.model.ArtifactRecord;
import com.agentide.core.model.ConversationTurn;
import com.agentide.core.model.ReviewAction;
import com.agentide.core.model.SessionMemory;
import com.agentide.core.model.SessionSnapshot;
import com.agentide.core.model.Step;
import com.agentide.core.model.WorkerKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class CheckpointStoreTest {

    static SessionSnapshot suspendedSnapshot(String sessionId) {
        var memory = new SessionMemory(
                List.of(new ConversationTurn("user", "write a calculator", List.of(),
                        Instant.parse("2026-03-01T12:00:00Z"))),
                List.of(new ArtifactRecord("calc.py", ArtifactOperation.CREATED, "code_agent",
                        Instant.parse("2026-03-01T12:00:05Z"))),
                "calc.py");
        return new SessionSnapshot(sessionId, "write a calculator", "write a calculator", "/work",
                List.of(new Step(WorkerKind.WRITE, "create calc.py", "calc.py"),
                        new Step(WorkerKind.DIAGNOSTIC, "check edge cases", null)),
                2, "", "", false, false, List.of("calc.py"), Map.of("calc.py", "def add(a, b): return a + b"),
                true, true, null, null, false, false, "REVIEW_GATE", "REVIEW_GATE",
                "=== DEBUG ANALYSIS ===\n\nlooks fine", "", 7, memory);
    }

    @Nested
    @DisplayName("CheckpointSerializer")
    class Serializer {

        @Test
        @DisplayName("restores every field, including memory timestamps and absent optionals")
        void restoresAllFields() {
            var snapshot = suspendedSnapshot("AIDE-2026-0001");

            var restored = CheckpointSerializer.fromJson(CheckpointSerializer.toJson(snapshot));

            assertEquals(snapshot, restored);
            assertNull(restored.feedback());
            assertFalse(restored.plan().get(1).hasTarget());
        }

        @Test
        @DisplayName("staged feedback survives serialization")
        void feedbackSurvives() {
            var staged = suspendedSnapshot("AIDE-2026-0002").withFeedback("add tests", ReviewAction.REVISE);

            var restored = CheckpointSerializer.fromJson(CheckpointSerializer.toJson(staged));

            assertEquals("add tests", restored.feedback());
            assertEquals(ReviewAction.REVISE, restored.feedbackAction());
        }

        @Test
        @DisplayName("malformed JSON fails with CheckpointException")
        void malformedJson() {
            assertThrows(CheckpointException.class, () -> CheckpointSerializer.fromJson("{not json"));
        }
    }

    @Nested
    @DisplayName("InMemoryCheckpointStore")
    class InMemory {

        @Test
        @DisplayName("save, load, list and delete")
        void lifecycle() {
            var store = new InMemoryCheckpointStore();
            store.save("B", suspendedSnapshot("B"));
            store.save("A", suspendedSnapshot("A"));

            assertTrue(store.exists("A"));
            assertEquals(List.of("A", "B"), store.listSessionIds());
            assertEquals(suspendedSnapshot("A"), store.load("A").orElseThrow());

            assertTrue(store.delete("A"));
            assertFalse(store.delete("A"));
            assertTrue(store.load("A").isEmpty());
            assertFalse(store.isDurable());
        }

        @Test
        @DisplayName("a later save replaces the earlier one")
        void overwrites() {
            var store = new InMemoryCheckpointStore();
            store.save("A", suspendedSnapshot("A"));
            store.save("A", suspendedSnapshot("A").withFeedback("ok", null));

            assertEquals("ok", store.load("A").orElseThrow().feedback());
        }
    }

    @Nested
    @DisplayName("JdbcCheckpointStore")
    class Jdbc {

        private final DataSource dataSource = mock(DataSource.class);
        private final Connection connection = mock(Connection.class);
        private final PreparedStatement statement = mock(PreparedStatement.class);
        private final ResultSet resultSet = mock(ResultSet.class);
        private final JdbcCheckpointStore store = new JdbcCheckpointStore(dataSource);

        Jdbc() throws SQLException {
            when(dataSource.getConnection()).thenReturn(connection);
            when(connection.prepareStatement(anyString())).thenReturn(statement);
            when(statement.executeQuery()).thenReturn(resultSet);
        }

        @Test
        @DisplayName("save upserts the JSON snapshot")
        void saveUpserts() throws SQLException {
            store.save("AIDE-1", suspendedSnapshot("AIDE-1"));

            verify(connection).prepareStatement(contains("ON CONFLICT (session_id)"));
            verify(statement).setString(1, "AIDE-1");
            verify(statement).setString(eq(2), contains("\"sessionId\":\"AIDE-1\""));
            verify(statement).executeUpdate();
        }

        @Test
        @DisplayName("load deserializes the stored row")
        void loadReadsRow() throws SQLException {
            when(resultSet.next()).thenReturn(true);
            when(resultSet.getString("snapshot")).thenReturn(CheckpointSerializer.toJson(suspendedSnapshot("AIDE-1")));

            assertEquals(suspendedSnapshot("AIDE-1"), store.load("AIDE-1").orElseThrow());
        }

        @Test
        @DisplayName("load of an unknown session is empty")
        void loadMissing() throws SQLException {
            when(resultSet.next()).thenReturn(false);

            assertTrue(store.load("nope").isEmpty());
        }

        @Test
        @DisplayName("lists ids in the order the database returns them")
        void listsIds() throws SQLException {
            when(resultSet.next()).thenReturn(true, true, false);
            when(resultSet.getString("session_id")).thenReturn("AIDE-2", "AIDE-1");

            assertEquals(List.of("AIDE-2", "AIDE-1"), store.listSessionIds());
        }

        @Test
        @DisplayName("delete reports whether a row was removed")
        void deletes() throws SQLException {
            when(statement.executeUpdate()).thenReturn(1, 0);

            assertTrue(store.delete("AIDE-1"));
            assertFalse(store.delete("AIDE-1"));
        }

        @Test
        @DisplayName("SQL failures surface as CheckpointException")
        void wrapsSqlException() throws SQLException {
            when(statement.executeUpdate()).thenThrow(new SQLException("connection reset"));

            var e = assertThrows(CheckpointException.class, () -> store.save("AIDE-1", suspendedSnapshot("AIDE-1")));
            assertInstanceOf(SQLException.class, e.getCause());
        }

        @Test
        @DisplayName("createTables issues CREATE TABLE IF NOT EXISTS")
        void createsTable() throws SQLException {
            store.createTables();

            verify(connection).prepareStatement(contains("CREATE TABLE IF NOT EXISTS " + JdbcCheckpointStore.TABLE_NAME));
            verify(statement).execute();
            assertTrue(store.isDurable());
        }
    }
}
