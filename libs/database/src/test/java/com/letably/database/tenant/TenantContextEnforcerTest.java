package com.letably.database.tenant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.letably.database.ConnectionPoolExhaustedException;
import com.letably.database.QueryExecutionException;
import com.letably.database.SqlErrorTranslator;
import com.letably.security.AgencyId;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import javax.sql.DataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for the acquire, set, execute, clear, release sequence of
 * {@link TenantContextEnforcer}, with the pool and driver mocked.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("TenantContextEnforcer")
class TenantContextEnforcerTest {

    private static final AgencyId AGENCY = AgencyId.of(42);

    @Mock
    private DataSource dataSource;

    @Mock
    private Connection connection;

    @Mock
    private TenantSessionBinder binder;

    @Mock
    private ConnectionEvictor evictor;

    private TenantContextEnforcer enforcer;

    @BeforeEach
    void setUp() {
        enforcer = new TenantContextEnforcer(
                dataSource, binder, evictor, new SqlErrorTranslator(Duration.ofMillis(100)), Duration.ofSeconds(1));
    }

    @Nested
    @DisplayName("scoped call")
    class ScopedCall {

        @Test
        @DisplayName("binds, runs, clears and releases on the same connection in order")
        void happyPath() throws Exception {
            when(dataSource.getConnection()).thenReturn(connection);

            String result = enforcer.withAgency(AGENCY, scoped -> {
                assertThat(scoped.agencyId()).isEqualTo(AGENCY);
                return "done";
            });

            assertThat(result).isEqualTo("done");
            InOrder order = inOrder(dataSource, binder, connection);
            order.verify(dataSource).getConnection();
            order.verify(binder).bind(connection, AGENCY);
            order.verify(binder).clear(connection);
            order.verify(connection).close();
            verify(evictor, never()).evict(any());
        }

        @Test
        @DisplayName("does not run the work and evicts the connection when the context cannot be set")
        void bindFailureAborts() throws Exception {
            when(dataSource.getConnection()).thenReturn(connection);
            doThrow(new SQLException("permission denied to set parameter", "42501"))
                    .when(binder).bind(connection, AGENCY);
            AtomicBoolean ran = new AtomicBoolean(false);

            assertThatThrownBy(() -> enforcer.withAgency(AGENCY, scoped -> {
                ran.set(true);
                return null;
            }))
                    .isInstanceOf(TenantContextException.class)
                    .hasMessageContaining("permission denied")
                    .satisfies(e -> assertThat(((TenantContextException) e).agencyId()).isEqualTo(AGENCY));

            assertThat(ran).isFalse();
            verify(evictor).evict(connection);
            verify(connection, never()).close();
        }

        @Test
        @DisplayName("evicts the connection when the context cannot be cleared")
        void clearFailureEvicts() throws Exception {
            when(dataSource.getConnection()).thenReturn(connection);
            doThrow(new SQLException("connection broken")).when(binder).clear(connection);

            Integer result = enforcer.withAgency(AGENCY, scoped -> 1);

            assertThat(result).isEqualTo(1);
            verify(evictor).evict(connection);
            verify(connection, never()).close();
        }

        @Test
        @DisplayName("clears and releases when the work fails, translating the SQL error")
        void workFailureReleases() throws Exception {
            when(dataSource.getConnection()).thenReturn(connection);

            assertThatThrownBy(() -> enforcer.withAgency(AGENCY, scoped -> {
                throw new SQLException("syntax error at or near \"FORM\"", "42601");
            }))
                    .isInstanceOf(QueryExecutionException.class)
                    .hasMessage("syntax error at or near \"FORM\"");

            verify(binder).clear(connection);
            verify(connection).close();
        }

        @Test
        @DisplayName("releases when the work throws an unchecked exception")
        void runtimeFailureReleases() throws Exception {
            when(dataSource.getConnection()).thenReturn(connection);

            assertThatThrownBy(() -> enforcer.withAgency(AGENCY, scoped -> {
                throw new IllegalStateException("shaping failed");
            })).isInstanceOf(IllegalStateException.class);

            verify(binder).clear(connection);
            verify(connection).close();
        }

        @Test
        @DisplayName("the scoped connection stops working after the callback returns")
        void capabilityInvalidated() throws Exception {
            when(dataSource.getConnection()).thenReturn(connection);
            AtomicReference<TenantScopedConnection> leaked = new AtomicReference<>();

            enforcer.withAgency(AGENCY, scoped -> {
                leaked.set(scoped);
                return null;
            });

            assertThat(leaked.get().isValid()).isFalse();
            assertThatThrownBy(() -> leaked.get().query(com.letably.database.query.BuiltQuery.of("SELECT 1")))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("after its scope ended");
        }

        @Test
        @DisplayName("pool acquisition failure is a retryable pool exhaustion and binds nothing")
        void acquireFailure() throws Exception {
            when(dataSource.getConnection())
                    .thenThrow(new SQLTransientConnectionException("Connection is not available, request timed out"));

            assertThatThrownBy(() -> enforcer.withAgency(AGENCY, scoped -> null))
                    .isInstanceOf(ConnectionPoolExhaustedException.class)
                    .satisfies(e -> assertThat(((ConnectionPoolExhaustedException) e).backoffHint())
                            .isEqualTo(Duration.ofMillis(100)));

            verify(binder, never()).bind(any(), any());
        }
    }

    @Nested
    @DisplayName("transaction")
    class Transaction {

        @Test
        @DisplayName("binds transaction-locally and commits on success")
        void commits() throws Exception {
            when(dataSource.getConnection()).thenReturn(connection);

            enforcer.withAgencyTransaction(AGENCY, scoped -> null);

            InOrder order = inOrder(connection, binder);
            order.verify(connection).setAutoCommit(false);
            order.verify(binder).bindTransactionLocal(connection, AGENCY);
            order.verify(connection).commit();
            order.verify(connection).setAutoCommit(true);
            order.verify(binder).clear(connection);
            order.verify(connection).close();
        }

        @Test
        @DisplayName("rolls back on failure and still releases")
        void rollsBack() throws Exception {
            when(dataSource.getConnection()).thenReturn(connection);

            assertThatThrownBy(() -> enforcer.withAgencyTransaction(AGENCY, scoped -> {
                throw new SQLException("duplicate key value", "23505");
            })).isInstanceOf(QueryExecutionException.class);

            verify(connection).rollback();
            verify(connection, never()).commit();
            verify(connection).close();
        }

        @Test
        @DisplayName("rolls back before restoring auto-commit when the work throws an Error")
        void rollsBackOnError() throws Exception {
            when(dataSource.getConnection()).thenReturn(connection);

            assertThatThrownBy(() -> enforcer.withAgencyTransaction(AGENCY, scoped -> {
                throw new StackOverflowError("report recursion");
            })).isInstanceOf(StackOverflowError.class);

            InOrder order = inOrder(connection, binder);
            order.verify(connection).rollback();
            order.verify(connection).setAutoCommit(true);
            order.verify(binder).clear(connection);
            order.verify(connection).close();
            verify(connection, never()).commit();
        }

        @Test
        @DisplayName("rolls back when the commit itself fails")
        void rollsBackFailedCommit() throws Exception {
            when(dataSource.getConnection()).thenReturn(connection);
            doThrow(new SQLException("could not serialize access", "40001")).when(connection).commit();

            assertThatThrownBy(() -> enforcer.withAgencyTransaction(AGENCY, scoped -> "written"))
                    .isInstanceOf(QueryExecutionException.class);

            verify(connection).rollback();
            verify(connection).close();
        }
    }

    @Nested
    @DisplayName("system call")
    class SystemCall {

        @Test
        @DisplayName("clears any context, marks the session, and clears again before release")
        void clearsFirst() throws Exception {
            when(dataSource.getConnection()).thenReturn(connection);

            enforcer.withSystemConnection(system -> null);

            InOrder order = inOrder(binder, connection);
            order.verify(binder).clear(connection);
            order.verify(binder).bindSystem(connection);
            order.verify(binder).clear(connection);
            order.verify(connection).close();
            verify(binder, never()).bind(any(), any());
        }

        @Test
        @DisplayName("aborts without running the work when the connection cannot be cleared")
        void clearFailureAborts() throws Exception {
            when(dataSource.getConnection()).thenReturn(connection);
            doThrow(new SQLException("reset failed")).when(binder).clear(connection);
            AtomicBoolean ran = new AtomicBoolean(false);

            assertThatThrownBy(() -> enforcer.withSystemConnection(system -> {
                ran.set(true);
                return null;
            })).isInstanceOf(TenantContextException.class);

            assertThat(ran).isFalse();
            verify(evictor).evict(connection);
        }
    }
}
