package io.kneo.scheduler.service.sql;

import io.kneo.scheduler.model.cnst.CommandStyle;
import io.kneo.scheduler.model.job.SqlCommand;
import io.kneo.scheduler.service.sql.provider.DbCommand;
import io.kneo.scheduler.service.sql.provider.DbProvider;
import io.kneo.scheduler.service.sql.provider.DbProviderFactory;
import io.kneo.scheduler.service.sql.provider.DbProviderRegistry;
import io.kneo.scheduler.service.sql.provider.DbSession;
import io.kneo.scheduler.service.sql.provider.ProviderBinding;
import io.kneo.scheduler.service.sql.provider.jdbc.ReflectiveJdbcProviderFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.quartz.JobDataMap;
import org.quartz.JobExecutionException;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SqlCommandExecutorTest {
    private static final String MOCK_PROVIDER = "test.provider";

    private String url;
    private Connection keepAlive;
    private DbProvider mockProvider;
    private SqlCommandExecutor executor;

    @BeforeEach
    void setUp() throws Exception {
        url = "jdbc:h2:mem:sqljob_" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1";
        keepAlive = DriverManager.getConnection(url);
        try (Statement statement = keepAlive.createStatement()) {
            statement.execute("CREATE TABLE audit_log (id INT PRIMARY KEY, archived BOOLEAN)");
            statement.execute("INSERT INTO audit_log VALUES (1, FALSE), (2, FALSE), (3, TRUE)");
        }

        mockProvider = mock(DbProvider.class);
        DbProviderFactory mockFactory = new DbProviderFactory() {
            @Override
            public String name() {
                return MOCK_PROVIDER;
            }

            @Override
            public DbProvider create(ProviderBinding binding) {
                return mockProvider;
            }
        };
        executor = new SqlCommandExecutor(new DbProviderRegistry(List.of(mockFactory), new ReflectiveJdbcProviderFactory()));
    }

    @AfterEach
    void tearDown() throws Exception {
        try (Statement statement = keepAlive.createStatement()) {
            statement.execute("SHUTDOWN");
        }
        keepAlive.close();
    }

    @Test
    void literalCommandRunsThroughReflectiveJdbcBinding() throws Exception {
        executor.execute(h2Job("UPDATE audit_log SET archived = TRUE WHERE archived = FALSE"));

        try (Statement statement = keepAlive.createStatement();
             ResultSet rs = statement.executeQuery("SELECT COUNT(*) FROM audit_log WHERE archived = FALSE")) {
            assertTrue(rs.next());
            assertEquals(0, rs.getInt(1));
        }
    }

    @Test
    void executeReportsAffectedRows() throws Exception {
        SqlCommand command = executor.readCommand(h2Job("DELETE FROM audit_log WHERE archived = TRUE"));

        int affected = executor.execute(new ReflectiveJdbcProviderFactory().create(
                ProviderBinding.of(command)), command);

        assertEquals(1, affected);
    }

    @Test
    void failingStatementIsNotRefired() {
        JobExecutionException e = assertThrows(JobExecutionException.class,
                () -> executor.execute(h2Job("UPDATE no_such_table SET x = 1")));

        assertFalse(e.refireImmediately());
        assertTrue(e.getCause() instanceof SQLException);
    }

    @Test
    void unresolvableProviderIsNotRefired() {
        JobDataMap data = h2Job("DELETE FROM audit_log");
        data.put(SqlCommand.PROVIDER_ASSEMBLY_NAME, "com.example.MissingDriver");

        JobExecutionException e = assertThrows(JobExecutionException.class, () -> executor.execute(data));

        assertFalse(e.refireImmediately());
    }

    @Test
    void missingKeyFailsBeforeOpeningAnything() throws Exception {
        JobDataMap data = mockJob("purge_audit", null);
        data.remove(SqlCommand.CONNECTION_CLASS);

        JobExecutionException e = assertThrows(JobExecutionException.class, () -> executor.execute(data));

        assertEquals("connectionClass not specified.", e.getMessage());
        assertFalse(e.refireImmediately());
        verify(mockProvider, never()).open(anyString());
    }

    @Test
    void emptyValueCountsAsMissing() throws Exception {
        JobDataMap data = mockJob("purge_audit", null);
        data.put(SqlCommand.CONNECTION_STRING, "");

        assertThrows(JobExecutionException.class, () -> executor.execute(data));
        verify(mockProvider, never()).open(anyString());
    }

    @Test
    void storedProcedureStyleIsPassedToProvider() throws Exception {
        DbSession session = mock(DbSession.class);
        DbCommand command = mock(DbCommand.class);
        when(mockProvider.open("mock://db")).thenReturn(session);
        when(session.prepare("purge_audit", CommandStyle.STORED_PROCEDURE)).thenReturn(command);
        when(command.executeNonQuery()).thenReturn(7);

        executor.execute(mockJob("purge_audit", "StoredProcedure"));

        verify(session).prepare("purge_audit", CommandStyle.STORED_PROCEDURE);
        verify(command).close();
        verify(session).close();
    }

    @Test
    void anyOtherStyleIsTreatedAsText() throws Exception {
        DbSession session = mock(DbSession.class);
        DbCommand command = mock(DbCommand.class);
        when(mockProvider.open("mock://db")).thenReturn(session);
        when(session.prepare(anyString(), any(CommandStyle.class))).thenReturn(command);

        executor.execute(mockJob("DELETE FROM audit_log", "text"));

        verify(session).prepare("DELETE FROM audit_log", CommandStyle.SQL_TEXT);
    }

    @Test
    void sessionIsClosedWhenCommandFails() throws Exception {
        DbSession session = mock(DbSession.class);
        DbCommand command = mock(DbCommand.class);
        when(mockProvider.open("mock://db")).thenReturn(session);
        when(session.prepare(anyString(), any(CommandStyle.class))).thenReturn(command);
        when(command.executeNonQuery()).thenThrow(new SQLException("deadlock"));

        JobExecutionException e = assertThrows(JobExecutionException.class,
                () -> executor.execute(mockJob("DELETE FROM audit_log", null)));

        assertFalse(e.refireImmediately());
        verify(command).close();
        verify(session).close();
    }

    private JobDataMap h2Job(String sql) {
        SqlCommand command = new SqlCommand(url, sql, "org.h2.Driver", "org.h2.jdbc.JdbcConnection",
                "org.h2.jdbc.JdbcPreparedStatement", "org.h2.jdbc.JdbcResultSet", CommandStyle.SQL_TEXT);
        return new JobDataMap(command.toDataMap());
    }

    private static JobDataMap mockJob(String text, String style) {
        JobDataMap data = new JobDataMap();
        data.put(SqlCommand.CONNECTION_STRING, "mock://db");
        data.put(SqlCommand.NON_QUERY_COMMAND, text);
        data.put(SqlCommand.PROVIDER_ASSEMBLY_NAME, MOCK_PROVIDER);
        data.put(SqlCommand.CONNECTION_CLASS, "MockConnection");
        data.put(SqlCommand.COMMAND_CLASS, "MockCommand");
        data.put(SqlCommand.DATA_ADAPTER_CLASS, "MockAdapter");
        if (style != null) {
            data.put(SqlCommand.COMMAND_STYLE, style);
        }
        return data;
    }
}
