package io.kneo.scheduler.repository;

import io.kneo.scheduler.config.SchedulerConfig;
import io.kneo.scheduler.model.Plugin;
import io.kneo.scheduler.model.cnst.PluginStatus;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.pgclient.PgPool;
import io.vertx.mutiny.sqlclient.Row;
import io.vertx.mutiny.sqlclient.RowSet;
import io.vertx.mutiny.sqlclient.SqlResult;
import io.vertx.mutiny.sqlclient.Tuple;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

@ApplicationScoped
public class PluginRepository implements PluginStore {

    private final PgPool client;
    private final String tableName;

    @Inject
    public PluginRepository(PgPool client, SchedulerConfig config) {
        this.client = client;
        this.tableName = config.getPluginTable();
    }

    public Uni<Void> createTableIfAbsent() {
        String sql = "CREATE TABLE IF NOT EXISTS " + tableName + " (" +
                "name VARCHAR(255) PRIMARY KEY, " +
                "assembly_path TEXT NOT NULL, " +
                "status VARCHAR(32) NOT NULL, " +
                "reg_date TIMESTAMP NOT NULL)";
        return client.query(sql)
                .execute()
                .replaceWithVoid();
    }

    @Override
    public Uni<Plugin> findByName(String name) {
        String sql = "SELECT * FROM " + tableName + " WHERE name = $1";
        return client.preparedQuery(sql)
                .execute(Tuple.of(name))
                .onItem().transform(RowSet::iterator)
                .onItem().transform(iterator -> iterator.hasNext() ? from(iterator.next()) : null);
    }

    @Override
    public Uni<List<Plugin>> getAll() {
        String sql = "SELECT * FROM " + tableName + " ORDER BY name";
        return client.query(sql)
                .execute()
                .onItem().transformToMulti(rows -> Multi.createFrom().iterable(rows))
                .onItem().transform(this::from)
                .collect().asList();
    }

    @Override
    public Uni<Void> upsert(Plugin plugin) {
        String sql = "INSERT INTO " + tableName + " (name, assembly_path, status, reg_date) " +
                "VALUES ($1, $2, $3, $4) " +
                "ON CONFLICT (name) DO UPDATE SET assembly_path = EXCLUDED.assembly_path, status = EXCLUDED.status";
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        return client.preparedQuery(sql)
                .execute(Tuple.of(plugin.getName(), plugin.getAssemblyPath(), plugin.getStatus().name(), now))
                .replaceWithVoid();
    }

    @Override
    public Uni<Integer> remove(String name) {
        String sql = "DELETE FROM " + tableName + " WHERE name = $1";
        return client.preparedQuery(sql)
                .execute(Tuple.of(name))
                .onItem().transform(SqlResult::rowCount);
    }

    private Plugin from(Row row) {
        return new Plugin(
                row.getString("name"),
                row.getString("assembly_path"),
                PluginStatus.valueOf(row.getString("status")),
                row.getLocalDateTime("reg_date"));
    }
}
