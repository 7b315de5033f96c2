package io.kneo.scheduler.repository;

import io.kneo.scheduler.model.Plugin;
import io.smallrye.mutiny.Uni;

import java.util.List;

/**
 * Registry of plugin artifacts keyed by plugin name. A lookup miss yields a null item, never a failure.
 */
public interface PluginStore {

    Uni<Plugin> findByName(String name);

    Uni<List<Plugin>> getAll();

    Uni<Void> upsert(Plugin plugin);

    Uni<Integer> remove(String name);
}
