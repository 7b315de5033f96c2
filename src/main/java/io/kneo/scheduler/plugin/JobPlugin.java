package io.kneo.scheduler.plugin;

/**
 * Contract a plugin JAR implements. Implementations are listed in
 * {@code META-INF/services/io.kneo.scheduler.plugin.JobPlugin} inside the JAR and need a public
 * no-argument constructor.
 */
public interface JobPlugin {

    String getName();

    void execute() throws Exception;
}
