package io.kneo.scheduler.service.plugin;

import io.kneo.scheduler.model.job.PluginInvocation;
import io.kneo.scheduler.plugin.JobPlugin;
import io.kneo.scheduler.service.exceptions.PluginExecutionException;
import jakarta.enterprise.context.ApplicationScoped;
import org.quartz.JobExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Loads a plugin JAR in its own class loader and runs every {@link JobPlugin} the JAR declares.
 * Only declarations inside the JAR itself count, never ones inherited from the parent class path.
 */
@ApplicationScoped
public class PluginRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(PluginRunner.class);

    public void run(PluginInvocation invocation) throws JobExecutionException {
        String pluginPath = invocation.pluginPath();
        if (pluginPath == null || pluginPath.isBlank()) {
            LOGGER.error("Error in PluginRunner: {} not specified.", PluginInvocation.PLUGIN_PATH);
            throw new JobExecutionException(PluginInvocation.PLUGIN_PATH + " not specified.", false);
        }
        try {
            int executed = execute(Path.of(pluginPath));
            LOGGER.info("Executed {} plugin(s) from {}", executed, pluginPath);
        } catch (PluginExecutionException | InvalidPathException e) {
            LOGGER.error("Error in PluginRunner for {}", pluginPath, e);
            throw new JobExecutionException(e.getMessage(), e, false);
        }
    }

    int execute(Path artifact) throws PluginExecutionException {
        if (!Files.isRegularFile(artifact)) {
            throw new PluginExecutionException("Plugin artifact not found: " + artifact);
        }
        try (URLClassLoader loader = new URLClassLoader(new URL[]{artifact.toUri().toURL()}, JobPlugin.class.getClassLoader())) {
            List<ServiceLoader.Provider<JobPlugin>> providers = declaredPlugins(loader, artifact);
            if (providers.isEmpty()) {
                throw new PluginExecutionException("No " + JobPlugin.class.getSimpleName() + " declared in " + artifact);
            }
            for (ServiceLoader.Provider<JobPlugin> provider : providers) {
                JobPlugin plugin = instantiate(provider);
                LOGGER.debug("Running plugin {} ({})", plugin.getName(), provider.type().getName());
                try {
                    plugin.execute();
                } catch (Exception e) {
                    throw new PluginExecutionException("Plugin " + plugin.getName() + " failed: " + e.getMessage(), e);
                }
            }
            return providers.size();
        } catch (IOException e) {
            throw new PluginExecutionException("Unable to read plugin artifact " + artifact, e);
        }
    }

    /**
     * Providers whose class was defined by the plugin's own loader. A declared name that resolves
     * to a host class is skipped.
     */
    private List<ServiceLoader.Provider<JobPlugin>> declaredPlugins(URLClassLoader loader, Path artifact)
            throws PluginExecutionException {
        try {
            return ServiceLoader.load(JobPlugin.class, loader).stream()
                    .filter(provider -> {
                        boolean own = provider.type().getClassLoader() == loader;
                        if (!own) {
                            LOGGER.warn("Skipping {} declared by {}: not defined in the artifact",
                                    provider.type().getName(), artifact);
                        }
                        return own;
                    })
                    .toList();
        } catch (ServiceConfigurationError e) {
            throw new PluginExecutionException("Invalid plugin declaration in " + artifact + ": " + e.getMessage(), e);
        }
    }

    private JobPlugin instantiate(ServiceLoader.Provider<JobPlugin> provider) throws PluginExecutionException {
        try {
            return provider.get();
        } catch (ServiceConfigurationError e) {
            throw new PluginExecutionException("Unable to instantiate plugin " + provider.type().getName(), e);
        }
    }
}
