package io.kneo.scheduler.service.scheduler;

import io.kneo.scheduler.config.SchedulerConfig;
import io.kneo.scheduler.model.Plugin;
import io.kneo.scheduler.model.cnst.JobType;
import io.kneo.scheduler.model.cnst.PluginStatus;
import io.kneo.scheduler.model.job.PluginInvocation;
import io.kneo.scheduler.model.trigger.CronTriggerDescriptor;
import io.kneo.scheduler.model.trigger.SimpleTriggerDescriptor;
import io.kneo.scheduler.model.trigger.TriggerDescriptor;
import io.kneo.scheduler.model.trigger.TriggerDetails;
import io.kneo.scheduler.repository.PluginStore;
import io.kneo.scheduler.service.scheduler.quartz.DispatchingJob;
import io.kneo.scheduler.util.BlockingUni;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.quartz.CronExpression;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.ObjectAlreadyExistsException;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.Lock;

import static org.quartz.CronScheduleBuilder.cronSchedule;
import static org.quartz.JobBuilder.newJob;
import static org.quartz.SimpleScheduleBuilder.simpleSchedule;
import static org.quartz.TriggerBuilder.newTrigger;

/**
 * Translates trigger descriptions into Quartz jobs and triggers and keeps the plugin registry
 * in step with the engine. Engine failures propagate unwrapped; plugin lookups that miss are
 * logged and otherwise ignored.
 */
@ApplicationScoped
public class SchedulerCore {
    private static final Logger LOGGER = LoggerFactory.getLogger(SchedulerCore.class);

    private final Scheduler scheduler;
    private final PluginStore pluginStore;
    private final JobKeyLocks jobKeyLocks;
    private final Clock clock;

    @Inject
    public SchedulerCore(Scheduler scheduler, PluginStore pluginStore, SchedulerConfig config) {
        this(scheduler, pluginStore, new JobKeyLocks(config.getJobLockStripes()), Clock.systemUTC());
    }

    public SchedulerCore(Scheduler scheduler, PluginStore pluginStore, JobKeyLocks jobKeyLocks, Clock clock) {
        this.scheduler = scheduler;
        this.pluginStore = pluginStore;
        this.jobKeyLocks = jobKeyLocks;
        this.clock = clock;
    }

    /**
     * Creates the job when it does not exist yet and attaches the trigger to it. An existing job keeps
     * its data map; a trigger already registered under the same key on that job is replaced. Jobs are
     * stored durably, so they outlive their triggers until removed explicitly.
     *
     * @throws ObjectAlreadyExistsException when the trigger key is already attached to another job
     */
    public void scheduleTrigger(TriggerDescriptor descriptor) throws SchedulerException {
        ScheduleIdentity identity = IdentityResolver.resolve(RequestedIdentity.of(descriptor));
        Instant startAt = IdentityResolver.resolveStartTime(descriptor.getStartDateTime(), clock);
        JobKey jobKey = identity.jobKey();
        TriggerKey triggerKey = identity.triggerKey();

        Lock lock = jobKeyLocks.forKey(jobKey);
        lock.lock();
        try {
            JobDetail jobDetail = scheduler.getJobDetail(jobKey);
            boolean jobExists = jobDetail != null;
            if (!jobExists) {
                jobDetail = buildJob(jobKey, descriptor.getDataMap());
            }
            Trigger trigger = buildTrigger(descriptor, triggerKey, jobKey, startAt);

            if (!jobExists) {
                Trigger existing = scheduler.getTrigger(triggerKey);
                if (existing != null) {
                    throw triggerOwnedElsewhere(triggerKey, existing, jobKey);
                }
                scheduler.scheduleJob(jobDetail, trigger);
                LOGGER.info("Scheduled new job {} with trigger {} starting at {}", jobKey, triggerKey, startAt);
            } else {
                Trigger existing = scheduler.getTrigger(triggerKey);
                if (existing == null) {
                    scheduler.scheduleJob(trigger);
                    LOGGER.info("Attached trigger {} to existing job {} starting at {}", triggerKey, jobKey, startAt);
                } else if (jobKey.equals(existing.getJobKey())) {
                    scheduler.rescheduleJob(triggerKey, trigger);
                    LOGGER.info("Replaced trigger {} of job {} starting at {}", triggerKey, jobKey, startAt);
                } else {
                    throw triggerOwnedElsewhere(triggerKey, existing, jobKey);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    public Uni<Void> executePlugin(String pluginName) {
        return pluginStore.findByName(pluginName)
                .onItem().transformToUni(plugin -> {
                    if (plugin == null) {
                        LOGGER.error("Error getting registered plugin {}", pluginName);
                        return Uni.createFrom().voidItem();
                    }
                    return BlockingUni.run(() -> scheduleOneShot(plugin));
                });
    }

    public Uni<Void> registerPlugin(String pluginName, String assemblyPath) {
        requireNonBlank(pluginName, "pluginName");
        if (!artifactExists(assemblyPath)) {
            LOGGER.error("Error registering plugin {}. Invalid assembly path {}", pluginName, assemblyPath);
            return Uni.createFrom().voidItem();
        }
        return pluginStore.upsert(new Plugin(pluginName, assemblyPath, PluginStatus.REGISTERED))
                .onItem().invoke(() -> LOGGER.info("Registered plugin {} at {}", pluginName, assemblyPath));
    }

    public Uni<Void> removePlugin(String pluginName) {
        return BlockingUni.run(() -> removeJobGroup(pluginName))
                .chain(() -> pluginStore.remove(pluginName))
                .onItem().invoke(count -> {
                    if (count == 0) {
                        LOGGER.warn("Error removing from data store. Plugin {} not found", pluginName);
                    } else {
                        LOGGER.info("Removed plugin {}", pluginName);
                    }
                })
                .replaceWithVoid();
    }

    public void removeJobGroup(String groupName) throws SchedulerException {
        requireNonBlank(groupName, "groupName");
        Set<JobKey> jobKeys = scheduler.getJobKeys(GroupMatcher.jobGroupEquals(groupName));
        if (jobKeys.isEmpty()) {
            LOGGER.debug("No jobs in group {}", groupName);
            return;
        }
        scheduler.deleteJobs(new ArrayList<>(jobKeys));
        LOGGER.info("Deleted {} job(s) of group {}", jobKeys.size(), groupName);
    }

    /**
     * Deletes the named job. Without a group every job group is searched and each match is deleted.
     */
    public void removeJob(String jobName, String jobGroup) throws SchedulerException {
        requireNonBlank(jobName, "jobName");
        List<String> jobGroups = IdentityResolver.isBlank(jobGroup) ? scheduler.getJobGroupNames() : List.of(jobGroup);
        for (String group : jobGroups) {
            JobKey jobKey = new JobKey(jobName, group);
            if (scheduler.checkExists(jobKey)) {
                scheduler.deleteJob(jobKey);
                LOGGER.info("Deleted job {}", jobKey);
            }
        }
    }

    public void removeTriggerGroup(String groupName) throws SchedulerException {
        requireNonBlank(groupName, "groupName");
        Set<TriggerKey> triggerKeys = scheduler.getTriggerKeys(GroupMatcher.triggerGroupEquals(groupName));
        if (triggerKeys.isEmpty()) {
            LOGGER.debug("No triggers in group {}", groupName);
            return;
        }
        scheduler.unscheduleJobs(new ArrayList<>(triggerKeys));
        LOGGER.info("Unscheduled {} trigger(s) of group {}", triggerKeys.size(), groupName);
    }

    public void removeTrigger(String triggerName, String triggerGroup) throws SchedulerException {
        requireNonBlank(triggerName, "triggerName");
        List<String> triggerGroups = IdentityResolver.isBlank(triggerGroup) ? scheduler.getTriggerGroupNames() : List.of(triggerGroup);
        for (String group : triggerGroups) {
            TriggerKey triggerKey = new TriggerKey(triggerName, group);
            if (scheduler.checkExists(triggerKey)) {
                scheduler.unscheduleJob(triggerKey);
                LOGGER.info("Unscheduled trigger {}", triggerKey);
            }
        }
    }

    public List<TriggerDetails> getTriggerDetails(String jobName, String jobGroup) throws SchedulerException {
        requireNonBlank(jobName, "jobName");
        requireNonBlank(jobGroup, "jobGroup");
        List<TriggerDetails> details = new ArrayList<>();
        for (Trigger trigger : scheduler.getTriggersOfJob(new JobKey(jobName, jobGroup))) {
            details.add(TriggerDetails.from(trigger));
        }
        return details;
    }

    private void scheduleOneShot(Plugin plugin) throws SchedulerException {
        ScheduleIdentity identity = IdentityResolver.resolve(RequestedIdentity.anonymous());
        JobDetail jobDetail = newJob(DispatchingJob.class)
                .withIdentity(identity.jobKey())
                .storeDurably(false)
                .usingJobData(PluginInvocation.PLUGIN_PATH, plugin.getAssemblyPath())
                .usingJobData(JobType.DATA_KEY, JobType.PLUGIN.name())
                .build();
        Trigger trigger = newTrigger()
                .withIdentity(identity.triggerKey())
                .forJob(jobDetail)
                .startNow()
                .withSchedule(simpleSchedule().withRepeatCount(0))
                .build();
        scheduler.scheduleJob(jobDetail, trigger);
        LOGGER.info("Plugin {} queued for immediate execution as job {}", plugin.getName(), identity.jobKey());
    }

    private static ObjectAlreadyExistsException triggerOwnedElsewhere(TriggerKey triggerKey, Trigger existing, JobKey jobKey) {
        LOGGER.error("Trigger {} already belongs to job {}, refusing to attach it to {}",
                triggerKey, existing.getJobKey(), jobKey);
        return new ObjectAlreadyExistsException("Trigger " + triggerKey + " already exists on job " + existing.getJobKey());
    }

    private JobDetail buildJob(JobKey jobKey, Map<String, Object> dataMap) {
        JobType jobType = JobType.resolve(dataMap);
        JobDataMap jobDataMap = new JobDataMap(dataMap);
        jobDataMap.put(JobType.DATA_KEY, jobType.name());
        return newJob(DispatchingJob.class)
                .withIdentity(jobKey)
                .storeDurably(true)
                .usingJobData(jobDataMap)
                .build();
    }

    private Trigger buildTrigger(TriggerDescriptor descriptor, TriggerKey triggerKey, JobKey jobKey, Instant startAt) {
        TriggerBuilder<Trigger> builder = newTrigger()
                .withIdentity(triggerKey)
                .forJob(jobKey)
                .startAt(Date.from(startAt));

        if (descriptor instanceof CronTriggerDescriptor cronTrigger) {
            String expression = cronTrigger.getCronExpression();
            if (IdentityResolver.isBlank(expression) || !CronExpression.isValidExpression(expression)) {
                throw new IllegalArgumentException("Invalid cron expression: " + expression);
            }
            return builder.withSchedule(cronSchedule(expression)).build();
        }
        if (descriptor instanceof SimpleTriggerDescriptor simpleTrigger) {
            if (simpleTrigger.getRepeatCount() < SimpleTriggerDescriptor.REPEAT_FOREVER) {
                throw new IllegalArgumentException("repeatCount must be -1 or greater: " + simpleTrigger.getRepeatCount());
            }
            Duration interval = simpleTrigger.getRepeatInterval() != null ? simpleTrigger.getRepeatInterval() : Duration.ZERO;
            if (interval.isNegative()) {
                throw new IllegalArgumentException("repeatInterval must not be negative: " + interval);
            }
            if (simpleTrigger.getRepeatCount() != 0 && interval.toMillis() < 1) {
                throw new IllegalArgumentException("repeatInterval is required when repeatCount is " + simpleTrigger.getRepeatCount());
            }
            return builder.withSchedule(simpleSchedule()
                            .withIntervalInMilliseconds(interval.toMillis())
                            .withRepeatCount(simpleTrigger.getRepeatCount()))
                    .build();
        }
        throw new IllegalArgumentException("Unsupported trigger type: " + descriptor.getClass().getSimpleName());
    }

    private static boolean artifactExists(String assemblyPath) {
        if (IdentityResolver.isBlank(assemblyPath)) {
            return false;
        }
        try {
            return Files.isRegularFile(Path.of(assemblyPath));
        } catch (InvalidPathException e) {
            LOGGER.debug("Unparseable assembly path {}", assemblyPath, e);
            return false;
        }
    }

    private static void requireNonBlank(String value, String argument) {
        if (IdentityResolver.isBlank(value)) {
            throw new IllegalArgumentException(argument + " is null or empty.");
        }
    }
}
