package io.kneo.scheduler.model.job;

import io.kneo.scheduler.model.cnst.JobType;

import java.util.Map;

public interface JobBody {

    JobType type();

    Map<String, Object> toDataMap();
}
