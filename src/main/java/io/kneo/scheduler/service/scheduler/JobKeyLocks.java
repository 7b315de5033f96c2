package io.kneo.scheduler.service.scheduler;

import org.quartz.JobKey;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed set of lock stripes. Look-up-then-create on the same job key always maps to the same stripe.
 */
public class JobKeyLocks {
    private final Lock[] stripes;

    public JobKeyLocks(int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("stripeCount must be positive: " + stripeCount);
        }
        stripes = new Lock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    public Lock forKey(JobKey jobKey) {
        return stripes[Math.floorMod(jobKey.hashCode(), stripes.length)];
    }

    public int size() {
        return stripes.length;
    }
}
