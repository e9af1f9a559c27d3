package com.muts.ecu.store;

import com.muts.ecu.flash.FlashJob;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Flash slice of {@link ApplicationState}: the job currently in progress (if
 * any) and the most recent finished jobs, newest first.
 */
public record FlashState(FlashJob activeJob, List<FlashJob> history)
{
    public FlashState {
        history = history == null ? List.of() : List.copyOf(history);
    }

    public static FlashState empty()
    {
        return new FlashState(null, List.of());
    }

    public Optional<FlashJob> active()
    {
        return Optional.ofNullable(activeJob);
    }

    /**
     * Records a job update. Terminal jobs leave the active slot and are pushed
     * onto the history, which is trimmed to {@code historyLimit}.
     */
    public FlashState withJob(FlashJob job, int historyLimit)
    {
        if (!job.state().isTerminal()) {
            return new FlashState(job, history);
        }
        List<FlashJob> next = new ArrayList<>(historyLimit + 1);
        next.add(job);
        for (FlashJob h : history) {
            if (next.size() >= historyLimit) {
                break;
            }
            if (!h.id().equals(job.id())) {
                next.add(h);
            }
        }
        if (historyLimit == 0) {
            next.clear();
        }
        FlashJob active = activeJob != null && activeJob.id().equals(job.id()) ? null : activeJob;
        return new FlashState(active, next);
    }
}
