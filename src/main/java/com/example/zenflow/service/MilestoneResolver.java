package com.example.zenflow.service;

import com.example.zenflow.model.GrowthStage;
import com.example.zenflow.model.MilestoneThreshold;
import com.example.zenflow.model.StageResolution;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Maps total minutes to a growth stage over a fixed, ascending threshold table.
 * Writer and reader resolve identically because the result depends only on the minutes and the table.
 */
@Component
public class MilestoneResolver {

    private final List<MilestoneThreshold> thresholds;

    @Autowired
    public MilestoneResolver() {
        this(GrowthStage.defaultTable());
    }

    public MilestoneResolver(List<MilestoneThreshold> thresholds) {
        if (thresholds == null || thresholds.isEmpty()) {
            throw new IllegalArgumentException("Threshold table must not be empty");
        }
        if (thresholds.get(0).getMinMinutes() != 0) {
            throw new IllegalArgumentException("First threshold must start at 0 minutes");
        }
        for (int i = 1; i < thresholds.size(); i++) {
            if (thresholds.get(i).getMinMinutes() <= thresholds.get(i - 1).getMinMinutes()) {
                throw new IllegalArgumentException("Thresholds must be strictly increasing, found "
                        + thresholds.get(i - 1).getMinMinutes() + " then " + thresholds.get(i).getMinMinutes());
            }
        }
        this.thresholds = List.copyOf(thresholds);
    }

    public StageResolution resolve(int totalMinutes) {
        int minutes = Math.max(0, totalMinutes);
        int index = 0;
        for (int i = 0; i < thresholds.size(); i++) {
            if (thresholds.get(i).getMinMinutes() <= minutes) {
                index = i;
            } else {
                break;
            }
        }
        MilestoneThreshold current = thresholds.get(index);
        if (index == thresholds.size() - 1) {
            return new StageResolution(current.getStageName(), current.getIconToken(), null, 1.0);
        }
        MilestoneThreshold next = thresholds.get(index + 1);
        double fraction = (double) (minutes - current.getMinMinutes())
                / (double) (next.getMinMinutes() - current.getMinMinutes());
        return new StageResolution(current.getStageName(), current.getIconToken(), next.getMinMinutes(),
                Math.min(1.0, Math.max(0.0, fraction)));
    }

    public List<MilestoneThreshold> getThresholds() {
        return thresholds;
    }
}
