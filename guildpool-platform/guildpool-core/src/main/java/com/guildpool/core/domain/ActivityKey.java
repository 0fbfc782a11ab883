package com.guildpool.core.domain;

import java.util.Objects;

/**
 * Identifies one activity instance: the asset it is denominated in and the activity id under that asset.
 * Every group, score, vote and reward is scoped by an activity.
 */
public record ActivityKey(Address asset, long activityId) {

    public ActivityKey {
        Objects.requireNonNull(asset, "Asset cannot be null");
        if (activityId < 0) {
            throw new IllegalArgumentException("Activity id cannot be negative: " + activityId);
        }
    }

    public static ActivityKey of(String asset, long activityId) {
        return new ActivityKey(Address.of(asset), activityId);
    }

    @Override
    public String toString() {
        return asset + "/" + activityId;
    }
}
