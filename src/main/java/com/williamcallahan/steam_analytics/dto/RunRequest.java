package com.williamcallahan.steam_analytics.dto;

import com.williamcallahan.steam_analytics.types.RunType;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Entry-point arguments for a pipeline run.
 *
 * @param runType which sources to refresh
 * @param appIds  explicit entity keys; empty means discover through the metadata source
 * @param trigger free-form origin label for logs (scheduler, cli, ...)
 */
public record RunRequest(RunType runType, List<Long> appIds, String trigger) {

    public RunRequest {
        runType = runType == null ? RunType.FULL : runType;
        TreeSet<Long> keys = new TreeSet<>();
        if (appIds != null) {
            for (Long appId : appIds) {
                if (appId == null || appId <= 0) {
                    throw new IllegalArgumentException("Steam appid must be a positive integer: " + appId);
                }
                keys.add(appId);
            }
        }
        appIds = List.copyOf(keys);
        trigger = trigger == null || trigger.isBlank() ? "manual" : trigger;
    }

    public static RunRequest of(RunType runType, String trigger) {
        return new RunRequest(runType, List.of(), trigger);
    }

    public static RunRequest forAppIds(RunType runType, Collection<Long> appIds, String trigger) {
        return new RunRequest(runType, appIds == null ? List.of() : List.copyOf(appIds), trigger);
    }

    public boolean hasExplicitAppIds() {
        return !appIds.isEmpty();
    }
}
