package com.delta.requesttimer.schedule.model;

import java.util.List;

public record NotifierStatistics(
    int trackedJobs,
    int openFailureKeys,
    NotificationSettings config,
    List<String> trackedJobIds
) {
}
