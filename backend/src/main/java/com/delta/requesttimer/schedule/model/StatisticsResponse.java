package com.delta.requesttimer.schedule.model;

import java.util.List;

public record StatisticsResponse(
    List<ScheduleStats> schedules,
    GlobalStatistics summary,
    NotifierStatistics notification
) {
}
