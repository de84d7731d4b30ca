package com.herzen.tutor.query;

import com.herzen.tutor.repository.ConversationJdbcRepository.ActiveStudent;
import com.herzen.tutor.repository.ConversationJdbcRepository.DailyActivity;

import java.util.List;

public class QueryModels {
    public record PlatformStats(long totalStudents,
                                long totalTurns,
                                long activeStudentsToday,
                                long activeStudentsLast7Days,
                                long unreviewedFlags,
                                double avgTurnsPerActiveStudent,
                                List<DailyActivity> dailyActivity,
                                List<ActiveStudent> topStudents) {}
}
