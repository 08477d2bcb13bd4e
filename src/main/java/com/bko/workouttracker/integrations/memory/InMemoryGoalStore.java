package com.bko.workouttracker.integrations.memory;

import com.bko.workouttracker.progress.Goal;
import com.bko.workouttracker.progress.GoalStore;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryGoalStore implements GoalStore {
    private final Map<String, Goal> goals = new ConcurrentHashMap<>();

    public void put(Goal goal) {
        goals.put(goal.id(), goal);
    }

    @Override
    public List<Goal> getForTrainee(String traineeId) {
        return goals.values().stream()
                .filter(goal -> goal.traineeId().equals(traineeId))
                .sorted(Comparator.comparing(Goal::deadline, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }
}
