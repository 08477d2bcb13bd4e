package com.bko.workouttracker.progress;

import java.io.IOException;
import java.util.List;

public interface GoalStore {
    List<Goal> getForTrainee(String traineeId) throws IOException;
}
