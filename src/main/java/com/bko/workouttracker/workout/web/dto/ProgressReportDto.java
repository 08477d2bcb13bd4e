package com.bko.workouttracker.workout.web.dto;

import com.bko.workouttracker.workout.history.ExerciseProgressComparison;
import com.bko.workouttracker.workout.history.TrainingProgressReport;

import java.util.List;

public record ProgressReportDto(
        String trainingId,
        String trainingName,
        String summary,
        double improvementPercentage,
        double totalVolumeIncrease,
        List<ExerciseProgressDto> exercises
) {
    public record ExerciseProgressDto(
            String exerciseName,
            double weightProgress,
            int repsProgress,
            double volumeProgress,
            double weightProgressPercentage,
            boolean improved,
            String description
    ) { }

    public static ProgressReportDto from(TrainingProgressReport report) {
        List<ExerciseProgressDto> exercises = report.comparisons().stream()
                .map(ProgressReportDto::toDto)
                .toList();
        return new ProgressReportDto(
                report.trainingId(),
                report.trainingName(),
                report.summary(),
                report.improvementPercentage(),
                report.totalVolumeIncrease(),
                exercises
        );
    }

    private static ExerciseProgressDto toDto(ExerciseProgressComparison comparison) {
        return new ExerciseProgressDto(
                comparison.exerciseName(),
                comparison.weightProgress(),
                comparison.repsProgress(),
                comparison.volumeProgress(),
                comparison.weightProgressPercentage(),
                comparison.hasImproved(),
                comparison.description()
        );
    }
}
